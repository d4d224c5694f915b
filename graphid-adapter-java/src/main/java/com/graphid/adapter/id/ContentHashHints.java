package com.graphid.adapter.id;

/**
 * Structural data about a node, used only to compute a disambiguating content hash.
 * Every field is optional; each node type fills in the ones that tell its siblings apart.
 */
public record ContentHashHints(
    Integer arity,            // argument count (calls), parameter count or index (declarations)
    String firstLiteralArg,   // first literal argument of a call
    String firstParamName,    // first parameter name of a callable
    String rhsType,           // initializer category of a variable
    String rhsToken,          // first significant token of the initializer
    String objectChain,       // receiver chain of a property access
    String declaredType,      // declared type of a variable or parameter
    String signature          // parameter types of a callable, comma-joined
) {
    public static final ContentHashHints EMPTY = builder().build();

    public static Builder builder() {
        return new Builder();
    }

    public boolean isEmpty() {
        return arity == null && firstLiteralArg == null && firstParamName == null
                && rhsType == null && rhsToken == null && objectChain == null
                && declaredType == null && signature == null;
    }

    public static final class Builder {
        private Integer arity;
        private String firstLiteralArg;
        private String firstParamName;
        private String rhsType;
        private String rhsToken;
        private String objectChain;
        private String declaredType;
        private String signature;

        private Builder() {}

        public Builder arity(Integer arity) { this.arity = arity; return this; }
        public Builder firstLiteralArg(String v) { this.firstLiteralArg = v; return this; }
        public Builder firstParamName(String v) { this.firstParamName = v; return this; }
        public Builder rhsType(String v) { this.rhsType = v; return this; }
        public Builder rhsToken(String v) { this.rhsToken = v; return this; }
        public Builder objectChain(String v) { this.objectChain = v; return this; }
        public Builder declaredType(String v) { this.declaredType = v; return this; }
        public Builder signature(String v) { this.signature = v; return this; }

        public ContentHashHints build() {
            return new ContentHashHints(arity, firstLiteralArg, firstParamName,
                    rhsType, rhsToken, objectChain, declaredType, signature);
        }
    }
}
