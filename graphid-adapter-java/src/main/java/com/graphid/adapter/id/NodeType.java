package com.graphid.adapter.id;

/**
 * Type tags that appear in the TYPE segment of an ID, together with the uniqueness guarantee
 * Java gives for each. The guarantee decides whether {@link IdGenerator} can hand out a final ID
 * on the spot or has to defer it to {@link CollisionResolver}.
 */
public enum NodeType {

    /** One per compilation unit. */
    MODULE(Uniqueness.PER_FILE),

    /**
     * Top-level type names are unique per compilation unit. Member and local types are not:
     * {@code A.Builder.X} and {@code B.Builder.X} share both name and named parent.
     */
    CLASS(Uniqueness.TOP_LEVEL),
    INTERFACE(Uniqueness.TOP_LEVEL),
    ENUM(Uniqueness.TOP_LEVEL),

    /** Methods and constructors; overloads share a name. */
    FUNCTION(Uniqueness.NONE),

    /** Overloads share the parent name, sibling lambdas and catch clauses repeat names. */
    PARAMETER(Uniqueness.NONE),

    /** Fields, enum constants and locals; sibling blocks may reuse local names. */
    VARIABLE(Uniqueness.NONE),
    CONSTANT(Uniqueness.NONE),

    /**
     * Anonymous block markers. Named by kind only ({@code if}, {@code for}), so their identity
     * is the content hash of the block header.
     */
    SCOPE(Uniqueness.CONTENT),

    CALL(Uniqueness.NONE),
    METHOD_CALL(Uniqueness.NONE),
    PROPERTY_ACCESS(Uniqueness.NONE);

    public enum Uniqueness {
        /** At most one node of this type per file. */
        PER_FILE,
        /** Unique when declared at file top level, collision-prone anywhere else. */
        TOP_LEVEL,
        /** May legitimately repeat under the same named parent. */
        NONE,
        /** Always carries its content hash; a counter only separates identical content. */
        CONTENT
    }

    private final Uniqueness uniqueness;

    NodeType(Uniqueness uniqueness) {
        this.uniqueness = uniqueness;
    }

    public Uniqueness uniqueness() {
        return uniqueness;
    }

    public boolean isDeclaration() {
        return this == VARIABLE || this == CONSTANT || this == PARAMETER;
    }
}
