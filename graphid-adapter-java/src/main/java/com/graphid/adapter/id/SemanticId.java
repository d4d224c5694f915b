package com.graphid.adapter.id;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Composes and parses semantic node IDs following the convention:
 *   file->TYPE->name                            (top-level, no collision)
 *   file->TYPE->name[in:parent]                 (nested, no collision)
 *   file->TYPE->name[in:parent,h:xxxx]          (collision, content hash disambiguates)
 *   file->TYPE->name[in:parent,h:xxxx]#N        (identical content, counter disambiguates)
 *
 * Pseudo-nodes that live outside any file:
 *   net:stdio->__stdio__
 *   net:request->__network__
 *   EXTERNAL_MODULE->java.util
 *
 * The separators are part of the graph contract; downstream queries match on them.
 */
public final class SemanticId {

    public static final String SEPARATOR = "->";
    public static final String PARENT_KEY = "in:";
    public static final String HASH_KEY = "h:";

    public static final String STDIO_PREFIX = "net:stdio";
    public static final String NETWORK_PREFIX = "net:request";
    public static final String EXTERNAL_MODULE_PREFIX = "EXTERNAL_MODULE";

    public static final String SINGLETON_TYPE = "SINGLETON";
    public static final String EXTERNAL_MODULE_TYPE = "EXTERNAL_MODULE";

    private SemanticId() {}

    public static String compose(String type, String name, String file) {
        return compose(type, name, file, null, null, null);
    }

    public static String compose(String type, String name, String file, String namedParent) {
        return compose(type, name, file, namedParent, null, null);
    }

    /**
     * Builds an ID from its parts. {@code namedParent}, {@code contentHash} and {@code counter}
     * may be null; a counter of 0 is omitted.
     *
     * @throws IllegalArgumentException if a positive counter is given without a parent or hash,
     *         since the counter could not be told apart from the name when parsed back
     */
    public static String compose(String type, String name, String file,
                                 String namedParent, String contentHash, Integer counter) {
        List<String> brackets = new ArrayList<>(2);
        if (namedParent != null && !namedParent.isEmpty()) brackets.add(PARENT_KEY + namedParent);
        if (contentHash != null && !contentHash.isEmpty()) brackets.add(HASH_KEY + contentHash);

        StringBuilder id = new StringBuilder(file.length() + type.length() + name.length() + 24)
                .append(file).append(SEPARATOR)
                .append(type).append(SEPARATOR)
                .append(name);
        if (!brackets.isEmpty()) {
            id.append('[').append(String.join(",", brackets)).append(']');
        }
        if (counter != null && counter > 0) {
            if (brackets.isEmpty()) {
                throw new IllegalArgumentException("Counter requires a named parent or content hash: " + id);
            }
            id.append('#').append(counter);
        }
        return id.toString();
    }

    public static String compose(ParsedSemanticId parts) {
        return compose(parts.type(), parts.name(), parts.file(),
                parts.namedParent(), parts.contentHash(), parts.counter());
    }

    /**
     * Merges a content hash into an already composed base ID: {@code ,h:xxxx} goes before the
     * closing bracket if there is one, otherwise {@code [h:xxxx]} is appended.
     */
    public static String withContentHash(String baseId, String contentHash) {
        if (baseId.endsWith("]")) {
            return baseId.substring(0, baseId.length() - 1) + "," + HASH_KEY + contentHash + "]";
        }
        return baseId + "[" + HASH_KEY + contentHash + "]";
    }

    /**
     * Parses an ID back into its parts. Returns empty for anything that does not follow the
     * grammar, including legacy IDs that still carry a scope path.
     */
    public static Optional<ParsedSemanticId> parse(String id) {
        if (id == null || id.isEmpty()) return Optional.empty();

        if (id.startsWith(STDIO_PREFIX) || id.startsWith(NETWORK_PREFIX)) {
            return pseudoNode(id, SINGLETON_TYPE);
        }
        if (id.startsWith(EXTERNAL_MODULE_PREFIX)) {
            return pseudoNode(id, EXTERNAL_MODULE_TYPE);
        }

        int firstArrow = id.indexOf(SEPARATOR);
        if (firstArrow == -1) return Optional.empty();
        int secondArrow = id.indexOf(SEPARATOR, firstArrow + SEPARATOR.length());
        if (secondArrow == -1) return Optional.empty();

        String file = id.substring(0, firstArrow);
        String type = id.substring(firstArrow + SEPARATOR.length(), secondArrow);
        String rest = id.substring(secondArrow + SEPARATOR.length());
        if (rest.contains(SEPARATOR) || rest.isEmpty()) return Optional.empty();

        Integer counter = null;
        int hashMark = rest.lastIndexOf('#');
        if (hashMark > 0 && rest.charAt(hashMark - 1) == ']' && isDigits(rest, hashMark + 1)) {
            counter = Integer.parseInt(rest.substring(hashMark + 1));
            rest = rest.substring(0, hashMark);
        }

        String name = rest;
        String namedParent = null;
        String contentHash = null;
        int bracketStart = rest.indexOf('[');
        if (bracketStart > 0 && rest.endsWith("]")) {
            name = rest.substring(0, bracketStart);
            String content = rest.substring(bracketStart + 1, rest.length() - 1);
            for (String part : content.split(",")) {
                if (part.startsWith(PARENT_KEY)) {
                    namedParent = part.substring(PARENT_KEY.length());
                } else if (part.startsWith(HASH_KEY)) {
                    contentHash = part.substring(HASH_KEY.length());
                }
            }
        } else if (counter != null) {
            return Optional.empty();
        }

        return Optional.of(new ParsedSemanticId(file, type, name, namedParent, contentHash, counter));
    }

    /** The process-wide standard streams pseudo-node. */
    public static String stdio() {
        return STDIO_PREFIX + SEPARATOR + "__stdio__";
    }

    /** The process-wide network pseudo-node. */
    public static String network() {
        return NETWORK_PREFIX + SEPARATOR + "__network__";
    }

    public static String externalModule(String packageName) {
        return EXTERNAL_MODULE_PREFIX + SEPARATOR + packageName;
    }

    public static boolean isPseudoNode(String id) {
        return id.startsWith(STDIO_PREFIX) || id.startsWith(NETWORK_PREFIX)
                || id.startsWith(EXTERNAL_MODULE_PREFIX);
    }

    private static Optional<ParsedSemanticId> pseudoNode(String id, String type) {
        int arrow = id.indexOf(SEPARATOR);
        if (arrow == -1) return Optional.empty();
        return Optional.of(new ParsedSemanticId("", type, id.substring(arrow + SEPARATOR.length()), null, null, null));
    }

    private static boolean isDigits(String s, int from) {
        if (from >= s.length()) return false;
        for (int i = from; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < '0' || c > '9') return false;
        }
        return true;
    }
}
