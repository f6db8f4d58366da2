package io.watson.core;

/**
 * A validated stack identifier of the form {@code <namespace>/<name>}.
 *
 * @param namespace the project part, never empty
 * @param name the stack part, never empty
 */
public record StackName(String namespace, String name) {
    static final char SEPARATOR = '/';

    public StackName {
        if (!isValidPart(namespace) || !isValidPart(name)) {
            throw new WatsonException.InvalidStackName(namespace + SEPARATOR + name);
        }
    }

    /**
     * Parses {@code value}, which must contain exactly one {@code /} with non-empty text on both sides.
     *
     * @throws WatsonException.InvalidStackName if the value has any other shape
     */
    public static StackName parse(String value) {
        if (value == null) {
            throw new WatsonException.InvalidStackName(null);
        }
        int idx = value.indexOf(SEPARATOR);
        if (idx <= 0 || idx == value.length() - 1 || value.indexOf(SEPARATOR, idx + 1) >= 0) {
            throw new WatsonException.InvalidStackName(value);
        }
        return new StackName(value.substring(0, idx), value.substring(idx + 1));
    }

    public static boolean isValid(String value) {
        try {
            parse(value);
            return true;
        } catch (WatsonException.InvalidStackName e) {
            return false;
        }
    }

    private static boolean isValidPart(String part) {
        return part != null && !part.isEmpty() && part.indexOf(SEPARATOR) < 0;
    }

    /** The canonical {@code namespace/name} form. */
    public String value() {
        return namespace + SEPARATOR + name;
    }

    @Override
    public String toString() {
        return value();
    }
}
