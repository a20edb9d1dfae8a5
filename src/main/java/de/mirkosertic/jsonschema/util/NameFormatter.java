package de.mirkosertic.jsonschema.util;

/**
 * Formatting of definition names.
 */
public final class NameFormatter {

    private NameFormatter() {
        // Utility class, no instances
    }

    /**
     * Converts a name to upper camel case. Letters following a separator ({@code -}, {@code _},
     * {@code .}, {@code $}, whitespace) are capitalized and the separators are dropped. Brackets and
     * commas of generic argument lists are kept and also start a new word.
     *
     * @param name the name to convert (may be null)
     * @return camel cased name, or the input if it was null or empty
     */
    public static String toCamel(final String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }

        final StringBuilder result = new StringBuilder(name.length());
        boolean upperNext = true;
        for (int i = 0; i < name.length(); i++) {
            final char c = name.charAt(i);
            if (c == '[' || c == ']' || c == ',') {
                result.append(c);
                upperNext = true;
            } else if (!Character.isLetterOrDigit(c)) {
                upperNext = true;
            } else if (upperNext) {
                result.append(Character.toUpperCase(c));
                upperNext = false;
            } else {
                result.append(c);
            }
        }
        return result.toString();
    }

    /**
     * Last segment of a dotted package name, the empty string for the unnamed package.
     */
    public static String packageBaseName(final String packageName) {
        final int index = packageName.lastIndexOf('.');
        return index < 0 ? packageName : packageName.substring(index + 1);
    }
}
