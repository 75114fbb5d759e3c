package com.sqlweave.generator;

/**
 * Escaping of string literals.
 *
 * <p>The literal is wrapped in single quotes and every character in the set
 * {NUL, {@code \n}, {@code \r}, {@code \\}, {@code '}, {@code "}, 0x1A} is
 * preceded by a backslash. Nothing else is altered, so un-escaping (dropping
 * each backslash and keeping the character after it) restores the input.
 *
 * <p>Example usage:
 * <pre>
 *   SQLQuoting.quoteString("O'Reilly");   // 'O\'Reilly'
 *   SQLQuoting.quoteString("");           // ''
 * </pre>
 *
 * <p>Identifier quoting is dialect specific and lives in
 * {@link com.sqlweave.scope.Dialect}.
 */
public final class SQLQuoting {

    // indexed by char value; only ASCII control/quote characters are flagged
    private static final boolean[] NEEDS_ESCAPE = new boolean[256];

    static {
        for (char c : new char[] {'\0', '\n', '\r', '\\', '\'', '"', '\u001a'}) {
            NEEDS_ESCAPE[c] = true;
        }
    }

    private SQLQuoting() {}

    /**
     * Quotes a string literal value.
     *
     * @param value the string value to quote (must not be null)
     * @return quoted literal safe for SQL
     */
    public static String quoteString(String value) {
        if (value.isEmpty()) {
            return "''";
        }

        StringBuilder sb = new StringBuilder(value.length() * 2 + 2);
        sb.append('\'');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (needsEscape(c)) {
                sb.append('\\');
            }
            sb.append(c);
        }
        sb.append('\'');
        return sb.toString();
    }

    /**
     * Returns whether a character is backslash-escaped inside a literal.
     *
     * @param c the character
     * @return true if escaped
     */
    public static boolean needsEscape(char c) {
        return c < NEEDS_ESCAPE.length && NEEDS_ESCAPE[c];
    }
}
