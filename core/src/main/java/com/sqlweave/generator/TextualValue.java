package com.sqlweave.generator;

/**
 * Extension point for application types that can be written as SQL text.
 *
 * <p>The marshaller renders {@link #toSqlText()} as a quoted, escaped string
 * literal. Types that implement neither this interface nor any of the
 * recognized value types are rejected with
 * {@link com.sqlweave.exception.UnsupportedValueException}.
 *
 * <p>Example:
 * <pre>
 *   record Email(String address) implements TextualValue {
 *       public String toSqlText() { return address; }
 *   }
 *   users.column("email").equalTo(new Email("a@b.c"))   -- `email` = 'a@b.c'
 * </pre>
 */
@FunctionalInterface
public interface TextualValue {

    /**
     * Returns the textual representation to embed as a string literal.
     *
     * @return the text (must not be null)
     */
    String toSqlText();
}
