package org.argverify.logic;

/**
 * Formula text is not well-formed.
 */
public class FormulaParseException extends Exception {
    private final int position;

    public FormulaParseException(String message, int position) {
        super(position >= 0 ? message + " (at position " + position + ")" : message);
        this.position = position;
    }

    public int getPosition() {
        return position;
    }
}
