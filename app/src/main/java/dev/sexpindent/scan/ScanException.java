package dev.sexpindent.scan;

/**
 * Raised when the text before the cursor is not balanced well enough to locate the enclosing lists.
 */
public class ScanException extends RuntimeException {

    private final int position;

    public ScanException(String message, int position) {
        super(message);
        this.position = position;
    }

    public int getPosition() {
        return position;
    }
}
