package dev.sexpindent.scan;

/**
 * Computes the partial parse state of a text range ending at the cursor.
 */
public interface PartialExpressionScanner {

    /**
     * @throws ScanException when the range contains a closing delimiter that does not match an opener
     */
    ParseState scan(CharSequence text, int from, int to);
}
