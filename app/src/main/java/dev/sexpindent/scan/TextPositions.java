package dev.sexpindent.scan;

/**
 * Line and display-column arithmetic over raw text.
 */
public final class TextPositions {

    private TextPositions() {
    }

    public static int lineStart(CharSequence text, int position) {
        int index = Math.min(position, text.length());
        while (index > 0 && text.charAt(index - 1) != '\n') {
            index--;
        }
        return index;
    }

    /**
     * Returns the offset just past the newline ending the line that contains {@code position},
     * or the text length on the last line.
     */
    public static int nextLineStart(CharSequence text, int position) {
        int index = position;
        while (index < text.length()) {
            if (text.charAt(index) == '\n') {
                return index + 1;
            }
            index++;
        }
        return text.length();
    }

    public static boolean sameLine(CharSequence text, int first, int second) {
        int low = Math.min(first, second);
        int high = Math.max(first, second);
        for (int i = low; i < high; i++) {
            if (text.charAt(i) == '\n') {
                return false;
            }
        }
        return true;
    }

    public static int column(CharSequence text, int position, int tabWidth) {
        int column = 0;
        for (int i = lineStart(text, position); i < position; i++) {
            if (text.charAt(i) == '\t') {
                column += tabWidth - (column % tabWidth);
            } else {
                column++;
            }
        }
        return column;
    }

    public static int skipHorizontalSpace(CharSequence text, int position) {
        int index = position;
        while (index < text.length() && SexpSyntax.isHorizontalSpace(text.charAt(index))) {
            index++;
        }
        return index;
    }

    public static int currentIndentation(CharSequence text, int lineStart, int tabWidth) {
        return column(text, skipHorizontalSpace(text, lineStart), tabWidth);
    }
}
