package com.jsgf.tools.exception;

/**
 * Thrown when grammar source text is malformed. Line and column are 1-based;
 * either may be absent (reported as 0).
 */
public class ParseException extends JsgfException {

    private static final long serialVersionUID = 1L;
    private final int line;
    private final int column;

    public ParseException(String message) {
        this(message, 0, 0, null);
    }

    public ParseException(String message, int line) {
        this(message, line, 0, null);
    }

    public ParseException(String message, int line, int column) {
        this(message, line, column, null);
    }

    public ParseException(String message, int line, int column, Throwable cause) {
        super(format(message, line, column), cause);
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    private static String format(String message, int line, int column) {
        String result = message;
        if (line > 0) {
            result = "Line " + line + ": " + result;
        }
        if (column > 0) {
            result = result + " (column " + column + ")";
        }
        return result;
    }
}
