package org.linescan;

/**
 * Raised when a document cannot be parsed because it is not well-formed. No partial output is
 * ever produced for a failed document; callers decide whether to skip the file or abort.
 */
public class ParsingFailure extends Exception {

    private final String source;
    private final int line;

    public ParsingFailure(String source, int line, String message, Throwable cause) {
        super(source + (line > 0 ? ":" + line : "") + ": " + message, cause);
        this.source = source;
        this.line = line;
    }

    /** Name of the document that failed to parse. */
    public String getSource() {
        return source;
    }

    /** 1-based line of the problem, or {@code 0} when unknown. */
    public int getLine() {
        return line;
    }
}
