package spelling.io;

import java.io.IOException;

/**
 * A training record or stored cost table that cannot be read. Loading stops at the first such record rather than
 * skipping it, since a silently dropped record would bias the learned costs.
 */
public class MalformedRecordException extends IOException {

    private final String source;
    private final int lineNumber;

    public MalformedRecordException(String source, int lineNumber, String message) {
        super(source + ":" + lineNumber + ": " + message);
        this.source = source;
        this.lineNumber = lineNumber;
    }

    public MalformedRecordException(String source, String message, Throwable cause) {
        super(source + ": " + message, cause);
        this.source = source;
        this.lineNumber = -1;
    }

    public String getSource() {
        return source;
    }

    /**
     * One-based line of the offending record, or -1 when the problem is not tied to a line.
     */
    public int getLineNumber() {
        return lineNumber;
    }
}
