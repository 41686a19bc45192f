package im.arun.mdblocks.logseq;

/**
 * Raised when the Logseq HTTP API rejects a call or cannot be reached.
 */
public class LogseqApiException extends RuntimeException {
    private final int statusCode;

    public LogseqApiException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public LogseqApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /**
     * HTTP status of the failed response, or -1 when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
