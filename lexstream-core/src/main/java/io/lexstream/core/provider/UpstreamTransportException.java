package io.lexstream.core.provider;

public class UpstreamTransportException extends UpstreamException {
    public static final int NO_STATUS = -1;

    private final int status;
    private final String body;

    public UpstreamTransportException(int status, String body) {
        super("HTTP " + status + (body == null || body.isBlank() ? "" : ": " + truncate(body, 300)));
        this.status = status;
        this.body = body == null ? "" : body;
    }

    public UpstreamTransportException(String message, Throwable cause) {
        super(message, cause);
        this.status = NO_STATUS;
        this.body = "";
    }

    public int status() {
        return status;
    }

    public String body() {
        return body;
    }

    private static String truncate(String value, int max) {
        if (value.length() <= max) {
            return value;
        }
        return value.substring(0, max) + "...";
    }
}
