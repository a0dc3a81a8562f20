package com.whereq.ferry.exception;

/**
 * HTTP error returned by one of the Google APIs, decoded once at the client boundary.
 * Callers branch on {@link #getKind()} instead of raw status codes.
 */
public class RemoteApiException extends FerryException {

    public enum Kind {
        /**
         * 404, the resource is gone
         */
        NOT_FOUND,

        /**
         * 5xx
         */
        SERVER_ERROR,

        /**
         * Everything else (bad request, permission denied, throttling...)
         */
        OTHER
    }

    private final Kind kind;
    private final int status;
    private final String body;

    public RemoteApiException(int status, String body) {
        super("Remote API error status=" + status + " body=" + body);
        this.status = status;
        this.body = body;
        this.kind = classify(status);
    }

    private static Kind classify(int status) {
        if (status == 404) {
            return Kind.NOT_FOUND;
        }
        if (status >= 500 && status <= 599) {
            return Kind.SERVER_ERROR;
        }
        return Kind.OTHER;
    }

    public Kind getKind() {
        return kind;
    }

    public int getStatus() {
        return status;
    }

    public String getBody() {
        return body;
    }
}
