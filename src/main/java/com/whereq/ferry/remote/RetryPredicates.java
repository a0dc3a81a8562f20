package com.whereq.ferry.remote;

import com.whereq.ferry.exception.RemoteApiException;
import org.springframework.web.reactive.function.client.WebClientRequestException;

import java.io.IOException;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

/**
 * Decides which remote failures are worth another attempt
 */
public final class RetryPredicates {

    private static final int TOO_MANY_REQUESTS = 429;

    private RetryPredicates() {
    }

    /**
     * Transport failures, throttling and server errors. Client errors such as 400 or 403 are final.
     */
    public static Predicate<Throwable> transientFailures() {
        return RetryPredicates::isTransient;
    }

    static boolean isTransient(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof RemoteApiException rae) {
                return rae.getKind() == RemoteApiException.Kind.SERVER_ERROR
                    || rae.getStatus() == TOO_MANY_REQUESTS;
            }
            if (t instanceof WebClientRequestException
                || t instanceof IOException
                || t instanceof TimeoutException) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }
}
