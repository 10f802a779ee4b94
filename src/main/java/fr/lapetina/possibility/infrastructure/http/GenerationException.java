package fr.lapetina.possibility.infrastructure.http;

import fr.lapetina.possibility.domain.model.ErrorType;

import java.io.IOException;
import java.net.ConnectException;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Failure of a possibility request, categorized by {@link ErrorType}.
 */
public class GenerationException extends RuntimeException {

    private final ErrorType errorType;
    private final int statusCode;

    public GenerationException(ErrorType errorType, String message) {
        this(errorType, message, -1, null);
    }

    public GenerationException(ErrorType errorType, String message, Throwable cause) {
        this(errorType, message, -1, cause);
    }

    public GenerationException(ErrorType errorType, String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
        this.statusCode = statusCode;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    /**
     * HTTP status of the rejected request, -1 when the failure happened elsewhere.
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * Strips the wrappers added by futures.
     */
    public static Throwable unwrap(Throwable ex) {
        Throwable current = ex;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    public static ErrorType classify(Throwable ex) {
        Throwable cause = unwrap(ex);

        if (cause instanceof GenerationException generationException) {
            return generationException.getErrorType();
        }
        if (cause instanceof HttpConnectTimeoutException
                || cause instanceof HttpTimeoutException
                || cause instanceof TimeoutException) {
            return ErrorType.TIMEOUT;
        }
        if (cause instanceof ConnectException) {
            return ErrorType.NETWORK_ERROR;
        }
        if (cause instanceof IOException) {
            return ErrorType.NETWORK_ERROR;
        }
        return ErrorType.INTERNAL_ERROR;
    }
}
