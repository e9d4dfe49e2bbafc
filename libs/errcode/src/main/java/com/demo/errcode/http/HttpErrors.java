package com.demo.errcode.http;

import com.demo.errcode.Causes;
import com.demo.errcode.ErrorCoder;
import com.demo.errcode.ErrorCoders;
import io.grpc.Status;
import org.springframework.lang.Nullable;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.server.ResponseStatusException;

import java.util.Optional;

/**
 * Attaches and extracts HTTP status codes on errors.
 *
 * Recognized, first match in the cause chain wins:
 * - {@link HttpStatusError}, including errors tagged with {@link #wrap(int, Throwable)}
 * - Spring {@link RestClientResponseException} (RestTemplate client errors)
 * - Spring {@link ResponseStatusException} (web handler errors)
 */
public final class HttpErrors {

    private static final ErrorCoder ERROR_CODER = ErrorCoders.fromFunction("http", HttpErrors::errorCode);

    private HttpErrors() {
    }

    /**
     * Wraps the given error and adds an HTTP status code.
     */
    public static HttpCodedException wrap(int httpStatus, Throwable cause) {
        return new HttpCodedException(httpStatus, cause);
    }

    /**
     * Returns the HTTP ErrorCoder.
     */
    public static ErrorCoder errorCoder() {
        return ERROR_CODER;
    }

    /**
     * Returns the gRPC code for the first HTTP status found in the cause chain.
     */
    public static Status.Code errorCode(@Nullable Throwable error) {
        if (error == null) {
            return Status.Code.OK;
        }
        return httpStatus(error)
                .map(HttpErrors::toGrpc)
                .orElse(Status.Code.UNKNOWN);
    }

    /**
     * Returns the HTTP status of the first HTTP error in the cause chain.
     */
    public static Optional<Integer> httpStatus(@Nullable Throwable error) {
        return Causes.stream(error)
                .map(HttpErrors::statusOf)
                .flatMap(Optional::stream)
                .findFirst();
    }

    private static Optional<Integer> statusOf(Throwable t) {
        if (t instanceof HttpStatusError hse) {
            return Optional.of(hse.httpStatus());
        }
        if (t instanceof RestClientResponseException rce) {
            return Optional.of(rce.getRawStatusCode());
        }
        if (t instanceof ResponseStatusException rse) {
            return Optional.of(rse.getRawStatusCode());
        }
        return Optional.empty();
    }

    /**
     * Returns the gRPC status code for an HTTP status code.
     */
    public static Status.Code toGrpc(int httpStatus) {
        if (200 <= httpStatus && httpStatus <= 299) {
            return Status.Code.OK;
        }
        return switch (httpStatus) {
            case 400 -> Status.Code.INVALID_ARGUMENT;   // Bad Request
            case 401 -> Status.Code.UNAUTHENTICATED;    // Unauthorized
            case 403 -> Status.Code.PERMISSION_DENIED;  // Forbidden
            case 404 -> Status.Code.NOT_FOUND;
            case 409 -> Status.Code.ABORTED;            // Conflict
            case 416 -> Status.Code.OUT_OF_RANGE;       // Range Not Satisfiable
            case 429 -> Status.Code.RESOURCE_EXHAUSTED; // Too Many Requests
            case 499 -> Status.Code.CANCELLED;          // Client Closed Request (nginx)
            case 500 -> Status.Code.INTERNAL;
            case 501 -> Status.Code.UNIMPLEMENTED;
            case 503 -> Status.Code.UNAVAILABLE;
            case 504 -> Status.Code.DEADLINE_EXCEEDED;  // Gateway Timeout
            default -> Status.Code.UNKNOWN;
        };
    }
}
