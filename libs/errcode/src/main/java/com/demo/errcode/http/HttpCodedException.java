package com.demo.errcode.http;

import java.util.Objects;

/**
 * Wraps an error and attaches an HTTP status code to it.
 * The message is the cause's message, unchanged.
 */
public final class HttpCodedException extends RuntimeException implements HttpStatusError {

    private final int httpStatus;

    HttpCodedException(int httpStatus, Throwable cause) {
        super(Objects.requireNonNull(cause, "cause").getMessage(), cause);
        this.httpStatus = httpStatus;
    }

    @Override
    public int httpStatus() {
        return httpStatus;
    }
}
