package com.demo.errcode;

import io.grpc.Status;

import java.util.Objects;

/**
 * Wraps an error and attaches an explicit code to it.
 * The message is the cause's message, unchanged.
 *
 * Created by {@link ErrorCodes#wrap(Status.Code, Throwable)}.
 */
public final class CodedException extends RuntimeException implements CodedError {

    private final Status.Code code;

    CodedException(Status.Code code, Throwable cause) {
        super(Objects.requireNonNull(cause, "cause").getMessage(), cause);
        this.code = Objects.requireNonNull(code, "code");
    }

    @Override
    public Status.Code code() {
        return code;
    }
}
