package com.demo.errcode;

import io.grpc.Status;
import org.springframework.lang.Nullable;

/**
 * Maps an error to a canonical gRPC status code.
 *
 * Contract every implementation must honor:
 * - a null error is OK
 * - an error the coder cannot place is UNKNOWN
 * - classification never throws
 *
 * Implementations are stateless and safe for concurrent use.
 */
@FunctionalInterface
public interface ErrorCoder {

    /**
     * Returns the code of an error.
     *
     * @param error error to classify, or null for success
     * @return the matched code, OK for null, UNKNOWN when the code cannot be determined
     */
    Status.Code errorCode(@Nullable Throwable error);
}
