package com.demo.errcode.grpc;

import com.demo.errcode.Causes;
import com.demo.errcode.ErrorCoder;
import com.demo.errcode.ErrorCoders;
import io.grpc.Status;
import io.grpc.StatusException;
import io.grpc.StatusRuntimeException;
import org.springframework.lang.Nullable;

/**
 * Extracts the status code from gRPC errors.
 *
 * Recognized, first match in the cause chain wins:
 * - {@link GrpcStatusError}: explicit status from any error type
 * - {@link StatusRuntimeException}: thrown by blocking stubs
 * - {@link StatusException}: delivered to async observers
 *
 * Used by: GoogleApiErrors (highest priority member), ErrorCoderConfiguration
 */
public final class GrpcErrors {

    private static final ErrorCoder ERROR_CODER = ErrorCoders.fromFunction("grpc", GrpcErrors::errorCode);

    private GrpcErrors() {
    }

    /**
     * Returns the gRPC ErrorCoder.
     */
    public static ErrorCoder errorCoder() {
        return ERROR_CODER;
    }

    /**
     * Returns the status code carried by the first gRPC error in the cause chain.
     *
     * A gRPC error whose status is null has no sensible code and maps to UNKNOWN,
     * not OK.
     */
    public static Status.Code errorCode(@Nullable Throwable error) {
        if (error == null) {
            return Status.Code.OK;
        }
        return Causes.stream(error)
                .filter(GrpcErrors::isGrpcError)
                .findFirst()
                .map(GrpcErrors::statusOf)
                .map(Status::getCode)
                .orElse(Status.Code.UNKNOWN);
    }

    private static boolean isGrpcError(Throwable t) {
        return t instanceof GrpcStatusError
                || t instanceof StatusRuntimeException
                || t instanceof StatusException;
    }

    @Nullable
    private static Status statusOf(Throwable t) {
        if (t instanceof GrpcStatusError gse) {
            return gse.grpcStatus();
        }
        if (t instanceof StatusRuntimeException sre) {
            return sre.getStatus();
        }
        return ((StatusException) t).getStatus();
    }
}
