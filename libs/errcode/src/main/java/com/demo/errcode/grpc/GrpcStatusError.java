package com.demo.errcode.grpc;

import io.grpc.Status;
import org.springframework.lang.Nullable;

/**
 * An error exposing an explicit gRPC status.
 */
public interface GrpcStatusError {

    @Nullable
    Status grpcStatus();
}
