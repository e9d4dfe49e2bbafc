package com.demo.errcode.grpc;

import com.demo.errcode.ErrorCoder;
import io.grpc.Status;
import io.grpc.StatusException;
import io.grpc.StatusRuntimeException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class GrpcErrorsTest {

    private final ErrorCoder coder = GrpcErrors.errorCoder();

    @Test
    void testSuccess() {
        assertEquals(Status.Code.OK, coder.errorCode(null));
    }

    @Test
    void testUnavailable() {
        StatusRuntimeException ex = new StatusRuntimeException(Status.UNAVAILABLE);
        assertEquals(Status.Code.UNAVAILABLE, coder.errorCode(ex));
    }

    @Test
    void testDeadlineExceeded() {
        StatusRuntimeException ex = new StatusRuntimeException(Status.DEADLINE_EXCEEDED);
        assertEquals(Status.Code.DEADLINE_EXCEEDED, coder.errorCode(ex));
    }

    @Test
    void testResourceExhausted() {
        StatusRuntimeException ex = new StatusRuntimeException(Status.RESOURCE_EXHAUSTED.withDescription("quota"));
        assertEquals(Status.Code.RESOURCE_EXHAUSTED, coder.errorCode(ex));
    }

    @Test
    void testCheckedStatusException() {
        StatusException ex = new StatusException(Status.PERMISSION_DENIED);
        assertEquals(Status.Code.PERMISSION_DENIED, coder.errorCode(ex));
    }

    @Test
    void testWrappedInExecutionException() {
        ExecutionException ex = new ExecutionException(new StatusRuntimeException(Status.NOT_FOUND));
        assertEquals(Status.Code.NOT_FOUND, coder.errorCode(ex));
    }

    @Test
    void testFirstGrpcErrorInChainWins() {
        StatusRuntimeException inner = new StatusRuntimeException(Status.INTERNAL);
        StatusRuntimeException outer = Status.ABORTED.withCause(inner).asRuntimeException();
        assertEquals(Status.Code.ABORTED, coder.errorCode(outer));
    }

    @Test
    void testStatusErrorCapability() {
        assertEquals(Status.Code.FAILED_PRECONDITION,
                coder.errorCode(new StatusCarrier(Status.FAILED_PRECONDITION)));
    }

    @Test
    void testNullStatusIsUnknown() {
        assertEquals(Status.Code.UNKNOWN, coder.errorCode(new StatusCarrier(null)));
    }

    @Test
    void testUnknownGrpcStatus() {
        StatusRuntimeException ex = new StatusRuntimeException(Status.UNKNOWN);
        assertEquals(Status.Code.UNKNOWN, coder.errorCode(ex));
    }

    @Test
    void testNonGrpcException() {
        assertEquals(Status.Code.UNKNOWN, coder.errorCode(new IllegalStateException("test")));
    }

    private static final class StatusCarrier extends RuntimeException implements GrpcStatusError {
        private final Status status;

        StatusCarrier(Status status) {
            super("carrier");
            this.status = status;
        }

        @Override
        public Status grpcStatus() {
            return status;
        }
    }
}
