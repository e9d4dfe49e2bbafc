package com.demo.errcode.googleapi;

import com.demo.errcode.Causes;
import com.demo.errcode.ErrorCoder;
import com.demo.errcode.ErrorCoders;
import com.demo.errcode.grpc.GrpcErrors;
import com.demo.errcode.http.HttpErrors;
import com.google.api.client.http.HttpResponseException;
import com.google.api.gax.rpc.ApiException;
import com.google.api.gax.rpc.StatusCode;
import io.grpc.Status;
import org.springframework.lang.Nullable;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Extracts the status code from Google Cloud API client errors.
 *
 * The coder is a composite, in priority order:
 * 1. gRPC errors (gRPC transport carries the richer status)
 * 2. HTTP status errors
 * 3. Google client errors: gax {@link ApiException} and google-http-client
 *    {@link HttpResponseException}
 */
public final class GoogleApiErrors {

    private static final Map<StatusCode.Code, Status.Code> GAX_CODES;

    static {
        Map<String, Status.Code> byName = new HashMap<>();
        for (Status.Code code : Status.Code.values()) {
            byName.put(code.name(), code);
        }
        Map<StatusCode.Code, Status.Code> codes = new EnumMap<>(StatusCode.Code.class);
        for (StatusCode.Code code : StatusCode.Code.values()) {
            Status.Code grpcCode = byName.get(code.name());
            if (grpcCode != null) {
                codes.put(code, grpcCode);
            }
        }
        GAX_CODES = Collections.unmodifiableMap(codes);
    }

    private static final ErrorCoder GOOGLE_CLIENT_ERROR_CODER =
            ErrorCoders.fromFunction("google-client", GoogleApiErrors::googleClientErrorCode);

    private static final ErrorCoders ERROR_CODER = ErrorCoders.of(
            GrpcErrors.errorCoder(),
            HttpErrors.errorCoder(),
            GOOGLE_CLIENT_ERROR_CODER);

    private GoogleApiErrors() {
    }

    /**
     * Returns the Google API ErrorCoder.
     */
    public static ErrorCoders errorCoder() {
        return ERROR_CODER;
    }

    public static Status.Code errorCode(@Nullable Throwable error) {
        return ERROR_CODER.errorCode(error);
    }

    static Status.Code googleClientErrorCode(@Nullable Throwable error) {
        if (error == null) {
            return Status.Code.OK;
        }
        return Causes.stream(error)
                .map(GoogleApiErrors::codeOf)
                .flatMap(Optional::stream)
                .findFirst()
                .orElse(Status.Code.UNKNOWN);
    }

    private static Optional<Status.Code> codeOf(Throwable t) {
        if (t instanceof ApiException ae) {
            StatusCode statusCode = ae.getStatusCode();
            if (statusCode == null || statusCode.getCode() == null) {
                return Optional.of(Status.Code.UNKNOWN);
            }
            return Optional.of(GAX_CODES.getOrDefault(statusCode.getCode(), Status.Code.UNKNOWN));
        }
        if (t instanceof HttpResponseException hre) {
            return Optional.of(HttpErrors.toGrpc(hre.getStatusCode()));
        }
        return Optional.empty();
    }
}
