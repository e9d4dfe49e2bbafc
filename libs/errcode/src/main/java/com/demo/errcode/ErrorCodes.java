package com.demo.errcode;

import io.grpc.Status;
import org.springframework.lang.Nullable;

import java.io.FileNotFoundException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.sql.SQLTimeoutException;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

/**
 * Explicit error tagging and the coders for JDK error types.
 *
 * The coders returned here are shared singletons, so composing them more than
 * once and compacting the result keeps a single copy.
 */
public final class ErrorCodes {

    private static final ErrorCoder CODED_ERROR_CODER =
            ErrorCoders.fromFunction("coded", ErrorCodes::codedErrorCode);
    private static final ErrorCoder CONTEXT_ERROR_CODER =
            ErrorCoders.fromFunction("context", ErrorCodes::contextErrorCode);
    private static final ErrorCoder FILE_SYSTEM_ERROR_CODER =
            ErrorCoders.fromFunction("filesystem", ErrorCodes::fileSystemErrorCode);

    private ErrorCodes() {
    }

    /**
     * Wraps the given error and adds an explicit code.
     * Any code is accepted, OK and UNKNOWN included.
     */
    public static CodedException wrap(Status.Code code, Throwable cause) {
        return new CodedException(code, cause);
    }

    /**
     * Returns an ErrorCoder that handles {@link CodedError}s.
     */
    public static ErrorCoder codedErrorCoder() {
        return CODED_ERROR_CODER;
    }

    /**
     * Returns an ErrorCoder that handles timeouts and cancellation.
     */
    public static ErrorCoder contextErrorCoder() {
        return CONTEXT_ERROR_CODER;
    }

    /**
     * Returns an ErrorCoder that handles filesystem errors.
     */
    public static ErrorCoder fileSystemErrorCoder() {
        return FILE_SYSTEM_ERROR_CODER;
    }

    public static Status.Code codedErrorCode(@Nullable Throwable error) {
        if (error == null) {
            return Status.Code.OK;
        }
        return Causes.find(error, CodedError.class)
                .map(CodedError::code)
                .orElse(Status.Code.UNKNOWN);
    }

    /**
     * Timeouts map to DEADLINE_EXCEEDED: {@link TimeoutException} and the JDK's
     * I/O timeouts ({@link SocketTimeoutException}, {@link HttpTimeoutException},
     * {@link SQLTimeoutException}). {@link CancellationException} maps to CANCELLED.
     */
    public static Status.Code contextErrorCode(@Nullable Throwable error) {
        if (error == null) {
            return Status.Code.OK;
        }
        if (Causes.contains(error, TimeoutException.class, SocketTimeoutException.class,
                HttpTimeoutException.class, SQLTimeoutException.class)) {
            return Status.Code.DEADLINE_EXCEEDED;
        }
        if (Causes.contains(error, CancellationException.class)) {
            return Status.Code.CANCELLED;
        }
        return Status.Code.UNKNOWN;
    }

    /**
     * java.io reports both a missing file and a refused open as
     * {@link FileNotFoundException}; the platform's "(Permission denied)" or
     * "(Access is denied)" message suffix tells them apart.
     */
    public static Status.Code fileSystemErrorCode(@Nullable Throwable error) {
        if (error == null) {
            return Status.Code.OK;
        }
        if (Causes.contains(error, FileAlreadyExistsException.class)) {
            return Status.Code.ALREADY_EXISTS;
        }
        if (Causes.contains(error, NoSuchFileException.class)) {
            return Status.Code.NOT_FOUND;
        }
        Optional<FileNotFoundException> fileNotFound = Causes.find(error, FileNotFoundException.class);
        if (fileNotFound.isPresent()) {
            return isAccessDenied(fileNotFound.get()) ? Status.Code.PERMISSION_DENIED : Status.Code.NOT_FOUND;
        }
        if (Causes.contains(error, AccessDeniedException.class)) {
            return Status.Code.PERMISSION_DENIED;
        }
        if (Causes.contains(error, InvalidPathException.class)) {
            return Status.Code.INVALID_ARGUMENT;
        }
        return Status.Code.UNKNOWN;
    }

    private static boolean isAccessDenied(FileNotFoundException e) {
        String message = e.getMessage();
        return message != null
                && (message.endsWith("(Permission denied)") || message.endsWith("(Access is denied)"));
    }
}
