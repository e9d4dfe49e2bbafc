package com.demo.errcode;

import io.grpc.Status;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * An {@link ErrorCoder} that combines other ErrorCoders.
 *
 * Members are asked in order and the first answer that is not UNKNOWN wins, so
 * earlier members take priority over later ones. Callers control priority purely
 * by the order given at construction time.
 *
 * Instances are immutable. Two composites are equal when they hold the same
 * member instances in the same order; members are compared by identity.
 */
public final class ErrorCoders implements ErrorCoder {
    private static final Logger logger = LoggerFactory.getLogger(ErrorCoders.class);

    private static final ErrorCoders EMPTY = new ErrorCoders(Collections.emptyList());

    private final List<ErrorCoder> coders;

    private ErrorCoders(List<ErrorCoder> coders) {
        this.coders = coders;
    }

    /**
     * Returns a composite of the given coders, in the given order, without flattening.
     */
    public static ErrorCoders of(ErrorCoder... coders) {
        List<ErrorCoder> list = new ArrayList<>(coders.length);
        for (ErrorCoder coder : coders) {
            list.add(Objects.requireNonNull(coder, "coder"));
        }
        return new ErrorCoders(Collections.unmodifiableList(list));
    }

    /**
     * Returns an ErrorCoder backed by a function.
     * Every call returns a new instance, distinct from all others.
     */
    public static ErrorCoder fromFunction(Function<? super Throwable, Status.Code> fn) {
        return new FunctionErrorCoder("fn", fn);
    }

    /**
     * Returns an ErrorCoder backed by a function, named for logging.
     */
    public static ErrorCoder fromFunction(String name, Function<? super Throwable, Status.Code> fn) {
        return new FunctionErrorCoder(Objects.requireNonNull(name, "name"), fn);
    }

    /**
     * Flattens and dedupes ErrorCoders.
     *
     * Nested composites are expanded in place, depth first. A coder instance seen
     * earlier in the traversal is dropped, so the result keeps first-occurrence
     * order. Null elements are skipped.
     */
    public static ErrorCoders compact(ErrorCoder... coders) {
        return compact(Arrays.asList(coders));
    }

    /**
     * Flattens and dedupes ErrorCoders.
     *
     * @see #compact(ErrorCoder...)
     */
    public static ErrorCoders compact(Iterable<? extends ErrorCoder> coders) {
        List<ErrorCoder> flat = new ArrayList<>();
        compact(flat, coders);
        if (flat.isEmpty()) {
            return EMPTY;
        }
        return new ErrorCoders(Collections.unmodifiableList(flat));
    }

    private static void compact(List<ErrorCoder> flat, Iterable<? extends ErrorCoder> elems) {
        for (ErrorCoder elem : elems) {
            if (elem == null) {
                continue;
            }
            if (elem instanceof ErrorCoders list) {
                compact(flat, list.coders);
                continue;
            }
            if (containsInstance(flat, elem)) {
                logger.debug("Dropping duplicate error coder: {}", elem);
            } else {
                flat.add(elem);
            }
        }
    }

    // Identity, not equals(): coders are opaque and may wrap lambdas.
    private static boolean containsInstance(List<ErrorCoder> list, ErrorCoder elem) {
        for (ErrorCoder coder : list) {
            if (coder == elem) {
                return true;
            }
        }
        return false;
    }

    @Override
    public Status.Code errorCode(@Nullable Throwable error) {
        if (error == null) {
            return Status.Code.OK;
        }
        for (ErrorCoder coder : coders) {
            Status.Code code = coder.errorCode(error);
            if (code != null && code != Status.Code.UNKNOWN) {
                return code;
            }
        }
        return Status.Code.UNKNOWN;
    }

    /**
     * Returns the members of this composite, in priority order.
     */
    public List<ErrorCoder> coders() {
        return coders;
    }

    public int size() {
        return coders.size();
    }

    public boolean isEmpty() {
        return coders.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ErrorCoders that)) {
            return false;
        }
        List<ErrorCoder> other = that.coders;
        if (other.size() != coders.size()) {
            return false;
        }
        for (int i = 0; i < coders.size(); i++) {
            if (coders.get(i) != other.get(i)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int h = 1;
        for (ErrorCoder coder : coders) {
            h = 31 * h + System.identityHashCode(coder);
        }
        return h;
    }

    @Override
    public String toString() {
        return "ErrorCoders" + coders;
    }

    private static final class FunctionErrorCoder implements ErrorCoder {
        private final String name;
        private final Function<? super Throwable, Status.Code> fn;

        FunctionErrorCoder(String name, Function<? super Throwable, Status.Code> fn) {
            this.name = name;
            this.fn = Objects.requireNonNull(fn, "fn");
        }

        @Override
        public Status.Code errorCode(@Nullable Throwable error) {
            if (error == null) {
                return Status.Code.OK;
            }
            Status.Code code = fn.apply(error);
            return code != null ? code : Status.Code.UNKNOWN;
        }

        @Override
        public String toString() {
            return name;
        }
    }
}
