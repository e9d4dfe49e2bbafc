package com.demo.errcode;

import org.springframework.lang.Nullable;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Optional;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Walks the cause chain of an error, starting with the error itself.
 * A chain that loops back on itself ends at the first repeated element.
 */
public final class Causes {

    private Causes() {
    }

    /**
     * Returns the chain of an error: the error, its cause, the cause's cause, and so on.
     * Empty for a null error.
     */
    public static Stream<Throwable> stream(@Nullable Throwable error) {
        return StreamSupport.stream(new ChainSpliterator(error), false);
    }

    /**
     * Returns the first element of the chain that is an instance of {@code type}.
     */
    public static <T> Optional<T> find(@Nullable Throwable error, Class<T> type) {
        return stream(error)
                .filter(type::isInstance)
                .map(type::cast)
                .findFirst();
    }

    /**
     * Returns true if any element of the chain is an instance of one of {@code types}.
     */
    @SafeVarargs
    public static boolean contains(@Nullable Throwable error, Class<? extends Throwable>... types) {
        return stream(error).anyMatch(t -> {
            for (Class<? extends Throwable> type : types) {
                if (type.isInstance(t)) {
                    return true;
                }
            }
            return false;
        });
    }

    private static final class ChainSpliterator extends Spliterators.AbstractSpliterator<Throwable> {
        private final Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        private Throwable next;

        ChainSpliterator(@Nullable Throwable first) {
            super(Long.MAX_VALUE, Spliterator.ORDERED | Spliterator.NONNULL);
            this.next = first;
        }

        @Override
        public boolean tryAdvance(Consumer<? super Throwable> action) {
            if (next == null || !seen.add(next)) {
                return false;
            }
            Throwable current = next;
            next = current.getCause();
            action.accept(current);
            return true;
        }
    }
}
