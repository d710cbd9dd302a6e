// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package lrmgen.util;

import java.util.Iterator;
import java.util.NoSuchElementException;
import org.checkerframework.checker.nullness.qual.NonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An operation trace entry, intended to be used within try-with-resources.
 * <p>
 * Traces describe, in words a manual author understands, what the generator was doing when a diagnostic was
 * reported: which manual was being loaded, which grammar bundle was being parsed, and so on. They stand in for a log
 * and are printed beneath every reported condition.
 * <p>
 * Trace objects must only be used by the thread that created them.
 */
public final class Trace implements AutoCloseable {
    /**
     * Opens a trace entry with a <em>lazily evaluated</em> message, computed at most once and only if somebody asks.
     */
    public Trace(final MessageSupplier supplier) {
        this((Object) supplier);
    }

    /**
     * Opens a trace entry with the given message.
     */
    public Trace(final String message) {
        this((Object) message);
    }

    private Trace(final Object messageOrSupplier) {
        final var context = localContext();
        next = context.innermost;
        this.messageOrSupplier = messageOrSupplier;
        ownerContext = context;
        context.innermost = this;
    }

    /**
     * Returns the calling thread's open trace messages, innermost first.
     */
    public static Iterable<String> activeTraces() {
        return ActiveTraces.instance;
    }

    /**
     * Does nothing; silences warnings about resources that are never referenced inside their try block.
     */
    @SuppressWarnings("EmptyMethod")
    public void use() {
    }

    /**
     * Closes this trace entry. Entries have to be closed innermost first, which try-with-resources guarantees.
     */
    @Override
    public void close() {
        assert ownerContext == localContext() : "Trace closed by a different thread";
        assert ownerContext.innermost == this : "Trace chain corrupt";
        ownerContext.innermost = next;
    }

    private String message() {
        if (messageOrSupplier instanceof final String string) {
            return string;
        }
        final var message = ((MessageSupplier) messageOrSupplier).get();
        messageOrSupplier = message;
        return message;
    }

    private static Context localContext() {
        return context.get();
    }

    @SuppressWarnings("nullness:type.argument")
    private static final ThreadLocal<Context> context = ThreadLocal.withInitial(Context::new);

    private final @Nullable Trace next;
    private Object messageOrSupplier;
    private final Context ownerContext;

    /**
     * A lazily evaluated trace message.
     */
    @FunctionalInterface
    public interface MessageSupplier {
        String get();
    }

    private static final class Context {
        private @Nullable Trace innermost = null;
    }

    private static final class ActiveTraces implements Iterable<String> {
        @Override
        public @NonNull Iterator<String> iterator() {
            return new TraceIterator(localContext().innermost);
        }

        private static final ActiveTraces instance = new ActiveTraces();
    }

    private static final class TraceIterator implements Iterator<String> {
        private TraceIterator(final @Nullable Trace innermost) {
            current = innermost;
        }

        @Override
        public boolean hasNext() {
            return current != null;
        }

        @Override
        public String next() {
            final var trace = current;
            if (trace == null) {
                throw new NoSuchElementException("No more traces left");
            }
            current = trace.next;
            return trace.message();
        }

        private @Nullable Trace current;
    }
}
