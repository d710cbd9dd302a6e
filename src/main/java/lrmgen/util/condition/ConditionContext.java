// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package lrmgen.util.condition;

import java.util.Iterator;
import java.util.NoSuchElementException;
import lrmgen.util.SneakyThrow;
import org.checkerframework.checker.nullness.qual.NonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The registry of installed handlers and established restart points.
 * <p>
 * Every thread has its own context, reachable only through the static methods of this class. A generation run is
 * single-threaded, so handlers and restarts never cross threads.
 *
 * @see Handler
 * @see Restart
 */
public final class ConditionContext {
    private ConditionContext() {
    }

    /**
     * Signals the given condition as a non-fatal one, such as a warning.
     * <p>
     * Installed handlers are invoked newest first. If all of them return normally, so does this method. A handler may
     * still unwind to a restart, so this method may throw {@link Unwind}.
     */
    public static void signal(final Condition condition) {
        localContext().signal(new SignaledCondition(condition, false));
    }

    /**
     * Signals the given condition as an error.
     * <p>
     * Behaves like {@link #signal(Condition)}, except that if every handler returns normally, an
     * {@link UnhandledErrorError} is thrown. This method therefore never returns normally; its return type lets call
     * sites write {@code throw ConditionContext.error(...)}.
     */
    public static UnhandledErrorError error(final Condition condition) {
        localContext().signal(new SignaledCondition(condition, true));
        throw new UnhandledErrorError(condition);
    }

    /**
     * Runs the given callback, reporting any exception it throws as a non-fatal {@link SuppressedExceptionCondition}
     * instead of propagating it.
     * <p>
     * Meant for cleanup code that runs while the stack may already be unwinding, so handlers must not unwind in
     * response to the suppressed exception.
     */
    public static void withSuppressedExceptions(final ThrowingCallback callback) {
        try {
            callback.run();
        } catch (final Exception e) {
            try {
                SneakyThrow.<Unwind>pretendThrows();
                signal(new SuppressedExceptionCondition(e));
            } catch (final Unwind u) {
                throw new AssertionError("A handler attempted to unwind a suppressed exception condition", u);
            }
        }
    }

    /**
     * Executes the given callback with a restart point around it.
     *
     * @param restartName The user-readable name of the restart point.
     * @param callback    The code to run; the restart object is passed as an argument.
     * @return The value returned by {@code callback}, or {@code null} if control was unwound to this restart point.
     */
    public static <T> @Nullable T withRestart(final String restartName, final RestartCallback<? extends T> callback) {
        final var restart = new Restart(restartName);
        try {
            return callback.call(restart);
        } catch (final Unwind unwind) {
            if (unwind.target() != restart) {
                throw SneakyThrow.doThrow(unwind);
            }
            return null;
        } finally {
            restart.unlink();
        }
    }

    /**
     * Returns the calling thread's established restart points, newest first.
     */
    public static Iterable<Restart> restarts() {
        return localContext().new RestartIterable();
    }

    static ConditionContext localContext() {
        return localContext.get();
    }

    private void signal(final SignaledCondition condition) {
        for (var handler = firstCandidateHandler(); handler != null; handler = handler.next) {
            final var previousHandler = currentHandler;
            currentHandler = handler;
            try {
                handler.handle(condition);
            } catch (final Unwind unwind) {
                throw SneakyThrow.doThrow(unwind);
            } finally {
                currentHandler = previousHandler;
            }
        }
    }

    private @Nullable Handler firstCandidateHandler() {
        // A condition signaled from inside a handler is only seen by handlers older than that one.
        return (currentHandler == null) ? firstHandler : currentHandler.next;
    }

    @Nullable Handler firstHandler = null;
    @Nullable Restart firstRestart = null;
    private @Nullable Handler currentHandler = null;

    @SuppressWarnings("nullness:type.argument")
    private static final ThreadLocal<ConditionContext> localContext = ThreadLocal.withInitial(ConditionContext::new);

    /**
     * A callback allowed to throw checked exceptions, for {@link #withSuppressedExceptions(ThrowingCallback)}.
     */
    @FunctionalInterface
    public interface ThrowingCallback {
        void run() throws Exception;
    }

    private final class RestartIterable implements Iterable<Restart> {
        @Override
        public @NonNull Iterator<Restart> iterator() {
            return new RestartIterator(firstRestart);
        }
    }

    private static final class RestartIterator implements Iterator<Restart> {
        private RestartIterator(final @Nullable Restart firstRestart) {
            current = firstRestart;
        }

        @Override
        public boolean hasNext() {
            return current != null;
        }

        @Override
        public Restart next() {
            final var restart = current;
            if (restart == null) {
                throw new NoSuchElementException("No more restarts left");
            }
            current = restart.next;
            return restart;
        }

        private @Nullable Restart current;
    }
}
