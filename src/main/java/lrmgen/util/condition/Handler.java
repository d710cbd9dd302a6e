// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package lrmgen.util.condition;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A condition handler, intended to be used within try-with-resources.
 * <p>
 * Signaled conditions are passed to installed handlers from the most recently installed one to the oldest one.
 */
public final class Handler implements AutoCloseable {
    /**
     * Installs a new handler running the given procedure in the calling thread's {@link ConditionContext}.
     */
    public Handler(final HandlerProcedure procedure) {
        final var context = ConditionContext.localContext();
        next = context.firstHandler;
        this.procedure = procedure;
        ownerContext = context;
        context.firstHandler = this;
    }

    /**
     * Does nothing; silences warnings about resources that are never referenced inside their try block.
     */
    @SuppressWarnings("EmptyMethod")
    public void use() {
    }

    /**
     * Uninstalls this handler. Handlers have to be uninstalled newest first, which try-with-resources guarantees.
     */
    @Override
    public void close() {
        assert ownerContext == ConditionContext.localContext() : "Handler closed by a different thread";
        assert ownerContext.firstHandler == this : "Handler chain corrupt";
        ownerContext.firstHandler = next;
    }

    void handle(final SignaledCondition condition) throws Unwind {
        procedure.handle(condition);
    }

    final @Nullable Handler next;
    private final HandlerProcedure procedure;
    private final ConditionContext ownerContext;
}
