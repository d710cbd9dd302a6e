// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package lrmgen.cli;

import lrmgen.util.Trace;
import lrmgen.util.condition.Condition;
import lrmgen.util.condition.ConditionContext;
import lrmgen.util.condition.HandlerProcedure;
import lrmgen.util.condition.SignaledCondition;

/**
 * The outermost handler: reports every condition on standard error, and unwinds to the newest restart point when a
 * condition is fatal. Generation is a batch process, so no restart is ever chosen interactively.
 */
final class FallbackHandler implements HandlerProcedure {
    private FallbackHandler() {
    }

    static FallbackHandler instance() {
        return instance;
    }

    @Override
    public void handle(final SignaledCondition condition) {
        if (!condition.isFatal()) {
            try (final var streams = Streams.acquire()) {
                showCondition(streams, condition.condition(), "Warning: a condition");
            }
            return;
        }
        final var restarts = ConditionContext.restarts().iterator();
        try (final var streams = Streams.acquire()) {
            showCondition(streams, condition.condition(), "A fatal condition");
            if (!restarts.hasNext()) {
                throw new IllegalStateException("No restarts available");
            }
            final var restart = restarts.next();
            streams.err().println("Unwinding to restart point " + restart.name() + '.');
            restart.unwindTo();
        }
    }

    private static void showCondition(final Streams streams, final Condition condition, final String prefix) {
        final var err = streams.err();
        err.println(prefix + " of type " + condition.getClass().getName() + " has been signaled.");
        err.println("\nDetailed message:");
        err.println(condition.detailedMessage().stripTrailing());
        err.println("\nOperation trace:");
        for (final var traceMessage : Trace.activeTraces()) {
            err.println(" - " + traceMessage);
        }
        err.println();
    }

    private static final FallbackHandler instance = new FallbackHandler();
}
