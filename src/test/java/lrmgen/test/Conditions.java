// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package lrmgen.test;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import lrmgen.util.condition.Condition;
import lrmgen.util.condition.ConditionContext;
import lrmgen.util.condition.Handler;
import org.checkerframework.checker.nullness.qual.Nullable;

// Runs code under a handler that records every signaled condition and unwinds on the first fatal one.
final class Conditions {
    private Conditions() {
    }

    static <T> Outcome<T> capture(final Supplier<? extends T> body) {
        final var warnings = new ArrayList<Condition>();
        final var errors = new ArrayList<Condition>();
        try (final var handler = new Handler(signaled -> {
            if (!signaled.isFatal()) {
                warnings.add(signaled.condition());
                return;
            }
            errors.add(signaled.condition());
            ConditionContext.restarts().iterator().next().unwindTo();
        })) {
            handler.use();
            final T value = ConditionContext.withRestart("abort-test", restart -> body.get());
            return new Outcome<>(value, warnings, errors.isEmpty() ? null : errors.get(0));
        }
    }

    static Outcome<Void> run(final Runnable body) {
        return capture(() -> {
            body.run();
            return null;
        });
    }

    record Outcome<T>(@Nullable T value, List<Condition> warnings, @Nullable Condition error) {
        Outcome {
            warnings = List.copyOf(warnings);
        }

        boolean failed() {
            return error != null;
        }

        Condition requireError() {
            final var condition = error;
            if (condition == null) {
                throw new AssertionError("Expected a fatal condition, but none was signaled");
            }
            return condition;
        }

        T requireValue() {
            final var result = value;
            if (error != null || result == null) {
                throw new AssertionError("Expected a result, but got fatal condition " + error);
            }
            return result;
        }
    }
}
