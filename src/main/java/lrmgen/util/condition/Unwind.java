// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package lrmgen.util.condition;

/**
 * The throwable carrying control from a handler to its chosen {@link Restart}.
 * <p>
 * Public only so that callbacks can declare it. Nothing but {@link ConditionContext} should catch it.
 * <p>
 * It is neither an {@link Exception} nor an {@link Error}, so ordinary catch clauses let it pass.
 */
@SuppressWarnings("ExtendsThrowable")
public final class Unwind extends Throwable {
    Unwind(final Restart target) {
        super("Unwinding to restart point " + target.name(), null, false, false);
        this.target = target;
    }

    Restart target() {
        return target;
    }

    private final transient Restart target;
}
