// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package lrmgen.util.condition;

/**
 * Thrown by {@link ConditionContext#error(Condition)} when no handler transferred control away.
 * <p>
 * Every run is expected to install a handler for fatal conditions, so reaching this is a programming error, hence
 * {@link AssertionError}.
 */
public final class UnhandledErrorError extends AssertionError {
    UnhandledErrorError(final Condition condition) {
        super("Fatal condition signaled, but no condition handler unwound; condition: " + condition);
    }
}
