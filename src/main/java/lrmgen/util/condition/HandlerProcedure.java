// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package lrmgen.util.condition;

/**
 * The body of a {@link Handler}.
 */
@FunctionalInterface
public interface HandlerProcedure {
    /**
     * Reacts to the given condition.
     * <p>
     * Returning normally declines the condition and lets older handlers see it. Handling it means transferring control
     * elsewhere, typically with {@link Restart#unwindTo()}.
     */
    void handle(SignaledCondition condition) throws Unwind;
}
