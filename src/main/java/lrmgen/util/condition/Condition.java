// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package lrmgen.util.condition;

/**
 * The base type for all conditions.
 * <p>
 * A condition describes something that code further up the call stack may care about: a malformed grammar rule, a
 * reference to an unknown production, a failed write. Handlers see a condition <em>before</em> the stack is unwound,
 * so they can still pick any restart point established below them.
 */
public abstract class Condition {
    /**
     * Initializes a new condition with the given user-readable message.
     */
    protected Condition(final String message) {
        this.message = message;
    }

    /**
     * Retrieves the short user-readable message of this condition.
     */
    public final String message() {
        return message;
    }

    /**
     * Retrieves the full user-readable description of this condition, including any context such as a source location.
     */
    public String detailedMessage() {
        return message;
    }

    @Override
    public String toString() {
        return getClass().getName() + ": " + message;
    }

    private final String message;
}
