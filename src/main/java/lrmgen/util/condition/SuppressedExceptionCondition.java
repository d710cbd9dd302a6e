// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package lrmgen.util.condition;

/**
 * A non-fatal condition reporting an exception swallowed during cleanup, such as a temporary output file that could
 * not be removed.
 */
public final class SuppressedExceptionCondition extends Condition {
    /**
     * Initializes a new condition reporting the given suppressed exception.
     */
    public SuppressedExceptionCondition(final Exception exception) {
        super("Suppressed exception: " + exception);
    }
}
