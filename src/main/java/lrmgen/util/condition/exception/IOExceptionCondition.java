// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package lrmgen.util.condition.exception;

import java.io.IOException;

/**
 * A condition reporting a failed read of the manual source or a failed write of the generated page.
 */
public final class IOExceptionCondition extends ExceptionCondition<IOException> {
    /**
     * Initializes a new {@code IOExceptionCondition} wrapping the given {@link IOException}.
     */
    public IOExceptionCondition(final IOException exception) {
        super(exception);
    }
}
