// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package lrmgen.sexp.reader;

import lrmgen.source.LocatedCondition;
import lrmgen.source.SourceLocation;

/**
 * A condition type indicating that the manual source could not be parsed as S-expressions.
 */
public final class ReadErrorCondition extends LocatedCondition {
    /**
     * Initializes a new read error with the given user-readable message and associated error location.
     */
    ReadErrorCondition(final String rawMessage, final SourceLocation location) {
        super(rawMessage, location);
    }
}
