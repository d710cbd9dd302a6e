// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package lrmgen.bnf;

import lrmgen.source.LocatedCondition;
import lrmgen.source.SourceLocation;

/**
 * A condition type indicating that grammar text could not be split into tokens.
 */
public final class LexicalErrorCondition extends LocatedCondition {
    LexicalErrorCondition(final String message, final SourceLocation location) {
        super(message, location);
    }
}
