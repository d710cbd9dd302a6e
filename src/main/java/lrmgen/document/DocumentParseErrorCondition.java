// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package lrmgen.document;

import lrmgen.source.LocatedCondition;
import lrmgen.source.SourceLocation;

/**
 * A condition type indicating that the {@link DocumentParser} could not turn S-expressions into a {@link Manual}.
 */
public final class DocumentParseErrorCondition extends LocatedCondition {
    DocumentParseErrorCondition(final String message, final SourceLocation location) {
        super(message, location);
    }
}
