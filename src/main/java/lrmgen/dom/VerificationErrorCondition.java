// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package lrmgen.dom;

import java.util.List;
import lrmgen.util.condition.Condition;

/**
 * A condition type representing a failed DOM tree verification.
 * <p>
 * The detailed message lists every error found, each with the tags of the offending node's ancestors.
 */
public final class VerificationErrorCondition extends Condition {
    VerificationErrorCondition(final List<VerificationError> errors) {
        super("DOM verification failed");
        this.errors = List.copyOf(errors);
    }

    /**
     * Retrieves the number of errors found.
     */
    public int errorCount() {
        return errors.size();
    }

    @Override
    public String detailedMessage() {
        final var builder = new StringBuilder(message());
        for (final var error : errors) {
            builder.append("\n - ");
            builder.append(error.message());
            builder.append("\n   Ancestors (from outermost):");
            for (final var ancestor : error.ancestorTags()) {
                builder.append("\n    - ");
                builder.append(ancestor.htmlName());
            }
        }
        return builder.toString();
    }

    private final List<VerificationError> errors;
}
