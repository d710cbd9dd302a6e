// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package lrmgen.source;

/**
 * A position in a manual source.
 *
 * @param sourceName   The user-readable name of the source, usually its path.
 * @param lineNumber   The 1-based line number.
 * @param columnNumber The 1-based column number.
 * @param offset       The 0-based offset from the start of the source.
 */
public record SourceLocation(String sourceName, int lineNumber, int columnNumber, int offset) {
    /**
     * Returns the location {@code count} columns and offset units to the right of this one, on the same line.
     */
    public SourceLocation shifted(final int count) {
        return new SourceLocation(sourceName, lineNumber, columnNumber + count, offset + count);
    }

    @Override
    public String toString() {
        return "In " + sourceName + ", line " + lineNumber + ", column " + columnNumber;
    }
}
