// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package lrmgen.document;

import lrmgen.source.SourceLocation;

/**
 * A bullet point of an entry.
 *
 * @param text     The unprocessed text of the bullet point.
 * @param location The location of the string the text comes from.
 */
public record Bullet(String text, SourceLocation location) {
}
