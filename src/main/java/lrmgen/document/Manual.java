// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package lrmgen.document;

import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A parsed language reference manual.
 *
 * @param title   The title of the manual, used for the page title and the top-level heading.
 * @param license The copyright and licensing notice shown under the title, if any.
 * @param entries The entries of the manual, in document order.
 */
public record Manual(String title, @Nullable String license, List<Entry> entries) {
    public Manual {
        entries = List.copyOf(entries);
    }
}
