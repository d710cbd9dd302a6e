// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package lrmgen.document;

import java.util.List;

/**
 * The part every kind of entry shares.
 *
 * @param section The section path of the entry, outermost heading first. Empty for entries outside any section.
 * @param text    The paragraph text, possibly empty.
 * @param bullets The bullet points, possibly empty.
 */
public record Body(List<String> section, String text, List<Bullet> bullets) {
    public Body {
        section = List.copyOf(section);
        bullets = List.copyOf(bullets);
    }
}
