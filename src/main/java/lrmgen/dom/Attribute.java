// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package lrmgen.dom;

/**
 * A DOM element's attribute. Every attribute the generator emits has a string value.
 *
 * @param name  The name of the attribute, such as {@code href}.
 * @param value The unescaped value.
 */
public record Attribute(String name, String value) {
    /**
     * Returns a new attribute with the given name and value.
     */
    public static Attribute of(final String name, final String value) {
        return new Attribute(name, value);
    }
}
