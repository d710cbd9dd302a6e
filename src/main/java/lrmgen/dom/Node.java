// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package lrmgen.dom;

import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The base interface for DOM tree nodes.
 * <p>
 * DOM tree nodes are guaranteed to be immutable. Only text and element nodes exist.
 */
public sealed interface Node {
    /**
     * Returns a new DOM element node representing the given tag, with given attributes and no children.
     */
    static Element empty(final Tag tag, final List<Attribute> attributes) {
        return new Element(tag, attributes, List.of());
    }

    /**
     * Returns a new DOM element node representing the given tag, with given children and no attributes.
     */
    static Element simple(final Tag tag, final List<? extends Node> children) {
        return new Element(tag, List.of(), List.copyOf(children));
    }

    /**
     * Returns a new DOM element node representing the given tag, with a single child and no attributes.
     */
    static Element simple(final Tag tag, final Node child) {
        return new Element(tag, List.of(), List.of(child));
    }

    /**
     * Returns a new DOM element node representing the given tag, with a single text child and no attributes.
     */
    static Element simple(final Tag tag, final String text) {
        return simple(tag, new Text(text));
    }

    /**
     * DOM node representing bare text.
     */
    record Text(String text) implements Node {
    }

    /**
     * DOM node representing an HTML element, with optional attributes and optional children.
     */
    record Element(Tag tag, List<Attribute> attributes, List<Node> children) implements Node {
        public Element {
            attributes = List.copyOf(attributes);
            children = List.copyOf(children);
        }

        /**
         * Retrieves the attribute with the given name, or {@code null} if there's none.
         */
        public @Nullable Attribute attribute(final String name) {
            for (final var attribute : attributes) {
                if (name.equals(attribute.name())) {
                    return attribute;
                }
            }
            return null;
        }
    }
}
