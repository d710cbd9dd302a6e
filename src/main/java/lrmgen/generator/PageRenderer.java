// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package lrmgen.generator;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import lrmgen.bnf.Grammar;
import lrmgen.bnf.ProductionRenderer;
import lrmgen.document.Body;
import lrmgen.document.Entry;
import lrmgen.document.Manual;
import lrmgen.dom.Attribute;
import lrmgen.dom.Node;
import lrmgen.dom.Tag;
import lrmgen.util.Trace;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The page renderer: turns a manual and its checked grammar into a complete DOM tree.
 * <p>
 * Entries are rendered in document order. Headings are emitted whenever an entry's section path differs from the
 * previous entry's, starting at the first differing level; level 1 of a section path is an {@code <h2>}, the manual
 * title being the only {@code <h1>}.
 */
public final class PageRenderer {
    private PageRenderer(final Grammar grammar) {
        this.grammar = grammar;
    }

    /**
     * Renders the whole page of the given manual.
     *
     * @param grammar The sealed grammar built from the manual's entries.
     */
    public static Node.Element renderPage(final Manual manual, final Grammar grammar) {
        try (final var trace = new Trace(() -> "Rendering manual " + manual.title())) {
            trace.use();
            final var renderer = new PageRenderer(grammar);
            final var body = new ArrayList<Node>();
            body.add(renderHeader(manual.title(), manual.license()));
            for (final var entry : manual.entries()) {
                renderer.renderEntry(entry, body);
            }
            body.add(Node.simple(Tag.FOOTER, List.of(
                new Node.Text("Generated by "),
                Node.simple(Tag.CODE, RenderConstants.generatorName)
            )));
            return new Node.Element(
                Tag.HTML,
                List.of(Attribute.of("lang", RenderConstants.documentLanguage)),
                List.of(renderHead(manual.title()), Node.simple(Tag.BODY, body))
            );
        }
    }

    /**
     * Renders free text: whitespace is collapsed, and back-quoted runs become {@code <code>} elements.
     */
    public static List<Node> renderText(final String text) {
        final var normalized = String.join(" ", text.strip().split("\\s+"));
        final var result = new ArrayList<Node>();
        final var matcher = backtickRun.matcher(normalized);
        var position = 0;
        while (matcher.find()) {
            if (matcher.start() > position) {
                result.add(new Node.Text(normalized.substring(position, matcher.start())));
            }
            result.add(Node.simple(Tag.CODE, matcher.group(1)));
            position = matcher.end();
        }
        if (position < normalized.length()) {
            result.add(new Node.Text(normalized.substring(position)));
        }
        return result;
    }

    private static Node.Element renderHeader(final String title, final @Nullable String license) {
        final var heading = Node.simple(Tag.H1, title);
        if (license == null) {
            return Node.simple(Tag.HEADER, heading);
        }
        return Node.simple(Tag.HEADER, List.of(
            heading,
            new Node.Element(Tag.DIV, List.of(Attribute.of("class", RenderConstants.licenseClass)), renderText(license))
        ));
    }

    private static Node.Element renderHead(final String title) {
        return Node.simple(Tag.HEAD, List.of(
            Node.empty(Tag.META_CHARSET_UTF8, List.of()),
            Node.empty(Tag.META_NAMED, List.of(
                Attribute.of("name", "viewport"),
                Attribute.of("content", RenderConstants.viewport)
            )),
            Node.empty(Tag.META_NAMED, List.of(
                Attribute.of("name", "generator"),
                Attribute.of("content", RenderConstants.generatorName)
            )),
            Node.simple(Tag.TITLE, title),
            Node.simple(Tag.STYLE, RenderConstants.stylesheet)
        ));
    }

    private void renderEntry(final Entry entry, final List<Node> output) {
        final var body = entry.body();
        renderHeadings(sectionPathOf(entry), output);
        output.add(Node.simple(Tag.DIV, renderBody(body)));
        if (entry instanceof Entry.Terminal terminal) {
            output.add(renderCodeBlock(Node.simple(Tag.CODE, terminal.definition())));
        } else if (entry instanceof Entry.GrammarBlock grammarBlock) {
            output.add(renderCodeBlock(renderGrammar(grammarBlock.declaration().name())));
        }
    }

    private void renderHeadings(final List<String> sectionPath, final List<Node> output) {
        var identical = true;
        for (int i = 0; i < sectionPath.size(); i += 1) {
            final var heading = sectionPath.get(i);
            if (i >= previousSectionPath.size() || !heading.equals(previousSectionPath.get(i))) {
                identical = false;
            }
            if (!identical) {
                output.add(Node.simple(Tag.heading(i + 2), heading));
            }
        }
        previousSectionPath = sectionPath;
    }

    private Node.Element renderGrammar(final String bundleName) {
        final var productionNames = grammar.bundle(bundleName);
        if (productionNames == null) {
            throw new IllegalStateException("Grammar bundle " + bundleName + " was never parsed");
        }
        final var nodes = new ArrayList<Node>();
        for (final var productionName : productionNames) {
            if (!nodes.isEmpty()) {
                nodes.add(new Node.Text("\n"));
            }
            nodes.addAll(ProductionRenderer.renderHyperlinked(productionName, grammar));
        }
        return Node.simple(Tag.PRE, nodes);
    }

    private static List<Node> renderBody(final Body body) {
        final var result = new ArrayList<Node>();
        if (!body.text().isBlank()) {
            result.addAll(renderText(body.text()));
        }
        if (!body.bullets().isEmpty()) {
            final var items = new ArrayList<Node>();
            for (final var bullet : body.bullets()) {
                items.add(Node.simple(Tag.LI, renderText(bullet.text())));
            }
            result.add(Node.simple(Tag.UL, items));
        }
        return result;
    }

    private static Node.Element renderCodeBlock(final Node content) {
        return new Node.Element(
            Tag.DIV,
            List.of(Attribute.of("class", RenderConstants.codeBlockClass)),
            List.of(content)
        );
    }

    private static List<String> sectionPathOf(final Entry entry) {
        final var section = entry.body().section();
        final var extraHeading = entry.extraHeading();
        if (extraHeading == null) {
            return section;
        }
        final var result = new ArrayList<>(section);
        result.add(extraHeading);
        return result;
    }

    private static final Pattern backtickRun = Pattern.compile("`(.*?)`");

    private final Grammar grammar;
    private List<String> previousSectionPath = List.of();
}
