// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package lrmgen.generator;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import lrmgen.bnf.Checker;
import lrmgen.bnf.Grammar;
import lrmgen.bnf.Parser;
import lrmgen.document.DocumentParser;
import lrmgen.document.Entry;
import lrmgen.document.Manual;
import lrmgen.dom.Node;
import lrmgen.dom.Serializer;
import lrmgen.dom.Verifier;
import lrmgen.sexp.SymbolTable;
import lrmgen.sexp.reader.ByteStream;
import lrmgen.sexp.reader.Reader;
import lrmgen.util.Trace;
import lrmgen.util.condition.ConditionContext;
import lrmgen.util.condition.exception.IOExceptionCondition;

/**
 * The entry point to the generation process proper.
 */
public final class Generator {
    /**
     * Initializes a new generator that will turn the given manual source file into the given HTML file.
     */
    public Generator(final Path sourcePath, final Path destinationPath) {
        this.sourcePath = sourcePath;
        this.destinationPath = destinationPath;
    }

    /**
     * Performs a full generation run.
     * <p>
     * A run consists of:
     * <ul>
     * <li>Loading the manual source,
     * <li>Registering the terminals declared by keyword and punctuation entries,
     * <li>Parsing every grammar bundle, in document order,
     * <li>Sealing and checking the grammar,
     * <li>Rendering, verifying and saving the page.
     * </ul>
     * <p>
     * The destination file is replaced only once the page has been completely written, so a run that signals a fatal
     * condition leaves it untouched. Unknown references are signaled as warnings and don't stop the run.
     * <p>
     * Since this method basically does everything, it can signal just about any
     * {@link lrmgen.util.condition.Condition}.
     */
    public void generate() {
        final var manual = loadManual();
        final var grammar = buildGrammar(manual);
        saveDomTree(PageRenderer.renderPage(manual, grammar));
    }

    /**
     * Builds the sealed and checked grammar of the given manual.
     * <p>
     * Terminals are registered before any grammar bundle is parsed, so productions may refer to keywords and
     * punctuation declared anywhere in the manual.
     */
    public static Grammar buildGrammar(final Manual manual) {
        final var grammar = new Grammar();
        try (final var trace = new Trace("Registering terminals")) {
            trace.use();
            for (final var entry : manual.entries()) {
                if (entry instanceof Entry.Keywords keywords) {
                    for (final var bullet : keywords.body().bullets()) {
                        grammar.registerTerminal(bullet.text(), bullet.location());
                    }
                } else if (entry instanceof Entry.Punctuation punctuation) {
                    for (final var bullet : punctuation.body().bullets()) {
                        grammar.registerBacktickTerminals(bullet.text(), bullet.location());
                    }
                }
            }
        }
        try (final var trace = new Trace("Parsing grammar bundles")) {
            trace.use();
            final var parser = new Parser(grammar);
            for (final var entry : manual.entries()) {
                if (entry instanceof Entry.GrammarBlock grammarBlock) {
                    parser.parse(grammarBlock.declaration());
                }
            }
        }
        grammar.seal();
        Checker.check(grammar);
        return grammar;
    }

    private Manual loadManual() {
        try (final var trace = new Trace(() -> "Loading manual source " + sourcePath)) {
            trace.use();
            try (final var stream = Files.newInputStream(sourcePath)) {
                final var reader = new Reader(new ByteStream(stream), new SymbolTable(), sourcePath.toString());
                return DocumentParser.parseManualForms(reader);
            } catch (final IOException e) {
                throw ConditionContext.error(new IOExceptionCondition(e));
            }
        }
    }

    private void saveDomTree(final Node rootNode) {
        Verifier.verify(rootNode);
        try (final var trace = new Trace(() -> "Saving HTML to " + destinationPath)) {
            trace.use();
            final var temporaryPath = createTemporaryFile();
            var moved = false;
            try {
                try (final var writer = Files.newBufferedWriter(temporaryPath, StandardCharsets.UTF_8)) {
                    writer.write("<!DOCTYPE html>");
                    Serializer.serialize(writer, rootNode);
                    writer.write('\n');
                }
                Files.move(
                    temporaryPath,
                    destinationPath,
                    StandardCopyOption.REPLACE_EXISTING,
                    StandardCopyOption.ATOMIC_MOVE
                );
                moved = true;
            } catch (final IOException e) {
                throw ConditionContext.error(new IOExceptionCondition(e));
            } finally {
                if (!moved) {
                    ConditionContext.withSuppressedExceptions(() -> Files.deleteIfExists(temporaryPath));
                }
            }
        }
    }

    private Path createTemporaryFile() {
        final var directory = destinationPath.toAbsolutePath().getParent();
        if (directory == null) {
            throw ConditionContext.error(new IOExceptionCondition(
                new IOException("Destination " + destinationPath + " has no parent directory")));
        }
        try {
            return Files.createTempFile(directory, ".lrmgen-", ".html.tmp");
        } catch (final IOException e) {
            throw ConditionContext.error(new IOExceptionCondition(e));
        }
    }

    private final Path sourcePath;
    private final Path destinationPath;
}
