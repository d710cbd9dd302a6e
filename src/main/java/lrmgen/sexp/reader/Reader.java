// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package lrmgen.sexp.reader;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import lrmgen.sexp.Sexp;
import lrmgen.sexp.SymbolTable;
import lrmgen.source.SourceLocation;
import lrmgen.util.UnreachableCodeReachedError;
import lrmgen.util.condition.ConditionContext;
import lrmgen.util.condition.UnhandledErrorError;
import lrmgen.util.condition.exception.IOExceptionCondition;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The S-expression reader: the primary means of converting a stream of bytes into a stream of {@link Sexp} objects.
 * <p>
 * Besides lists, symbols and {@code "strings"}, the reader understands raw strings: {@code '''} opens one, and the
 * last three quotes of the next run of three or more quotes close it. Nothing in between is interpreted.
 * <p>
 * Line and column numbers are 1-based and count bytes; offsets are 0-based byte offsets.
 */
public final class Reader {
    /**
     * Initializes a new S-expression reader that will read bytes from the given byte stream.
     * <p>
     * All symbols read will be interned into the given symbol table. {@code sourceName} is used in locations.
     */
    public Reader(final ByteStream stream, final SymbolTable symbolTable, final String sourceName) {
        this.stream = stream;
        this.symbolTable = symbolTable;
        this.sourceName = sourceName;
        topLevelFormLocation = here();
    }

    /**
     * Attempts to parse the next top-level S-expression.
     *
     * <ul>
     * <li>If an S-expression was correctly parsed, its object representation in the form of a {@link Sexp} is returned.
     * <li>If the end of input is reached, {@code null} is returned.
     * <li>If a parse error occurs, a fatal {@link ReadErrorCondition} condition is signaled.
     * <li>If an I/O error occurs, the {@link IOException} is caught and signaled as a fatal
     * {@link IOExceptionCondition}.
     * </ul>
     */
    public @Nullable Sexp readTopLevelForm() {
        if (skipSkippables().hitEof()) {
            return null;
        }
        currentDepth = 0;
        topLevelFormLocation = here();
        return readForm();
    }

    /**
     * Retrieves the user-readable name of the source being read, as used in locations.
     */
    public String sourceName() {
        return sourceName;
    }

    /**
     * Retrieves the location of the start of the most recently read top-level form.
     */
    public SourceLocation topLevelFormLocation() {
        return topLevelFormLocation;
    }

    private HitEof skipSkippables() {
        while (true) {
            if (stream.reachedEnd()) {
                return HitEof.YES;
            }
            final var b = stream.peek();
            if (ByteClass.of(b) != ByteClass.SKIPPABLE) {
                return HitEof.NO;
            }
            take();
            if (b == ';' && skipComment().hitEof()) {
                return HitEof.YES;
            }
        }
    }

    private HitEof skipComment() {
        while (true) {
            if (stream.reachedEnd()) {
                return HitEof.YES;
            }
            if (take() == '\n') {
                return HitEof.NO;
            }
        }
    }

    private Sexp readForm() {
        currentDepth += 1;
        try {
            if (currentDepth > maxDepth) {
                throw signalReadError("Recursion limit reached, try to limit nesting");
            }

            final var b = stream.peek();
            switch (ByteClass.of(b)) {
                case RESERVED -> throw signalReservedCharacterError(b);
                case SKIPPABLE -> throw new UnreachableCodeReachedError(
                    "readForm called without preceding skipSkippables");
                case SEPARATOR, REGULAR -> {
                }
            }

            return switch (b) {
                case ')' -> throw signalReadError("Expected a form, but found ')' instead");
                case '(' -> readList();
                case '"' -> readString();
                case '\'' -> readRawString();
                default -> readSymbol();
            };
        } finally {
            currentDepth -= 1;
        }
    }

    private Sexp.List readList() {
        final var location = here();
        take();
        final var list = new ArrayList<Sexp>();
        while (true) {
            if (skipSkippables().hitEof()) {
                throw signalReadError("Expected closing ')' but found end of input instead");
            }
            if (stream.peek() == ')') {
                take();
                break;
            }
            list.add(readForm());
        }
        return new Sexp.List(list, location);
    }

    private Sexp.String readString() {
        final var location = here();
        take();
        final var contentsBytes = new ByteArrayOutputStream(initialStringCapacity);
        var inEscapeSequence = false;
        outerLoop:
        while (true) {
            if (stream.reachedEnd()) {
                throw signalReadError("Expected closing '\"' but found end of input instead");
            }
            final var b = take();
            if (inEscapeSequence) {
                inEscapeSequence = false;
                contentsBytes.write(b);
            } else {
                switch (b) {
                    case '"' -> {
                        break outerLoop;
                    }
                    case '\\' -> inEscapeSequence = true;
                    default -> contentsBytes.write(b);
                }
            }
        }

        return new Sexp.String(convertUtf8(contentsBytes.toByteArray()), location);
    }

    private Sexp.RawString readRawString() {
        final var location = here();
        for (int i = 0; i < rawStringDelimiter.length(); i += 1) {
            if (stream.reachedEnd() || stream.peek() != '\'') {
                throw signalReadError("Expected ''' to open a raw string");
            }
            take();
        }
        final var contentsBytes = new ByteArrayOutputStream(initialStringCapacity);
        var quoteRun = 0;
        while (true) {
            if (stream.reachedEnd()) {
                throw signalReadError("Expected closing ''' but found end of input instead");
            }
            final var b = take();
            contentsBytes.write(b);
            quoteRun = (b == '\'') ? quoteRun + 1 : 0;
            if (quoteRun >= rawStringDelimiter.length() && (stream.reachedEnd() || stream.peek() != '\'')) {
                break;
            }
        }
        final var bytes = contentsBytes.toByteArray();
        final var contents = convertUtf8(Arrays.copyOf(bytes, bytes.length - rawStringDelimiter.length()));
        return new Sexp.RawString(rawStringDelimiter + contents + rawStringDelimiter, location);
    }

    private Sexp readSymbol() {
        final var symbolNameBytes = new ByteArrayOutputStream(initialSymbolCapacity);
        symbolNameBytes.write(take());
        while (!stream.reachedEnd() && ByteClass.of(stream.peek()) == ByteClass.REGULAR) {
            symbolNameBytes.write(take());
        }
        return symbolTable.intern(convertUtf8(symbolNameBytes.toByteArray()));
    }

    private byte take() {
        final var b = stream.peek();
        stream.discardPeek();
        offset += 1;
        if (b == '\n') {
            lineNumber += 1;
            columnNumber = 1;
        } else {
            columnNumber += 1;
        }
        return b;
    }

    private SourceLocation here() {
        return new SourceLocation(sourceName, lineNumber, columnNumber, offset);
    }

    private String convertUtf8(final byte[] bytes) {
        try {
            return utf8Decoder.decode(ByteBuffer.wrap(bytes)).toString();
        } catch (final CharacterCodingException e) {
            throw signalReadError("Invalid UTF-8 byte sequence detected");
        }
    }

    private UnhandledErrorError signalReservedCharacterError(final byte b) {
        final var message = (b >= 0 && b <= lastControlByte)
            ? String.format("Reserved control character U+%04X found", b)
            : ("Reserved character '" + (char) b + "' found");
        throw signalReadError(message);
    }

    private UnhandledErrorError signalReadError(final String message) {
        throw ConditionContext.error(new ReadErrorCondition(message, here()));
    }

    private static CharsetDecoder newUtf8Decoder() {
        final var decoder = StandardCharsets.UTF_8.newDecoder();
        decoder.onMalformedInput(CodingErrorAction.REPORT);
        decoder.onUnmappableCharacter(CodingErrorAction.REPORT);
        return decoder;
    }

    private static final String rawStringDelimiter = "'''";
    private static final byte lastControlByte = 0x1F;
    private static final int initialStringCapacity = 256;
    private static final int initialSymbolCapacity = 16;
    private static final int maxDepth = 150;

    private final ByteStream stream;
    private final SymbolTable symbolTable;
    private final String sourceName;
    private final CharsetDecoder utf8Decoder = newUtf8Decoder();
    private int lineNumber = 1;
    private int columnNumber = 1;
    private int offset = 0;
    private int currentDepth = 0;
    private SourceLocation topLevelFormLocation;

    private enum ByteClass {
        REGULAR,
        SKIPPABLE,
        SEPARATOR,
        RESERVED;

        private static ByteClass of(final byte b) {
            return byteClasses[Byte.toUnsignedInt(b)];
        }

        private static final ByteClass[] byteClasses;

        static {
            final var classes = new ByteClass[256];
            Arrays.fill(classes, REGULAR);
            for (int i = 0; i <= lastControlByte; i += 1) {
                classes[i] = RESERVED;
            }
            classes[' '] = SKIPPABLE;
            classes['\r'] = SKIPPABLE;
            classes['\n'] = SKIPPABLE;
            classes['\t'] = SKIPPABLE;
            classes['\u000B'] = SKIPPABLE;
            classes['\u000C'] = SKIPPABLE;
            classes[';'] = SKIPPABLE;
            classes['('] = SEPARATOR;
            classes[')'] = SEPARATOR;
            classes['"'] = SEPARATOR;
            classes['\''] = SEPARATOR;
            classes['#'] = RESERVED;
            classes['|'] = RESERVED;
            classes['\\'] = RESERVED;
            classes[0x7F] = RESERVED;
            byteClasses = classes;
        }
    }
}
