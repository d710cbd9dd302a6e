// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package lrmgen.bnf;

import lrmgen.source.SourceLocation;
import lrmgen.util.UnreachableCodeReachedError;
import lrmgen.util.condition.ConditionContext;
import lrmgen.util.condition.UnhandledErrorError;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The grammar notation lexer: turns the text between the triple-quote delimiters of a grammar bundle into a stream of
 * {@link Token}s.
 * <p>
 * Single line breaks are ordinary whitespace. A run of whitespace containing two or more line breaks ends the current
 * rule and becomes one {@link TokenKind#RULE_END} token; the end of the text always produces exactly one final
 * {@code RULE_END}, after which {@link #nextToken()} returns {@code null}.
 */
public final class Lexer {
    /**
     * Initializes a new lexer over the given grammar text.
     *
     * @param fragment The grammar text, without the enclosing delimiters.
     * @param anchor   The location of the opening delimiter in the manual source; token locations are computed
     *                 relative to it.
     */
    public Lexer(final String fragment, final SourceLocation anchor) {
        this.fragment = fragment;
        this.anchor = anchor;
    }

    /**
     * Returns the next token, or {@code null} once the final {@link TokenKind#RULE_END} has been returned.
     * <p>
     * If the text cannot be tokenized, a fatal {@link LexicalErrorCondition} is signaled.
     */
    public @Nullable Token nextToken() {
        if (finished) {
            return null;
        }
        final var whitespaceStart = position;
        final var whitespaceLine = lineNumber;
        final var whitespaceColumn = columnNumber;
        final var whitespaceOffset = byteOffset;
        final var lineBreaks = skipWhitespace();
        if (atEnd()) {
            finished = true;
            return new Token(TokenKind.RULE_END, null, null, position, position, here());
        }
        if (lineBreaks >= 2 && ruleInProgress) {
            ruleInProgress = false;
            return new Token(
                TokenKind.RULE_END,
                null,
                null,
                whitespaceStart,
                position - 1,
                locate(whitespaceLine, whitespaceColumn, whitespaceOffset)
            );
        }
        ruleInProgress = true;
        return lexToken();
    }

    private int skipWhitespace() {
        var lineBreaks = 0;
        while (!atEnd() && CharClass.of(current()) == CharClass.WHITESPACE) {
            if (current() == '\n') {
                lineBreaks += 1;
            }
            advance();
        }
        return lineBreaks;
    }

    private Token lexToken() {
        final var character = current();
        return switch (CharClass.of(character)) {
            case STRUCTURAL -> lexStructural(character);
            case COLON -> lexProductionOperator();
            case LOWERCASE -> lexName(TokenKind.NONTERMINAL);
            case UPPERCASE -> lexName(TokenKind.TERMINAL);
            case QUOTE -> lexSymbol();
            case OTHER -> throw signalError("unexpected character '" + character + '\'', here());
            case WHITESPACE -> throw new UnreachableCodeReachedError("lexToken called without skipping whitespace");
        };
    }

    private Token lexStructural(final char character) {
        final var kind = switch (character) {
            case '[' -> TokenKind.OPEN_OPTIONAL;
            case ']' -> TokenKind.CLOSE_OPTIONAL;
            case '{' -> TokenKind.OPEN_REPEAT;
            case '}' -> TokenKind.CLOSE_REPEAT;
            case '|' -> TokenKind.ALTERNATIVE;
            default -> throw new UnreachableCodeReachedError("Not a structural character: " + character);
        };
        final var location = here();
        final var start = position;
        advance();
        return new Token(kind, null, null, start, start, location);
    }

    private Token lexProductionOperator() {
        final var location = here();
        final var start = position;
        advance();
        for (final var expected : productionOperatorTail) {
            if (atEnd() || current() != expected) {
                throw signalError("malformed production operator, expected '::='", atEnd() ? location : here());
            }
            advance();
        }
        return new Token(TokenKind.PRODUCTION, null, null, start, position - 1, location);
    }

    private Token lexName(final TokenKind kind) {
        final var location = here();
        final var start = position;
        advance();
        while (!atEnd() && (Character.isLetter(current()) || current() == '_')) {
            advance();
        }
        final var text = fragment.substring(start, position);
        final var suffixStart = findSuffixStart(text, kind);
        if (suffixStart < 0) {
            return new Token(kind, text, null, start, position - 1, location);
        }
        if (text.charAt(suffixStart - 1) != '_') {
            throw signalError("malformed " + kind + " '" + text + "', the suffix must follow an underscore", location);
        }
        return new Token(
            kind,
            text.substring(0, suffixStart - 1),
            text.substring(suffixStart),
            start,
            position - 1,
            location
        );
    }

    private Token lexSymbol() {
        final var location = here();
        final var start = position;
        advance();
        while (!atEnd() && current() != '\'') {
            advance();
        }
        if (atEnd()) {
            throw signalError("unclosed token literal", location);
        }
        advance();
        return new Token(TokenKind.SYMBOL, fragment.substring(start + 1, position - 1), null, start, position - 1,
            location);
    }

    // Nonterminals switch from lowercase to an uppercase suffix, terminals the other way round.
    private static int findSuffixStart(final String text, final TokenKind kind) {
        final var length = text.length();
        for (int i = 1; i < length; i += 1) {
            final var character = text.charAt(i);
            final var switched = (kind == TokenKind.NONTERMINAL)
                ? Character.isUpperCase(character)
                : Character.isLowerCase(character);
            if (switched) {
                return i;
            }
        }
        return -1;
    }

    private boolean atEnd() {
        return position >= fragment.length();
    }

    private char current() {
        assert position < fragment.length();
        return fragment.charAt(position);
    }

    // Columns and offsets count UTF-8 bytes, like the manual reader does.
    private void advance() {
        final var character = current();
        final var width = encodedWidth(character);
        if (character == '\n') {
            lineNumber += 1;
            columnNumber = 1;
        } else {
            columnNumber += width;
        }
        byteOffset += width;
        position += 1;
    }

    // A surrogate pair takes four bytes, two per half.
    private static int encodedWidth(final char character) {
        if (character < 0x80) {
            return 1;
        } else if (character < 0x800 || Character.isSurrogate(character)) {
            return 2;
        } else {
            return 3;
        }
    }

    private SourceLocation here() {
        return locate(lineNumber, columnNumber, byteOffset);
    }

    private SourceLocation locate(final int line, final int column, final int fragmentOffset) {
        return new SourceLocation(
            anchor.sourceName(),
            anchor.lineNumber() + line - 1,
            (line == 1) ? anchor.columnNumber() + delimiterWidth + column - 1 : column,
            anchor.offset() + delimiterWidth + fragmentOffset
        );
    }

    private static UnhandledErrorError signalError(final String message, final SourceLocation location) {
        throw ConditionContext.error(new LexicalErrorCondition(message, location));
    }

    /**
     * The width of the delimiter grammar text is enclosed in, {@code '''}.
     */
    static final int delimiterWidth = 3;

    private static final char[] productionOperatorTail = {':', '='};

    private final String fragment;
    private final SourceLocation anchor;
    private int position = 0;
    private int lineNumber = 1;
    private int columnNumber = 1;
    private int byteOffset = 0;
    private boolean ruleInProgress = false;
    private boolean finished = false;

    private enum CharClass {
        WHITESPACE,
        STRUCTURAL,
        COLON,
        QUOTE,
        LOWERCASE,
        UPPERCASE,
        OTHER;

        private static CharClass of(final char character) {
            switch (character) {
                case '[', ']', '{', '}', '|':
                    return STRUCTURAL;
                case ':':
                    return COLON;
                case '\'':
                    return QUOTE;
                default:
                    break;
            }
            if (Character.isWhitespace(character)) {
                return WHITESPACE;
            } else if (Character.isLowerCase(character)) {
                return LOWERCASE;
            } else if (Character.isUpperCase(character)) {
                return UPPERCASE;
            } else {
                return OTHER;
            }
        }
    }
}
