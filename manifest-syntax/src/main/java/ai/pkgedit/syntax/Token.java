package ai.pkgedit.syntax;

import java.util.Objects;

/**
 * A single lexical token together with the trivia (whitespace and comments) that surrounds it.
 *
 * <p>Leading trivia is everything between the previous token's trailing trivia and this token's text. Trailing trivia
 * is the horizontal whitespace and comments that follow the token on the same line. Concatenating
 * {@code leadingTrivia + text + trailingTrivia} over all tokens of a file reproduces the file exactly.
 */
public record Token(TokenKind kind, String text, String leadingTrivia, String trailingTrivia) {

    public Token {
        Objects.requireNonNull(kind);
        Objects.requireNonNull(text);
        Objects.requireNonNull(leadingTrivia);
        Objects.requireNonNull(trailingTrivia);
    }

    public static Token of(TokenKind kind, String text) {
        return new Token(kind, text, "", "");
    }

    public static Token identifier(String name) {
        return of(TokenKind.IDENTIFIER, name);
    }

    public static Token comma() {
        return of(TokenKind.COMMA, ",");
    }

    public static Token colon() {
        return new Token(TokenKind.COLON, ":", "", " ");
    }

    public static Token period() {
        return of(TokenKind.PERIOD, ".");
    }

    public Token withLeadingTrivia(String trivia) {
        return new Token(kind, text, trivia, trailingTrivia);
    }

    public Token withTrailingTrivia(String trivia) {
        return new Token(kind, text, leadingTrivia, trivia);
    }

    /** True if a line break separates this token from whatever precedes it. */
    public boolean startsOnNewLine() {
        return leadingTrivia.indexOf('\n') >= 0;
    }

    public void writeTo(StringBuilder sb) {
        sb.append(leadingTrivia).append(text).append(trailingTrivia);
    }

    @Override
    public String toString() {
        return leadingTrivia + text + trailingTrivia;
    }
}
