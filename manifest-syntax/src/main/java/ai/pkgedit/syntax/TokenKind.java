package ai.pkgedit.syntax;

/** Lexical categories of manifest tokens. */
public enum TokenKind {
    IDENTIFIER,
    STRING,
    NUMBER,
    LEFT_PAREN,
    RIGHT_PAREN,
    LEFT_BRACKET,
    RIGHT_BRACKET,
    COMMA,
    COLON,
    PERIOD,
    EQUAL,
    OPERATOR,
    END_OF_FILE
}
