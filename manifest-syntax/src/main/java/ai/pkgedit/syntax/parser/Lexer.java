package ai.pkgedit.syntax.parser;

import ai.pkgedit.syntax.Token;
import ai.pkgedit.syntax.TokenKind;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits manifest text into tokens, attaching every character of whitespace and comments to a token as trivia.
 *
 * <p>Trailing trivia stops at the first line break; a block comment that spans lines is never trailing trivia.
 */
final class Lexer {
    private static final String OPERATOR_CHARS = "/=-+!*%<>&|^~?";

    /** A token plus the offset of its text in the source, used for error positions. */
    record Lexed(Token token, int offset) {}

    private final String source;
    private int pos;

    Lexer(String source) {
        this.source = source;
    }

    List<Lexed> tokenize() throws ManifestParseException {
        var result = new ArrayList<Lexed>();
        while (true) {
            String leading = scanLeadingTrivia();
            int start = pos;
            if (pos >= source.length()) {
                result.add(new Lexed(new Token(TokenKind.END_OF_FILE, "", leading, ""), start));
                return result;
            }
            TokenKind kind = scanToken();
            String text = source.substring(start, pos);
            String trailing = scanTrailingTrivia();
            result.add(new Lexed(new Token(kind, text, leading, trailing), start));
        }
    }

    private String scanLeadingTrivia() throws ManifestParseException {
        int start = pos;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (startsWith("//")) {
                skipLineComment();
            } else if (startsWith("/*")) {
                skipBlockComment();
            } else {
                break;
            }
        }
        return source.substring(start, pos);
    }

    private String scanTrailingTrivia() throws ManifestParseException {
        int start = pos;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == ' ' || c == '\t') {
                pos++;
            } else if (startsWith("//")) {
                skipLineComment();
            } else if (startsWith("/*")) {
                int save = pos;
                skipBlockComment();
                if (source.substring(save, pos).indexOf('\n') >= 0) {
                    pos = save;
                    break;
                }
            } else {
                break;
            }
        }
        return source.substring(start, pos);
    }

    private void skipLineComment() {
        while (pos < source.length() && source.charAt(pos) != '\n') {
            pos++;
        }
    }

    // Block comments nest.
    private void skipBlockComment() throws ManifestParseException {
        int start = pos;
        int depth = 0;
        while (pos < source.length()) {
            if (startsWith("/*")) {
                depth++;
                pos += 2;
            } else if (startsWith("*/")) {
                depth--;
                pos += 2;
                if (depth == 0) {
                    return;
                }
            } else {
                pos++;
            }
        }
        throw ManifestParseException.at(source, start, "unterminated block comment");
    }

    private TokenKind scanToken() throws ManifestParseException {
        char c = source.charAt(pos);
        if (Character.isLetter(c) || c == '_') {
            pos++;
            while (pos < source.length() && isIdentifierPart(source.charAt(pos))) {
                pos++;
            }
            return TokenKind.IDENTIFIER;
        }
        if (c == '`') {
            int close = source.indexOf('`', pos + 1);
            if (close < 0) {
                throw ManifestParseException.at(source, pos, "unterminated escaped identifier");
            }
            pos = close + 1;
            return TokenKind.IDENTIFIER;
        }
        if (Character.isDigit(c)) {
            scanNumber();
            return TokenKind.NUMBER;
        }
        if (c == '"') {
            scanString();
            return TokenKind.STRING;
        }
        switch (c) {
            case '(' -> {
                pos++;
                return TokenKind.LEFT_PAREN;
            }
            case ')' -> {
                pos++;
                return TokenKind.RIGHT_PAREN;
            }
            case '[' -> {
                pos++;
                return TokenKind.LEFT_BRACKET;
            }
            case ']' -> {
                pos++;
                return TokenKind.RIGHT_BRACKET;
            }
            case ',' -> {
                pos++;
                return TokenKind.COMMA;
            }
            case ':' -> {
                pos++;
                return TokenKind.COLON;
            }
            default -> {}
        }
        if (c == '.') {
            if (peekChar(1) == '.') {
                // dot operators: ..< and ...
                while (pos < source.length() && (source.charAt(pos) == '.' || isOperatorChar(source.charAt(pos)))) {
                    pos++;
                }
                return TokenKind.OPERATOR;
            }
            pos++;
            return TokenKind.PERIOD;
        }
        if (c == '=' && !isOperatorChar(peekChar(1))) {
            pos++;
            return TokenKind.EQUAL;
        }
        if (isOperatorChar(c)) {
            while (pos < source.length() && isOperatorChar(source.charAt(pos)) && !startsWith("//")
                    && !startsWith("/*")) {
                pos++;
            }
            return TokenKind.OPERATOR;
        }
        throw ManifestParseException.at(source, pos, "unsupported character '" + c + "'");
    }

    private void scanNumber() {
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (isIdentifierPart(c)) {
                pos++;
            } else if (c == '.' && Character.isDigit(peekChar(1))) {
                pos++;
            } else {
                break;
            }
        }
    }

    private void scanString() throws ManifestParseException {
        int start = pos;
        if (startsWith("\"\"\"")) {
            pos += 3;
            while (pos < source.length()) {
                char c = source.charAt(pos);
                if (c == '\\') {
                    skipEscape(start);
                } else if (startsWith("\"\"\"")) {
                    pos += 3;
                    return;
                } else {
                    pos++;
                }
            }
            throw ManifestParseException.at(source, start, "unterminated multi-line string literal");
        }
        pos++;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '"') {
                pos++;
                return;
            }
            if (c == '\n') {
                break;
            }
            if (c == '\\') {
                skipEscape(start);
            } else {
                pos++;
            }
        }
        throw ManifestParseException.at(source, start, "unterminated string literal");
    }

    /** Skips a backslash escape, including a whole {@code \(...)} interpolation. */
    private void skipEscape(int literalStart) throws ManifestParseException {
        pos++;
        if (pos >= source.length()) {
            throw ManifestParseException.at(source, literalStart, "unterminated string literal");
        }
        if (source.charAt(pos) == 'u') {
            skipUnicodeEscape();
            return;
        }
        if (source.charAt(pos) != '(') {
            pos++;
            return;
        }
        pos++;
        int depth = 1;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '"') {
                scanString();
            } else if (c == '(') {
                depth++;
                pos++;
            } else if (c == ')') {
                depth--;
                pos++;
                if (depth == 0) {
                    return;
                }
            } else {
                pos++;
            }
        }
        throw ManifestParseException.at(source, literalStart, "unterminated string interpolation");
    }

    /** Braced unicode escape with one to eight hex digits naming a scalar value; {@code pos} is on the {@code u}. */
    private void skipUnicodeEscape() throws ManifestParseException {
        int escapeStart = pos - 1;
        pos++;
        if (pos >= source.length() || source.charAt(pos) != '{') {
            throw ManifestParseException.at(source, escapeStart, "expected '{' in \\u{...} escape");
        }
        pos++;
        int digitsStart = pos;
        while (pos < source.length() && Character.digit(source.charAt(pos), 16) >= 0) {
            pos++;
        }
        int digits = pos - digitsStart;
        if (digits == 0 || digits > 8 || pos >= source.length() || source.charAt(pos) != '}') {
            throw ManifestParseException.at(
                    source, escapeStart, "\\u{...} escape must contain 1 to 8 hex digits followed by '}'");
        }
        long value = Long.parseLong(source.substring(digitsStart, pos), 16);
        if (value > Character.MAX_CODE_POINT
                || (value >= Character.MIN_SURROGATE && value <= Character.MAX_SURROGATE)) {
            throw ManifestParseException.at(source, escapeStart, "invalid unicode scalar in \\u{...} escape");
        }
        pos++;
    }

    private boolean startsWith(String s) {
        return source.startsWith(s, pos);
    }

    private char peekChar(int ahead) {
        int i = pos + ahead;
        return i < source.length() ? source.charAt(i) : '\0';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private static boolean isOperatorChar(char c) {
        return c != '\0' && OPERATOR_CHARS.indexOf(c) >= 0;
    }
}
