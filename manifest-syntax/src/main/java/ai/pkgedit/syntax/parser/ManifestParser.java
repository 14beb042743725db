package ai.pkgedit.syntax.parser;

import ai.pkgedit.syntax.Syntax.Argument;
import ai.pkgedit.syntax.Syntax.ArgumentList;
import ai.pkgedit.syntax.Syntax.ArrayElement;
import ai.pkgedit.syntax.Syntax.ArrayLiteral;
import ai.pkgedit.syntax.Syntax.BinaryOperatorExpr;
import ai.pkgedit.syntax.Syntax.CallExpr;
import ai.pkgedit.syntax.Syntax.Expr;
import ai.pkgedit.syntax.Syntax.ExpressionStatement;
import ai.pkgedit.syntax.Syntax.IdentifierExpr;
import ai.pkgedit.syntax.Syntax.ImportDecl;
import ai.pkgedit.syntax.Syntax.InitializerClause;
import ai.pkgedit.syntax.Syntax.LiteralExpr;
import ai.pkgedit.syntax.Syntax.MemberAccessExpr;
import ai.pkgedit.syntax.Syntax.ParenExpr;
import ai.pkgedit.syntax.Syntax.SequenceExpr;
import ai.pkgedit.syntax.Syntax.SourceFile;
import ai.pkgedit.syntax.Syntax.Statement;
import ai.pkgedit.syntax.Syntax.StringLiteral;
import ai.pkgedit.syntax.Syntax.TypeAnnotation;
import ai.pkgedit.syntax.Syntax.VariableDecl;
import ai.pkgedit.syntax.Token;
import ai.pkgedit.syntax.TokenKind;
import com.google.common.collect.ImmutableList;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Recursive-descent parser for the subset of the manifest language that package manifests use: imports, {@code let}
 * and {@code var} declarations, calls with labeled arguments, member access, array literals, string and number
 * literals, and infix operator sequences.
 *
 * <p>The result is lossless: {@code parse(text).toSource().equals(text)} for every text that parses.
 */
public final class ManifestParser {
    private final String source;
    private final List<Lexer.Lexed> tokens;
    private int index;

    private ManifestParser(String source, List<Lexer.Lexed> tokens) {
        this.source = source;
        this.tokens = tokens;
    }

    public static SourceFile parse(String source) throws ManifestParseException {
        var tokens = new Lexer(source).tokenize();
        return new ManifestParser(source, tokens).parseSourceFile();
    }

    private SourceFile parseSourceFile() throws ManifestParseException {
        var statements = ImmutableList.<Statement>builder();
        boolean first = true;
        while (peek().kind() != TokenKind.END_OF_FILE) {
            if (!first && !peek().startsOnNewLine()) {
                throw error("consecutive statements on a line are not supported");
            }
            statements.add(parseStatement());
            first = false;
        }
        return new SourceFile(statements.build(), next());
    }

    private Statement parseStatement() throws ManifestParseException {
        var token = peek();
        if (token.kind() == TokenKind.IDENTIFIER) {
            switch (token.text()) {
                case "import":
                    return parseImport();
                case "let":
                case "var":
                    return parseVariable();
                default:
                    break;
            }
        }
        return new ExpressionStatement(parseExpr());
    }

    private ImportDecl parseImport() throws ManifestParseException {
        var keyword = next();
        var path = ImmutableList.<Token>builder();
        path.add(expect(TokenKind.IDENTIFIER, "module name"));
        while (peek().kind() == TokenKind.PERIOD) {
            path.add(next());
            path.add(expect(TokenKind.IDENTIFIER, "module name"));
        }
        return new ImportDecl(keyword, path.build());
    }

    private VariableDecl parseVariable() throws ManifestParseException {
        var keyword = next();
        var name = expect(TokenKind.IDENTIFIER, "variable name");
        TypeAnnotation type = null;
        if (peek().kind() == TokenKind.COLON) {
            var colon = next();
            var typeTokens = ImmutableList.<Token>builder();
            parseType(typeTokens);
            type = new TypeAnnotation(colon, typeTokens.build());
        }
        InitializerClause initializer = null;
        if (peek().kind() == TokenKind.EQUAL) {
            var equal = next();
            initializer = new InitializerClause(equal, parseExpr());
        }
        return new VariableDecl(keyword, name, type, initializer);
    }

    // Type := '[' Type (':' Type)? ']' | Identifier ('.' Identifier)*, optionally followed by '?' or '!'
    private void parseType(ImmutableList.Builder<Token> out) throws ManifestParseException {
        if (peek().kind() == TokenKind.LEFT_BRACKET) {
            out.add(next());
            parseType(out);
            if (peek().kind() == TokenKind.COLON) {
                out.add(next());
                parseType(out);
            }
            out.add(expect(TokenKind.RIGHT_BRACKET, "']'"));
        } else {
            out.add(expect(TokenKind.IDENTIFIER, "type name"));
            while (peek().kind() == TokenKind.PERIOD) {
                out.add(next());
                out.add(expect(TokenKind.IDENTIFIER, "type name"));
            }
        }
        var suffix = peek();
        if (suffix.kind() == TokenKind.OPERATOR && (suffix.text().equals("?") || suffix.text().equals("!"))) {
            out.add(next());
        }
    }

    private Expr parseExpr() throws ManifestParseException {
        var operand = parsePostfix();
        if (!isInfixOperator(peek())) {
            return operand;
        }
        var elements = ImmutableList.<Expr>builder();
        elements.add(operand);
        while (isInfixOperator(peek())) {
            elements.add(new BinaryOperatorExpr(next()));
            elements.add(parsePostfix());
        }
        return new SequenceExpr(elements.build());
    }

    private static boolean isInfixOperator(Token token) {
        return token.kind() == TokenKind.OPERATOR || token.kind() == TokenKind.EQUAL;
    }

    private Expr parsePostfix() throws ManifestParseException {
        var expr = parsePrimary();
        while (true) {
            var token = peek();
            if (token.kind() == TokenKind.PERIOD) {
                var period = next();
                var name = expect(TokenKind.IDENTIFIER, "member name");
                expr = new MemberAccessExpr(expr, period, name);
            } else if (token.kind() == TokenKind.LEFT_PAREN && !token.startsOnNewLine()) {
                var leftParen = next();
                var arguments = parseArguments();
                var rightParen = expect(TokenKind.RIGHT_PAREN, "',' or ')'");
                expr = new CallExpr(expr, leftParen, arguments, rightParen);
            } else {
                return expr;
            }
        }
    }

    private Expr parsePrimary() throws ManifestParseException {
        var token = peek();
        switch (token.kind()) {
            case STRING:
                return new StringLiteral(next());
            case NUMBER:
                return new LiteralExpr(next());
            case IDENTIFIER:
                return new IdentifierExpr(next());
            case PERIOD: {
                var period = next();
                var name = expect(TokenKind.IDENTIFIER, "member name");
                return new MemberAccessExpr(null, period, name);
            }
            case LEFT_BRACKET:
                return parseArray();
            case LEFT_PAREN: {
                var leftParen = next();
                var inner = parseExpr();
                if (peek().kind() == TokenKind.COMMA) {
                    throw error("tuple expressions are not supported");
                }
                return new ParenExpr(leftParen, inner, expect(TokenKind.RIGHT_PAREN, "')'"));
            }
            default:
                throw error("expected expression");
        }
    }

    private ArrayLiteral parseArray() throws ManifestParseException {
        var leftBracket = next();
        var elements = ImmutableList.<ArrayElement>builder();
        while (peek().kind() != TokenKind.RIGHT_BRACKET) {
            var value = parseExpr();
            if (peek().kind() == TokenKind.COLON) {
                throw error("dictionary literals are not supported");
            }
            if (peek().kind() == TokenKind.COMMA) {
                elements.add(new ArrayElement(value, next()));
            } else {
                elements.add(new ArrayElement(value, null));
                break;
            }
        }
        var rightBracket = expect(TokenKind.RIGHT_BRACKET, "',' or ']'");
        return new ArrayLiteral(leftBracket, elements.build(), rightBracket);
    }

    private ArgumentList parseArguments() throws ManifestParseException {
        var arguments = ImmutableList.<Argument>builder();
        while (peek().kind() != TokenKind.RIGHT_PAREN) {
            Token label = null;
            Token colon = null;
            if (peek().kind() == TokenKind.IDENTIFIER && peek(1).kind() == TokenKind.COLON) {
                label = next();
                colon = next();
            }
            var value = parseExpr();
            @Nullable Token comma = peek().kind() == TokenKind.COMMA ? next() : null;
            arguments.add(new Argument(label, colon, value, comma));
            if (comma == null) {
                break;
            }
        }
        return new ArgumentList(arguments.build());
    }

    private Token peek() {
        return peek(0);
    }

    private Token peek(int ahead) {
        int i = Math.min(index + ahead, tokens.size() - 1);
        return tokens.get(i).token();
    }

    private Token next() {
        var token = tokens.get(index).token();
        if (index < tokens.size() - 1) {
            index++;
        }
        return token;
    }

    private Token expect(TokenKind kind, String what) throws ManifestParseException {
        if (peek().kind() != kind) {
            throw error("expected " + what);
        }
        return next();
    }

    private ManifestParseException error(String message) {
        var current = tokens.get(index);
        String found = current.token().kind() == TokenKind.END_OF_FILE ? "end of file" : "'" + current.token().text() + "'";
        return ManifestParseException.at(source, current.offset(), message + ", found " + found);
    }
}
