package ai.pkgedit.syntax;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;
import org.jetbrains.annotations.Nullable;

/**
 * Lossless, immutable syntax tree for package manifests.
 *
 * <p>Every token keeps its own leading and trailing trivia, so {@link #toSource()} of an untouched tree is exactly the
 * text it was parsed from. Nodes are records and never change after construction; an edit produces new nodes along
 * the path from the edited node to the root (see {@link SyntaxRef}) and shares everything else by reference.
 */
public sealed interface Syntax {

    /** Child nodes in source order. Tokens are not nodes and are not included. */
    List<? extends Syntax> children();

    /**
     * Returns a copy of this node whose {@code index}-th child (as reported by {@link #children()}) is replaced.
     *
     * @throws IndexOutOfBoundsException if there is no such child
     * @throws ClassCastException if the replacement is not a valid node for that position
     */
    Syntax withChild(int index, Syntax newChild);

    @Nullable
    Token firstToken();

    @Nullable
    Token lastToken();

    void writeTo(StringBuilder sb);

    default String toSource() {
        var sb = new StringBuilder();
        writeTo(sb);
        return sb.toString();
    }

    private static <T extends Syntax> ImmutableList<T> replaced(List<T> nodes, int index, Syntax newChild, Class<T> type) {
        Objects.checkIndex(index, nodes.size());
        var copy = new ArrayList<T>(nodes);
        copy.set(index, type.cast(newChild));
        return ImmutableList.copyOf(copy);
    }

    private static IndexOutOfBoundsException noSuchChild(Syntax node, int index) {
        return new IndexOutOfBoundsException(
                "%s has no child at index %d".formatted(node.getClass().getSimpleName(), index));
    }

    private static void writeAll(List<? extends Syntax> nodes, StringBuilder sb) {
        for (var node : nodes) {
            node.writeTo(sb);
        }
    }

    // ---------------------------------------------------------------------------------------------------------------
    // File and statements

    record SourceFile(ImmutableList<Statement> statements, Token endOfFile) implements Syntax {
        @Override
        public List<Statement> children() {
            return statements;
        }

        @Override
        public SourceFile withChild(int index, Syntax newChild) {
            return new SourceFile(replaced(statements, index, newChild, Statement.class), endOfFile);
        }

        @Override
        public Token firstToken() {
            return statements.isEmpty() ? endOfFile : statements.get(0).firstToken();
        }

        @Override
        public Token lastToken() {
            return endOfFile;
        }

        @Override
        public void writeTo(StringBuilder sb) {
            writeAll(statements, sb);
            endOfFile.writeTo(sb);
        }
    }

    sealed interface Statement extends Syntax {}

    record ImportDecl(Token importKeyword, ImmutableList<Token> path) implements Statement {
        @Override
        public List<Syntax> children() {
            return List.of();
        }

        @Override
        public Syntax withChild(int index, Syntax newChild) {
            throw noSuchChild(this, index);
        }

        @Override
        public Token firstToken() {
            return importKeyword;
        }

        @Override
        public Token lastToken() {
            return path.isEmpty() ? importKeyword : path.get(path.size() - 1);
        }

        @Override
        public void writeTo(StringBuilder sb) {
            importKeyword.writeTo(sb);
            path.forEach(t -> t.writeTo(sb));
        }
    }

    /** {@code let name: Type = value} or {@code var ...}. */
    record VariableDecl(
            Token keyword, Token name, @Nullable TypeAnnotation type, @Nullable InitializerClause initializer)
            implements Statement {
        @Override
        public List<Syntax> children() {
            var result = new ArrayList<Syntax>(2);
            if (type != null) {
                result.add(type);
            }
            if (initializer != null) {
                result.add(initializer);
            }
            return result;
        }

        @Override
        public VariableDecl withChild(int index, Syntax newChild) {
            if (type != null && index == 0) {
                return new VariableDecl(keyword, name, (TypeAnnotation) newChild, initializer);
            }
            int initializerIndex = type != null ? 1 : 0;
            if (initializer != null && index == initializerIndex) {
                return new VariableDecl(keyword, name, type, (InitializerClause) newChild);
            }
            throw noSuchChild(this, index);
        }

        @Override
        public Token firstToken() {
            return keyword;
        }

        @Override
        public Token lastToken() {
            if (initializer != null) {
                return initializer.lastToken();
            }
            return type != null ? type.lastToken() : name;
        }

        @Override
        public void writeTo(StringBuilder sb) {
            keyword.writeTo(sb);
            name.writeTo(sb);
            if (type != null) {
                type.writeTo(sb);
            }
            if (initializer != null) {
                initializer.writeTo(sb);
            }
        }
    }

    /** A type annotation, kept as raw tokens; manifests only need it to round-trip. */
    record TypeAnnotation(Token colon, ImmutableList<Token> tokens) implements Syntax {
        @Override
        public List<Syntax> children() {
            return List.of();
        }

        @Override
        public Syntax withChild(int index, Syntax newChild) {
            throw noSuchChild(this, index);
        }

        @Override
        public Token firstToken() {
            return colon;
        }

        @Override
        public Token lastToken() {
            return tokens.isEmpty() ? colon : tokens.get(tokens.size() - 1);
        }

        @Override
        public void writeTo(StringBuilder sb) {
            colon.writeTo(sb);
            tokens.forEach(t -> t.writeTo(sb));
        }
    }

    record InitializerClause(Token equal, Expr value) implements Syntax {
        @Override
        public List<Expr> children() {
            return List.of(value);
        }

        @Override
        public InitializerClause withChild(int index, Syntax newChild) {
            if (index != 0) {
                throw noSuchChild(this, index);
            }
            return new InitializerClause(equal, (Expr) newChild);
        }

        @Override
        public Token firstToken() {
            return equal;
        }

        @Override
        public Token lastToken() {
            return value.lastToken();
        }

        @Override
        public void writeTo(StringBuilder sb) {
            equal.writeTo(sb);
            value.writeTo(sb);
        }
    }

    record ExpressionStatement(Expr expression) implements Statement {
        @Override
        public List<Expr> children() {
            return List.of(expression);
        }

        @Override
        public ExpressionStatement withChild(int index, Syntax newChild) {
            if (index != 0) {
                throw noSuchChild(this, index);
            }
            return new ExpressionStatement((Expr) newChild);
        }

        @Override
        public Token firstToken() {
            return expression.firstToken();
        }

        @Override
        public Token lastToken() {
            return expression.lastToken();
        }

        @Override
        public void writeTo(StringBuilder sb) {
            expression.writeTo(sb);
        }
    }

    // ---------------------------------------------------------------------------------------------------------------
    // Expressions

    /** An expression. Expressions always contain at least one token. */
    sealed interface Expr extends Syntax {
        @Override
        Token firstToken();

        @Override
        Token lastToken();

        /** Returns a copy with the first token transformed, typically to change its leading trivia. */
        Expr withFirstToken(UnaryOperator<Token> transform);

        /** Returns a copy with the last token transformed, typically to change its trailing trivia. */
        Expr withLastToken(UnaryOperator<Token> transform);
    }

    /** An expression made of exactly one token. */
    sealed interface LeafExpr extends Expr {
        Token token();

        LeafExpr withToken(Token token);

        @Override
        default List<Syntax> children() {
            return List.of();
        }

        @Override
        default Syntax withChild(int index, Syntax newChild) {
            throw noSuchChild(this, index);
        }

        @Override
        default Token firstToken() {
            return token();
        }

        @Override
        default Token lastToken() {
            return token();
        }

        @Override
        default LeafExpr withFirstToken(UnaryOperator<Token> transform) {
            return withToken(transform.apply(token()));
        }

        @Override
        default LeafExpr withLastToken(UnaryOperator<Token> transform) {
            return withToken(transform.apply(token()));
        }

        @Override
        default void writeTo(StringBuilder sb) {
            token().writeTo(sb);
        }
    }

    /** A string literal. The token text includes the quotes. */
    record StringLiteral(Token token) implements LeafExpr {

        /** Builds a single-line literal for {@code value}, escaping as needed. */
        public static StringLiteral of(String value) {
            var sb = new StringBuilder(value.length() + 2).append('"');
            for (int i = 0; i < value.length(); i++) {
                char c = value.charAt(i);
                switch (c) {
                    case '"' -> sb.append("\\\"");
                    case '\\' -> sb.append("\\\\");
                    case '\n' -> sb.append("\\n");
                    case '\r' -> sb.append("\\r");
                    case '\t' -> sb.append("\\t");
                    case '\0' -> sb.append("\\0");
                    default -> sb.append(c);
                }
            }
            return new StringLiteral(Token.of(TokenKind.STRING, sb.append('"').toString()));
        }

        @Override
        public StringLiteral withToken(Token token) {
            return new StringLiteral(token);
        }

        public boolean isMultiLine() {
            return token.text().startsWith("\"\"\"");
        }

        /**
         * The literal's value if it is a plain single-line literal with one segment, otherwise {@code null}.
         * Interpolated and multi-line literals have no single value.
         */
        @Nullable
        public String singleSegmentValue() {
            if (isMultiLine()) {
                return null;
            }
            String text = token.text();
            String body = text.substring(1, text.length() - 1);
            var sb = new StringBuilder(body.length());
            for (int i = 0; i < body.length(); i++) {
                char c = body.charAt(i);
                if (c != '\\') {
                    sb.append(c);
                    continue;
                }
                char next = body.charAt(++i);
                switch (next) {
                    case '(' -> {
                        return null;
                    }
                    case 'n' -> sb.append('\n');
                    case 'r' -> sb.append('\r');
                    case 't' -> sb.append('\t');
                    case '0' -> sb.append('\0');
                    case 'u' -> {
                        int close = body.indexOf('}', i);
                        int codePoint = Integer.parseInt(body.substring(i + 2, close), 16);
                        sb.appendCodePoint(codePoint);
                        i = close;
                    }
                    default -> sb.append(next);
                }
            }
            return sb.toString();
        }
    }

    /** Numeric literal. */
    record LiteralExpr(Token token) implements LeafExpr {
        @Override
        public LiteralExpr withToken(Token token) {
            return new LiteralExpr(token);
        }
    }

    /** A bare identifier reference such as {@code Package} or {@code true}. */
    record IdentifierExpr(Token token) implements LeafExpr {
        public static IdentifierExpr of(String name) {
            return new IdentifierExpr(Token.identifier(name));
        }

        public String name() {
            return token.text();
        }

        @Override
        public IdentifierExpr withToken(Token token) {
            return new IdentifierExpr(token);
        }
    }

    /** An infix operator inside a {@link SequenceExpr}, e.g. {@code +} or {@code ..<}. */
    record BinaryOperatorExpr(Token token) implements LeafExpr {
        public String symbol() {
            return token.text();
        }

        @Override
        public BinaryOperatorExpr withToken(Token token) {
            return new BinaryOperatorExpr(token);
        }
    }

    /** {@code base.name}, or the implicit member expression {@code .name} when {@code base} is null. */
    record MemberAccessExpr(@Nullable Expr base, Token period, Token name) implements Expr {
        public static MemberAccessExpr implicit(String name) {
            return new MemberAccessExpr(null, Token.period(), Token.identifier(name));
        }

        @Override
        public List<Expr> children() {
            return base == null ? List.of() : List.of(base);
        }

        @Override
        public MemberAccessExpr withChild(int index, Syntax newChild) {
            if (base == null || index != 0) {
                throw noSuchChild(this, index);
            }
            return new MemberAccessExpr((Expr) newChild, period, name);
        }

        @Override
        public Token firstToken() {
            return base != null ? base.firstToken() : period;
        }

        @Override
        public Token lastToken() {
            return name;
        }

        @Override
        public MemberAccessExpr withFirstToken(UnaryOperator<Token> transform) {
            if (base != null) {
                return new MemberAccessExpr(base.withFirstToken(transform), period, name);
            }
            return new MemberAccessExpr(null, transform.apply(period), name);
        }

        @Override
        public MemberAccessExpr withLastToken(UnaryOperator<Token> transform) {
            return new MemberAccessExpr(base, period, transform.apply(name));
        }

        @Override
        public void writeTo(StringBuilder sb) {
            if (base != null) {
                base.writeTo(sb);
            }
            period.writeTo(sb);
            name.writeTo(sb);
        }
    }

    /** {@code callee(arguments)}. */
    record CallExpr(Expr callee, Token leftParen, ArgumentList arguments, Token rightParen) implements Expr {
        public static CallExpr of(Expr callee, ArgumentList arguments) {
            return new CallExpr(
                    callee, Token.of(TokenKind.LEFT_PAREN, "("), arguments, Token.of(TokenKind.RIGHT_PAREN, ")"));
        }

        /**
         * The called name: {@code Package} for {@code Package(...)}, {@code target} for {@code .target(...)}, or
         * null for any other callee shape.
         */
        @Nullable
        public String calleeName() {
            if (callee instanceof IdentifierExpr id) {
                return id.name();
            }
            if (callee instanceof MemberAccessExpr member) {
                return member.name().text();
            }
            return null;
        }

        public CallExpr withArguments(ArgumentList newArguments) {
            return new CallExpr(callee, leftParen, newArguments, rightParen);
        }

        @Override
        public List<Syntax> children() {
            return List.of(callee, arguments);
        }

        @Override
        public CallExpr withChild(int index, Syntax newChild) {
            return switch (index) {
                case 0 -> new CallExpr((Expr) newChild, leftParen, arguments, rightParen);
                case 1 -> new CallExpr(callee, leftParen, (ArgumentList) newChild, rightParen);
                default -> throw noSuchChild(this, index);
            };
        }

        @Override
        public Token firstToken() {
            return callee.firstToken();
        }

        @Override
        public Token lastToken() {
            return rightParen;
        }

        @Override
        public CallExpr withFirstToken(UnaryOperator<Token> transform) {
            return new CallExpr(callee.withFirstToken(transform), leftParen, arguments, rightParen);
        }

        @Override
        public CallExpr withLastToken(UnaryOperator<Token> transform) {
            return new CallExpr(callee, leftParen, arguments, transform.apply(rightParen));
        }

        @Override
        public void writeTo(StringBuilder sb) {
            callee.writeTo(sb);
            leftParen.writeTo(sb);
            arguments.writeTo(sb);
            rightParen.writeTo(sb);
        }
    }

    /** {@code [a, b, c]}. */
    record ArrayLiteral(Token leftBracket, ImmutableList<ArrayElement> elements, Token rightBracket) implements Expr {
        public static ArrayLiteral empty() {
            return new ArrayLiteral(
                    Token.of(TokenKind.LEFT_BRACKET, "["), ImmutableList.of(), Token.of(TokenKind.RIGHT_BRACKET, "]"));
        }

        public ArrayLiteral withElements(List<ArrayElement> newElements) {
            return new ArrayLiteral(leftBracket, ImmutableList.copyOf(newElements), rightBracket);
        }

        public ArrayLiteral withRightBracket(Token token) {
            return new ArrayLiteral(leftBracket, elements, token);
        }

        @Override
        public List<ArrayElement> children() {
            return elements;
        }

        @Override
        public ArrayLiteral withChild(int index, Syntax newChild) {
            return withElements(replaced(elements, index, newChild, ArrayElement.class));
        }

        @Override
        public Token firstToken() {
            return leftBracket;
        }

        @Override
        public Token lastToken() {
            return rightBracket;
        }

        @Override
        public ArrayLiteral withFirstToken(UnaryOperator<Token> transform) {
            return new ArrayLiteral(transform.apply(leftBracket), elements, rightBracket);
        }

        @Override
        public ArrayLiteral withLastToken(UnaryOperator<Token> transform) {
            return new ArrayLiteral(leftBracket, elements, transform.apply(rightBracket));
        }

        @Override
        public void writeTo(StringBuilder sb) {
            leftBracket.writeTo(sb);
            writeAll(elements, sb);
            rightBracket.writeTo(sb);
        }
    }

    /**
     * A flat run of operands and infix operators, e.g. {@code base + [x]} or {@code "1.0.0"..<"2.0.0"}. Elements
     * alternate between operands and {@link BinaryOperatorExpr}s, starting and ending with an operand.
     */
    record SequenceExpr(ImmutableList<Expr> elements) implements Expr {
        public SequenceExpr {
            if (elements.size() < 3 || elements.size() % 2 == 0) {
                throw new IllegalArgumentException("sequence needs operand (operator operand)+, got " + elements.size());
            }
        }

        public List<Expr> operands() {
            var result = new ArrayList<Expr>();
            for (int i = 0; i < elements.size(); i += 2) {
                result.add(elements.get(i));
            }
            return result;
        }

        public List<BinaryOperatorExpr> operators() {
            var result = new ArrayList<BinaryOperatorExpr>();
            for (int i = 1; i < elements.size(); i += 2) {
                result.add((BinaryOperatorExpr) elements.get(i));
            }
            return result;
        }

        @Override
        public List<Expr> children() {
            return elements;
        }

        @Override
        public SequenceExpr withChild(int index, Syntax newChild) {
            return new SequenceExpr(replaced(elements, index, newChild, Expr.class));
        }

        @Override
        public Token firstToken() {
            return elements.get(0).firstToken();
        }

        @Override
        public Token lastToken() {
            return elements.get(elements.size() - 1).lastToken();
        }

        @Override
        public SequenceExpr withFirstToken(UnaryOperator<Token> transform) {
            return withChild(0, elements.get(0).withFirstToken(transform));
        }

        @Override
        public SequenceExpr withLastToken(UnaryOperator<Token> transform) {
            int last = elements.size() - 1;
            return withChild(last, elements.get(last).withLastToken(transform));
        }

        @Override
        public void writeTo(StringBuilder sb) {
            writeAll(elements, sb);
        }
    }

    record ParenExpr(Token leftParen, Expr expression, Token rightParen) implements Expr {
        @Override
        public List<Expr> children() {
            return List.of(expression);
        }

        @Override
        public ParenExpr withChild(int index, Syntax newChild) {
            if (index != 0) {
                throw noSuchChild(this, index);
            }
            return new ParenExpr(leftParen, (Expr) newChild, rightParen);
        }

        @Override
        public Token firstToken() {
            return leftParen;
        }

        @Override
        public Token lastToken() {
            return rightParen;
        }

        @Override
        public ParenExpr withFirstToken(UnaryOperator<Token> transform) {
            return new ParenExpr(transform.apply(leftParen), expression, rightParen);
        }

        @Override
        public ParenExpr withLastToken(UnaryOperator<Token> transform) {
            return new ParenExpr(leftParen, expression, transform.apply(rightParen));
        }

        @Override
        public void writeTo(StringBuilder sb) {
            leftParen.writeTo(sb);
            expression.writeTo(sb);
            rightParen.writeTo(sb);
        }
    }

    // ---------------------------------------------------------------------------------------------------------------
    // Arguments and elements

    record ArgumentList(ImmutableList<Argument> arguments) implements Syntax {
        public static ArgumentList of(Argument... arguments) {
            return new ArgumentList(ImmutableList.copyOf(arguments));
        }

        /** Index of the first argument with the given label, or -1. */
        public int indexOf(String label) {
            for (int i = 0; i < arguments.size(); i++) {
                if (label.equals(arguments.get(i).labelText())) {
                    return i;
                }
            }
            return -1;
        }

        public ArgumentList withArguments(List<Argument> newArguments) {
            return new ArgumentList(ImmutableList.copyOf(newArguments));
        }

        @Override
        public List<Argument> children() {
            return arguments;
        }

        @Override
        public ArgumentList withChild(int index, Syntax newChild) {
            return new ArgumentList(replaced(arguments, index, newChild, Argument.class));
        }

        @Override
        @Nullable
        public Token firstToken() {
            return arguments.isEmpty() ? null : arguments.get(0).firstToken();
        }

        @Override
        @Nullable
        public Token lastToken() {
            return arguments.isEmpty() ? null : arguments.get(arguments.size() - 1).lastToken();
        }

        @Override
        public void writeTo(StringBuilder sb) {
            writeAll(arguments, sb);
        }
    }

    /** {@code label: value,} with the label and the separating comma both optional. */
    record Argument(@Nullable Token label, @Nullable Token colon, Expr value, @Nullable Token comma)
            implements Syntax {
        public Argument {
            if ((label == null) != (colon == null)) {
                throw new IllegalArgumentException("label and colon must be both present or both absent");
            }
        }

        public static Argument labeled(String label, Expr value) {
            return new Argument(Token.identifier(label), Token.colon(), value, null);
        }

        public static Argument unlabeled(Expr value) {
            return new Argument(null, null, value, null);
        }

        @Nullable
        public String labelText() {
            return label == null ? null : label.text();
        }

        public boolean hasTrailingComma() {
            return comma != null;
        }

        public Argument withComma(@Nullable Token newComma) {
            return new Argument(label, colon, value, newComma);
        }

        public Argument withValue(Expr newValue) {
            return new Argument(label, colon, newValue, comma);
        }

        public Argument withFirstToken(UnaryOperator<Token> transform) {
            if (label != null) {
                return new Argument(transform.apply(label), colon, value, comma);
            }
            return new Argument(null, null, value.withFirstToken(transform), comma);
        }

        @Override
        public List<Expr> children() {
            return List.of(value);
        }

        @Override
        public Argument withChild(int index, Syntax newChild) {
            if (index != 0) {
                throw noSuchChild(this, index);
            }
            return withValue((Expr) newChild);
        }

        @Override
        public Token firstToken() {
            return label != null ? label : value.firstToken();
        }

        @Override
        public Token lastToken() {
            return comma != null ? comma : value.lastToken();
        }

        @Override
        public void writeTo(StringBuilder sb) {
            if (label != null) {
                label.writeTo(sb);
                Objects.requireNonNull(colon).writeTo(sb);
            }
            value.writeTo(sb);
            if (comma != null) {
                comma.writeTo(sb);
            }
        }
    }

    record ArrayElement(Expr value, @Nullable Token comma) implements Syntax {
        public static ArrayElement of(Expr value) {
            return new ArrayElement(value, null);
        }

        public boolean hasTrailingComma() {
            return comma != null;
        }

        public ArrayElement withComma(@Nullable Token newComma) {
            return new ArrayElement(value, newComma);
        }

        public ArrayElement withValue(Expr newValue) {
            return new ArrayElement(newValue, comma);
        }

        @Override
        public List<Expr> children() {
            return List.of(value);
        }

        @Override
        public ArrayElement withChild(int index, Syntax newChild) {
            if (index != 0) {
                throw noSuchChild(this, index);
            }
            return withValue((Expr) newChild);
        }

        @Override
        public Token firstToken() {
            return value.firstToken();
        }

        @Override
        public Token lastToken() {
            return comma != null ? comma : value.lastToken();
        }

        @Override
        public void writeTo(StringBuilder sb) {
            value.writeTo(sb);
            if (comma != null) {
                comma.writeTo(sb);
            }
        }
    }
}
