package io.logscope.engine.query.parser;

import io.logscope.engine.query.FieldRegistry;
import io.logscope.engine.query.ast.Node;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Recursive descent parser for the log filter language.
 * <p>
 * Precedence, loosest first: {@code or}, {@code and}, {@code not}, comparisons and
 * predicates, {@code + -}, {@code * / %}, unary sign, then member access and calls.
 * {@code &&}, {@code ||} and {@code !} are accepted and normalised to their keyword forms.
 * Literal-only arrays are folded into {@link Node.ConstantSet}.
 */
public class ExpressionParser {

    private static final Set<String> COMPARISON_OPERATORS = Set.of("==", "!=", "<", "<=", ">", ">=");
    private static final Set<String> PREDICATES = Set.of("contains", "startsWith", "endsWith", "matches");
    private static final Set<String> BOOLEAN_OPERATORS;

    static {
        Set<String> ops = new LinkedHashSet<>(COMPARISON_OPERATORS);
        ops.addAll(PREDICATES);
        ops.add("in");
        ops.add("and");
        ops.add("or");
        BOOLEAN_OPERATORS = Set.copyOf(ops);
    }

    private final FieldRegistry registry;

    public ExpressionParser(FieldRegistry registry) {
        this.registry = registry;
    }

    public Node parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ParseException("empty expression");
        }
        Node root = new Cursor(Lexer.tokenize(expression)).parseExpression();
        if (!isBoolean(root)) {
            throw new ParseException("expression must evaluate to a boolean");
        }
        return root;
    }

    static boolean isBoolean(Node node) {
        if (node instanceof Node.Binary binary) {
            return BOOLEAN_OPERATORS.contains(binary.operator());
        }
        if (node instanceof Node.Unary unary) {
            return unary.operator().equals("not");
        }
        return node instanceof Node.BoolLiteral;
    }

    private final class Cursor {

        private final List<Token> tokens;
        private int index;

        private Cursor(List<Token> tokens) {
            this.tokens = tokens;
        }

        Node parseExpression() {
            Node node = parseOr();
            Token trailing = peek();
            if (!trailing.is(TokenType.EOF)) {
                throw new ParseException("unexpected " + trailing.describe(), trailing.position());
            }
            return node;
        }

        // --- Boolean layers -------------------------------------------------------------------

        private Node parseOr() {
            Node left = parseAnd();
            while (peek().isKeyword("or") || peek().isOperator("||")) {
                advance();
                left = new Node.Binary("or", left, parseAnd());
            }
            return left;
        }

        private Node parseAnd() {
            Node left = parseNot();
            while (peek().isKeyword("and") || peek().isOperator("&&")) {
                advance();
                left = new Node.Binary("and", left, parseNot());
            }
            return left;
        }

        private Node parseNot() {
            if (peek().isKeyword("not") || peek().isOperator("!")) {
                advance();
                return new Node.Unary("not", parseNot());
            }
            return parseComparison();
        }

        private Node parseComparison() {
            Node left = parseAdditive();
            Token token = peek();

            if (token.is(TokenType.OPERATOR) && COMPARISON_OPERATORS.contains(token.text())) {
                advance();
                return new Node.Binary(token.text(), left, parseAdditive());
            }
            if (token.is(TokenType.KEYWORD) && PREDICATES.contains(token.text())) {
                advance();
                return new Node.Binary(token.text(), left, parseAdditive());
            }
            if (token.isKeyword("in")) {
                advance();
                return new Node.Binary("in", left, foldConstants(parseAdditive()));
            }
            if (token.isKeyword("not") && peekAt(1).isKeyword("in")) {
                advance();
                advance();
                return new Node.Unary("not", new Node.Binary("in", left, foldConstants(parseAdditive())));
            }
            return left;
        }

        // --- Arithmetic -----------------------------------------------------------------------

        private Node parseAdditive() {
            Node left = parseMultiplicative();
            while (peek().isOperator("+") || peek().isOperator("-")) {
                String operator = advance().text();
                left = new Node.Binary(operator, left, parseMultiplicative());
            }
            return left;
        }

        private Node parseMultiplicative() {
            Node left = parseUnary();
            while (peek().isOperator("*") || peek().isOperator("/") || peek().isOperator("%")) {
                String operator = advance().text();
                left = new Node.Binary(operator, left, parseUnary());
            }
            return left;
        }

        private Node parseUnary() {
            if (peek().isOperator("-")) {
                advance();
                Node operand = parseUnary();
                if (operand instanceof Node.IntegerLiteral literal) {
                    return new Node.IntegerLiteral(-literal.value());
                }
                if (operand instanceof Node.FloatLiteral literal) {
                    return new Node.FloatLiteral(-literal.value());
                }
                return new Node.Unary("-", operand);
            }
            if (peek().isOperator("+")) {
                advance();
                return parseUnary();
            }
            return parsePostfix();
        }

        private Node parsePostfix() {
            Node node = parsePrimary();
            while (true) {
                if (peek().is(TokenType.DOT)) {
                    advance();
                    Token name = advance();
                    if (!name.is(TokenType.IDENTIFIER) && !name.is(TokenType.KEYWORD) && !name.is(TokenType.STRING)) {
                        throw new ParseException("expected property name after '.' but got " + name.describe(),
                                name.position());
                    }
                    node = new Node.Member(node, name.text());
                } else if (peek().is(TokenType.LBRACKET)) {
                    advance();
                    Token key = advance();
                    if (!key.is(TokenType.STRING)) {
                        throw new ParseException("expected quoted property name inside [] but got " + key.describe(),
                                key.position());
                    }
                    expect(TokenType.RBRACKET, "]");
                    node = new Node.Member(node, key.text());
                } else {
                    return node;
                }
            }
        }

        // --- Primaries ------------------------------------------------------------------------

        private Node parsePrimary() {
            Token token = advance();
            switch (token.type()) {
                case STRING:
                    return new Node.StringLiteral(token.text());
                case INTEGER:
                    return new Node.IntegerLiteral(parseLong(token));
                case FLOAT:
                    return new Node.FloatLiteral(Double.parseDouble(token.text().replace("_", "")));
                case LPAREN: {
                    Node inner = parseOr();
                    expect(TokenType.RPAREN, ")");
                    return inner;
                }
                case LBRACKET:
                    return parseArray();
                case IDENTIFIER:
                    return parseIdentifier(token);
                case KEYWORD:
                    if (token.text().equals("true") || token.text().equals("false")) {
                        return new Node.BoolLiteral(Boolean.parseBoolean(token.text()));
                    }
                    if (token.text().equals("nil")) {
                        return new Node.NilLiteral();
                    }
                    throw new ParseException("unexpected keyword '" + token.text() + "'", token.position());
                default:
                    throw new ParseException("unexpected " + token.describe(), token.position());
            }
        }

        private Node parseIdentifier(Token token) {
            if (peek().is(TokenType.LPAREN)) {
                advance();
                List<Node> arguments = new ArrayList<>();
                if (!peek().is(TokenType.RPAREN)) {
                    do {
                        arguments.add(parseOr());
                    } while (match(TokenType.COMMA));
                }
                expect(TokenType.RPAREN, ")");
                return new Node.Call(token.text(), arguments);
            }
            if (!registry.contains(token.text())) {
                throw new ParseException("unknown field '" + token.text() + "'", token.position());
            }
            return new Node.Identifier(token.text());
        }

        private Node parseArray() {
            List<Node> elements = new ArrayList<>();
            if (!peek().is(TokenType.RBRACKET)) {
                do {
                    elements.add(parseOr());
                } while (match(TokenType.COMMA));
            }
            expect(TokenType.RBRACKET, "]");
            return new Node.ArrayLiteral(elements);
        }

        private long parseLong(Token token) {
            try {
                return Long.parseLong(token.text().replace("_", ""));
            } catch (NumberFormatException e) {
                throw new ParseException("integer literal out of range: " + token.text(), token.position());
            }
        }

        // --- Token helpers --------------------------------------------------------------------

        private Token peek() {
            return tokens.get(index);
        }

        private Token peekAt(int offset) {
            return tokens.get(Math.min(index + offset, tokens.size() - 1));
        }

        private Token advance() {
            Token token = tokens.get(index);
            if (!token.is(TokenType.EOF)) {
                index++;
            }
            return token;
        }

        private boolean match(TokenType type) {
            if (peek().is(type)) {
                advance();
                return true;
            }
            return false;
        }

        private void expect(TokenType type, String text) {
            Token token = advance();
            if (!token.is(type)) {
                throw new ParseException("expected '" + text + "' but got " + token.describe(), token.position());
            }
        }
    }

    /** Arrays made only of scalar literals become an unordered constant set. */
    private static Node foldConstants(Node node) {
        if (!(node instanceof Node.ArrayLiteral array) || array.elements().isEmpty()) {
            return node;
        }
        Set<Object> values = new LinkedHashSet<>();
        for (Node element : array.elements()) {
            if (element instanceof Node.StringLiteral s) {
                values.add(s.value());
            } else if (element instanceof Node.IntegerLiteral i) {
                values.add(i.value());
            } else if (element instanceof Node.FloatLiteral f) {
                values.add(f.value());
            } else if (element instanceof Node.BoolLiteral b) {
                values.add(b.value());
            } else {
                return node;
            }
        }
        return new Node.ConstantSet(values);
    }
}
