package io.logscope.engine.query.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Splits filter text into tokens. Strings may use double or single quotes with backslash
 * escapes; numbers are decimal integers or floats with an optional exponent.
 */
final class Lexer {

    static final Set<String> KEYWORDS = Set.of(
            "and", "or", "not", "in", "contains", "startsWith", "endsWith", "matches", "true", "false", "nil");

    private static final String[] OPERATORS = {
            "==", "!=", "<=", ">=", "&&", "||", "<", ">", "!", "+", "-", "*", "/", "%"
    };

    private final String input;
    private int pos;

    private Lexer(String input) {
        this.input = input;
    }

    static List<Token> tokenize(String input) {
        return new Lexer(input).run();
    }

    private List<Token> run() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (pos >= input.length()) {
                tokens.add(new Token(TokenType.EOF, "", pos));
                return tokens;
            }
            tokens.add(next());
        }
    }

    private Token next() {
        int start = pos;
        char c = input.charAt(pos);

        if (c == '"' || c == '\'') {
            return readString(c);
        }
        if (Character.isDigit(c)) {
            return readNumber();
        }
        if (Character.isLetter(c) || c == '_') {
            while (pos < input.length() && isIdentifierPart(input.charAt(pos))) {
                pos++;
            }
            String word = input.substring(start, pos);
            return new Token(KEYWORDS.contains(word) ? TokenType.KEYWORD : TokenType.IDENTIFIER, word, start);
        }

        switch (c) {
            case '(':
                pos++;
                return new Token(TokenType.LPAREN, "(", start);
            case ')':
                pos++;
                return new Token(TokenType.RPAREN, ")", start);
            case '[':
                pos++;
                return new Token(TokenType.LBRACKET, "[", start);
            case ']':
                pos++;
                return new Token(TokenType.RBRACKET, "]", start);
            case ',':
                pos++;
                return new Token(TokenType.COMMA, ",", start);
            case '.':
                pos++;
                return new Token(TokenType.DOT, ".", start);
            default:
                break;
        }

        for (String operator : OPERATORS) {
            if (input.startsWith(operator, pos)) {
                pos += operator.length();
                return new Token(TokenType.OPERATOR, operator, start);
            }
        }
        throw new ParseException("unexpected character '" + c + "'", start);
    }

    private Token readString(char quote) {
        int start = pos;
        pos++;
        StringBuilder sb = new StringBuilder();
        while (pos < input.length()) {
            char c = input.charAt(pos++);
            if (c == quote) {
                return new Token(TokenType.STRING, sb.toString(), start);
            }
            if (c != '\\') {
                sb.append(c);
                continue;
            }
            if (pos >= input.length()) {
                break;
            }
            char escaped = input.charAt(pos++);
            switch (escaped) {
                case 'n' -> sb.append('\n');
                case 't' -> sb.append('\t');
                case 'r' -> sb.append('\r');
                case '\\', '"', '\'' -> sb.append(escaped);
                case 'u' -> sb.append(readUnicodeEscape());
                default -> throw new ParseException("invalid escape sequence '\\" + escaped + "'", pos - 2);
            }
        }
        throw new ParseException("unterminated string literal", start);
    }

    private char readUnicodeEscape() {
        if (pos + 4 > input.length()) {
            throw new ParseException("invalid unicode escape", pos - 2);
        }
        String hex = input.substring(pos, pos + 4);
        try {
            char value = (char) Integer.parseInt(hex, 16);
            pos += 4;
            return value;
        } catch (NumberFormatException e) {
            throw new ParseException("invalid unicode escape '\\u" + hex + "'", pos - 2);
        }
    }

    private Token readNumber() {
        int start = pos;
        boolean isFloat = false;
        consumeDigits();
        // "1.x" stays an integer followed by member access, only "1.5" is a float
        if (pos + 1 < input.length() && input.charAt(pos) == '.' && Character.isDigit(input.charAt(pos + 1))) {
            isFloat = true;
            pos++;
            consumeDigits();
        }
        if (pos < input.length() && (input.charAt(pos) == 'e' || input.charAt(pos) == 'E')) {
            int mark = pos;
            pos++;
            if (pos < input.length() && (input.charAt(pos) == '+' || input.charAt(pos) == '-')) {
                pos++;
            }
            if (pos < input.length() && Character.isDigit(input.charAt(pos))) {
                isFloat = true;
                consumeDigits();
            } else {
                pos = mark;
            }
        }
        if (pos < input.length() && isIdentifierPart(input.charAt(pos))) {
            throw new ParseException("malformed number", start);
        }
        return new Token(isFloat ? TokenType.FLOAT : TokenType.INTEGER, input.substring(start, pos), start);
    }

    private void consumeDigits() {
        while (pos < input.length() && (Character.isDigit(input.charAt(pos)) || input.charAt(pos) == '_')) {
            pos++;
        }
    }

    private void skipWhitespace() {
        while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
            pos++;
        }
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
