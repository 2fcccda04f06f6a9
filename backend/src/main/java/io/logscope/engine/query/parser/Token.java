package io.logscope.engine.query.parser;

record Token(TokenType type, String text, int position) {

    boolean is(TokenType expected) {
        return type == expected;
    }

    boolean isOperator(String operator) {
        return type == TokenType.OPERATOR && text.equals(operator);
    }

    boolean isKeyword(String keyword) {
        return type == TokenType.KEYWORD && text.equals(keyword);
    }

    String describe() {
        return type == TokenType.EOF ? "end of expression" : "'" + text + "'";
    }
}
