package com.vidnyan.vbuilder.adapter.out.parser;

import java.util.List;

/**
 * Helpers over token lists.
 */
final class Tokens {

    private Tokens() {
    }

    /**
     * Canonical text of a token run: tokens are concatenated, with a single
     * space only where two word-like tokens would otherwise fuse.
     */
    static String render(List<Token> tokens) {
        StringBuilder sb = new StringBuilder();
        Token previous = null;
        for (Token token : tokens) {
            if (previous != null && needsSpace(previous, token)) {
                sb.append(' ');
            }
            sb.append(token.text());
            previous = token;
        }
        return sb.toString();
    }

    private static boolean needsSpace(Token left, Token right) {
        if (left.text().startsWith("\\")) {
            return true;
        }
        return isWord(left) && isWord(right);
    }

    private static boolean isWord(Token token) {
        return token.type() != TokenType.SYMBOL;
    }

    static boolean isOpener(Token token) {
        return token.type() == TokenType.SYMBOL
                && (token.is("(") || token.is("[") || token.is("{"));
    }

    static boolean isCloser(Token token) {
        return token.type() == TokenType.SYMBOL
                && (token.is(")") || token.is("]") || token.is("}"));
    }

    static String closerFor(String opener) {
        return switch (opener) {
            case "(" -> ")";
            case "[" -> "]";
            case "{" -> "}";
            default -> throw new IllegalArgumentException("Not an opener: " + opener);
        };
    }
}
