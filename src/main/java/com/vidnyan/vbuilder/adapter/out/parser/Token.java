package com.vidnyan.vbuilder.adapter.out.parser;

import com.vidnyan.vbuilder.domain.model.Location;

/**
 * A lexical token with its position in the source.
 */
public record Token(
    TokenType type,
    String text,
    int line,
    int column
) {

    public boolean is(String value) {
        return text.equals(value);
    }

    public boolean isIdentifier() {
        return type == TokenType.IDENTIFIER;
    }

    public boolean isSymbol(String value) {
        return type == TokenType.SYMBOL && text.equals(value);
    }

    public Location location(String filePath) {
        return Location.at(filePath, line, column);
    }

    @Override
    public String toString() {
        return text + "@" + line + ":" + column;
    }
}
