package com.vidnyan.vbuilder.adapter.out.parser;

public enum TokenType {
    IDENTIFIER,     // plain, escaped (\name) or system ($clog2) identifier
    NUMBER,         // 12, 8'hFF, 'b0, 1.5e3
    STRING,         // "text"
    SYMBOL,         // operators and punctuation
    MACRO           // `NAME that was not expanded
}
