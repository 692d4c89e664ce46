package com.vidnyan.vbuilder.adapter.out.parser;

import com.vidnyan.vbuilder.domain.error.ParseException;
import com.vidnyan.vbuilder.domain.error.SyntaxException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VerilogLexerTest {

    private static List<String> texts(String source) {
        return new VerilogLexer(source, "t.v").tokenize().stream().map(Token::text).toList();
    }

    @Test
    void tokenize_ShouldDropCommentsAndAttributes() {
        List<String> texts = texts("a /* block\n comment */ b // line\n (* keep = 1 *) c");

        assertEquals(List.of("a", "b", "c"), texts);
    }

    @Test
    void tokenize_ShouldTreatNoBreakSpaceAsWhitespace() {
        List<String> texts = texts("wire\u00A0a;\n\u3000assign a = 1'b0;");

        assertEquals(List.of("wire", "a", ";", "assign", "a", "=", "1'b0", ";"), texts);
    }

    @Test
    void tokenize_ShouldKeepSizedAndUnbasedNumbersWhole() {
        List<String> texts = texts("x = 8'hFF + 4'b10_1z + '0;");

        assertTrue(texts.contains("8'hFF"));
        assertTrue(texts.contains("4'b10_1z"));
        assertTrue(texts.contains("'0"));
    }

    @Test
    void tokenize_ShouldExpandObjectLikeMacroAtReference() {
        List<Token> tokens = new VerilogLexer("`define W 8 // bus width\n[`W-1:0]", "t.v").tokenize();

        assertEquals(List.of("[", "8", "-", "1", ":", "0", "]"), tokens.stream().map(Token::text).toList());
        // Expanded tokens take the position of the reference
        assertEquals(2, tokens.get(1).line());
        assertEquals(2, tokens.get(1).column());
    }

    @Test
    void tokenize_ShouldKeepFunctionLikeAndUndefinedMacrosOpaque() {
        List<Token> tokens = new VerilogLexer("`define MAX(a,b) ((a)>(b)?(a):(b))\n`MAX(1,2) `UNKNOWN", "t.v")
                .tokenize();

        assertEquals(TokenType.MACRO, tokens.get(0).type());
        assertEquals("`MAX", tokens.get(0).text());
        assertEquals("`UNKNOWN", tokens.get(tokens.size() - 1).text());
    }

    @Test
    void tokenize_ShouldReadEscapedAndSystemIdentifiers() {
        List<Token> tokens = new VerilogLexer("\\bus[0] $clog2", "t.v").tokenize();

        assertEquals("\\bus[0]", tokens.get(0).text());
        assertTrue(tokens.get(0).isIdentifier());
        assertEquals("$clog2", tokens.get(1).text());
        assertTrue(tokens.get(1).isIdentifier());
    }

    @Test
    void scan_ShouldSplitHeaderAndBodyAndRecordMacros() {
        String source = """
                `timescale 1ns/1ps
                `define DEPTH 16
                module m(input a);
                  wire x;
                endmodule
                """;

        ScannedSource scanned = new VerilogLexer(source, "m.v").scan();

        assertEquals("module", scanned.getHeader().get(0).text());
        assertEquals(";", scanned.getHeader().get(scanned.getHeader().size() - 1).text());
        assertEquals(List.of("wire", "x", ";"), scanned.getBody().stream().map(Token::text).toList());
        assertEquals("16", scanned.getMacros().get("DEPTH"));
        assertEquals("m.v", scanned.getSourcePath());
    }

    @Test
    void scan_ShouldRejectTextWithoutModule() {
        SyntaxException e = assertThrows(SyntaxException.class,
                () -> new VerilogLexer("wire x;", "none.v").scan());

        assertTrue(e.getMessage().startsWith("none.v:1:1"));
    }

    @Test
    void scan_ShouldReportUnterminatedHeaderAtModuleKeyword() {
        SyntaxException e = assertThrows(SyntaxException.class,
                () -> new VerilogLexer("\n  module m(input a", "h.v").scan());

        assertEquals(2, e.location().line());
        assertEquals(3, e.location().column());
    }

    @Test
    void scan_ShouldReportStrayClosingParenthesis() {
        assertThrows(ParseException.class,
                () -> new VerilogLexer("module m(input a));", "p.v").scan());
    }

    @Test
    void tokenize_ShouldRejectUnterminatedCommentAndString() {
        assertThrows(SyntaxException.class, () -> texts("a /* never closed"));
        assertThrows(SyntaxException.class, () -> texts("x = \"open\n"));
    }
}
