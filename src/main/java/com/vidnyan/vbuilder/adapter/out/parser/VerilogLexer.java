package com.vidnyan.vbuilder.adapter.out.parser;

import com.vidnyan.vbuilder.domain.error.ParseException;
import com.vidnyan.vbuilder.domain.error.SyntaxException;
import com.vidnyan.vbuilder.domain.model.Location;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.IntPredicate;

/**
 * Lexical scanner for Verilog and SystemVerilog source.
 * <p>
 * Comments and attribute instances are dropped. {@code `define} lines are
 * taken out of the token stream and recorded as raw name/body pairs; later
 * references to object-like macros are replaced by the tokens of their body.
 * Other compiler directives are skipped. Conditional compilation is not
 * evaluated: tokens of every branch are kept.
 * <p>
 * One lexer instance scans one text; it is not reusable.
 */
public class VerilogLexer {

    private static final int MAX_MACRO_DEPTH = 16;

    private static final Set<String> LINE_DIRECTIVES = Set.of(
            "include", "timescale", "default_nettype", "resetall", "celldefine",
            "endcelldefine", "pragma", "line", "begin_keywords", "end_keywords",
            "unconnected_drive", "nounconnected_drive", "undefineall");

    private static final Set<String> NAMED_CONDITIONALS = Set.of("ifdef", "ifndef", "elsif");
    private static final Set<String> BARE_CONDITIONALS = Set.of("else", "endif");

    // Longest first
    private static final String[] SYMBOLS = {
            "<<<=", ">>>=",
            "===", "!==", "<<<", ">>>", "<<=", ">>=", "==?", "!=?",
            "::", "**", "<<", ">>", "==", "!=", "<=", ">=", "&&", "||", "+:", "-:",
            "->", "##", "~&", "~|", "~^", "^~", "++", "--", "+=", "-=", ".*",
            "(", ")", "[", "]", "{", "}", ",", ";", ":", "=", "#", ".", "+", "-",
            "*", "/", "%", "!", "~", "&", "|", "^", "?", "<", ">", "@", "'", "$"
    };

    private final String text;
    private final String sourcePath;
    private final Map<String, String> macros;
    private final Set<String> functionLike;
    private final Map<String, String> active;
    private final int depth;

    private int pos;
    private int line = 1;
    private int column = 1;

    public VerilogLexer(String text, String sourcePath) {
        this(text, sourcePath, new LinkedHashMap<>(), new HashSet<>(), new LinkedHashMap<>(), 0);
    }

    private VerilogLexer(String text, String sourcePath, Map<String, String> macros,
                         Set<String> functionLike, Map<String, String> active, int depth) {
        this.text = text;
        this.sourcePath = sourcePath;
        this.macros = macros;
        this.functionLike = functionLike;
        this.active = active;
        this.depth = depth;
    }

    /**
     * Scan the text and cut out the first module declaration.
     * @throws SyntaxException when there is no module or its header never closes
     */
    public ScannedSource scan() {
        List<Token> tokens = tokenize();

        int start = -1;
        for (int i = 0; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (t.isIdentifier() && (t.is("module") || t.is("macromodule"))) {
                start = i;
                break;
            }
        }
        if (start < 0) {
            throw new SyntaxException("no module declaration found", Location.at(sourcePath, 1, 1));
        }

        int end = headerEnd(tokens, start);
        int bodyEnd = end + 1;
        while (bodyEnd < tokens.size() && !tokens.get(bodyEnd).is("endmodule")) {
            bodyEnd++;
        }

        return ScannedSource.builder()
                .sourcePath(sourcePath)
                .header(List.copyOf(tokens.subList(start, end + 1)))
                .body(List.copyOf(tokens.subList(end + 1, bodyEnd)))
                .macros(new LinkedHashMap<>(macros))
                .build();
    }

    /**
     * Index of the {@code ;} closing the header that starts at {@code start}.
     * Package import clauses between the name and the lists end with their own {@code ;}.
     */
    private int headerEnd(List<Token> tokens, int start) {
        int nesting = 0;
        boolean inImport = false;
        for (int i = start + 1; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (Tokens.isOpener(t)) {
                nesting++;
            } else if (Tokens.isCloser(t)) {
                nesting--;
                if (nesting < 0) {
                    throw new ParseException("unmatched '" + t.text() + "' in module header",
                            t.location(sourcePath));
                }
            } else if (nesting == 0 && t.isIdentifier() && t.is("import")) {
                inImport = true;
            } else if (nesting == 0 && t.isSymbol(";")) {
                if (!inImport) {
                    return i;
                }
                inImport = false;
            }
        }
        Token module = tokens.get(start);
        throw new SyntaxException("unterminated module header", module.location(sourcePath));
    }

    /**
     * Full token stream of the text; fills the macro table as a side effect.
     */
    List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespaceAndComments();
            if (pos >= text.length()) {
                return tokens;
            }
            char c = text.charAt(pos);
            int startLine = line;
            int startColumn = column;

            if (c == '`') {
                directive(tokens, startLine, startColumn);
            } else if (c == '"') {
                tokens.add(new Token(TokenType.STRING, string(), startLine, startColumn));
            } else if (Character.isDigit(c) || (c == '\'' && isBaseStart(pos + 1))) {
                tokens.add(new Token(TokenType.NUMBER, number(), startLine, startColumn));
            } else if (isIdentifierStart(c) || (c == '$' && pos + 1 < text.length()
                    && isIdentifierStart(text.charAt(pos + 1)))) {
                tokens.add(new Token(TokenType.IDENTIFIER, identifier(), startLine, startColumn));
            } else if (c == '\\') {
                tokens.add(new Token(TokenType.IDENTIFIER, escapedIdentifier(), startLine, startColumn));
            } else {
                tokens.add(new Token(TokenType.SYMBOL, symbol(), startLine, startColumn));
            }
        }
    }

    // ------------------------------------------------------------ directives

    private void directive(List<Token> tokens, int startLine, int startColumn) {
        advance(1);
        String name = identifierOrEmpty();
        if (name.isEmpty()) {
            throw new SyntaxException("stray '`'", Location.at(sourcePath, startLine, startColumn));
        }

        if (name.equals("define")) {
            define(startLine, startColumn);
        } else if (name.equals("undef")) {
            skipBlanks();
            active.remove(identifierOrEmpty());
        } else if (LINE_DIRECTIVES.contains(name)) {
            restOfLine();
        } else if (NAMED_CONDITIONALS.contains(name)) {
            skipBlanks();
            identifierOrEmpty();
        } else if (!BARE_CONDITIONALS.contains(name)) {
            reference(tokens, name, startLine, startColumn);
        }
    }

    private void define(int startLine, int startColumn) {
        skipBlanks();
        String name = identifierOrEmpty();
        if (name.isEmpty()) {
            throw new SyntaxException("`define without a macro name",
                    Location.at(sourcePath, startLine, startColumn));
        }
        boolean parameterized = pos < text.length() && text.charAt(pos) == '(';
        String body = stripLineComment(restOfLine()).strip();

        macros.put(name, body);
        active.put(name, body);
        if (parameterized) {
            functionLike.add(name);
        } else {
            functionLike.remove(name);
        }
    }

    private void reference(List<Token> tokens, String name, int startLine, int startColumn) {
        String body = active.get(name);
        if (body == null || functionLike.contains(name)) {
            tokens.add(new Token(TokenType.MACRO, "`" + name, startLine, startColumn));
            return;
        }
        if (depth >= MAX_MACRO_DEPTH) {
            throw new SyntaxException("macro expansion too deep at `" + name,
                    Location.at(sourcePath, startLine, startColumn));
        }
        VerilogLexer nested = new VerilogLexer(body, sourcePath, macros, functionLike, active, depth + 1);
        for (Token t : nested.tokenize()) {
            tokens.add(new Token(t.type(), t.text(), startLine, startColumn));
        }
    }

    /**
     * Remainder of the logical line, following backslash continuations.
     */
    private String restOfLine() {
        StringBuilder sb = new StringBuilder();
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (c == '\\' && pos + 1 < text.length() && isLineBreak(text.charAt(pos + 1))) {
                advance(1);
                skipLineBreak();
                sb.append('\n');
                continue;
            }
            if (isLineBreak(c)) {
                break;
            }
            sb.append(c);
            advance(1);
        }
        return sb.toString();
    }

    private static String stripLineComment(String body) {
        boolean inString = false;
        for (int i = 0; i + 1 < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '"') {
                inString = !inString;
            } else if (!inString && c == '/' && body.charAt(i + 1) == '/') {
                return body.substring(0, i);
            }
        }
        return body;
    }

    // ----------------------------------------------------------- token forms

    private String string() {
        int startLine = line;
        int startColumn = column;
        StringBuilder sb = new StringBuilder();
        sb.append('"');
        advance(1);
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (c == '\\' && pos + 1 < text.length()) {
                sb.append(c).append(text.charAt(pos + 1));
                advance(2);
                continue;
            }
            if (isLineBreak(c)) {
                break;
            }
            sb.append(c);
            advance(1);
            if (c == '"') {
                return sb.toString();
            }
        }
        throw new SyntaxException("unterminated string literal", Location.at(sourcePath, startLine, startColumn));
    }

    private String number() {
        int start = pos;
        if (text.charAt(pos) != '\'') {
            consumeWhile(ch -> Character.isDigit(ch) || ch == '_');
            if (peek(0) == '.' && Character.isDigit(peek(1))) {
                advance(1);
                consumeWhile(ch -> Character.isDigit(ch) || ch == '_');
            }
            if ((peek(0) == 'e' || peek(0) == 'E')
                    && (Character.isDigit(peek(1)) || ((peek(1) == '+' || peek(1) == '-') && Character.isDigit(peek(2))))) {
                advance(2);
                consumeWhile(Character::isDigit);
            }
        }
        if (peek(0) == '\'' && isBaseStart(pos + 1)) {
            advance(1);
            if (peek(0) == 's' || peek(0) == 'S') {
                advance(1);
            }
            char base = peek(0);
            if ("bBoOdDhH".indexOf(base) >= 0) {
                advance(1);
                while (peek(0) == ' ' || peek(0) == '\t') {
                    advance(1);
                }
                consumeWhile(ch -> Character.isLetterOrDigit(ch) || ch == '_' || ch == '?');
            } else {
                advance(1);
            }
        }
        return text.substring(start, pos).replaceAll("[ \\t]+", "");
    }

    private boolean isBaseStart(int index) {
        if (index >= text.length()) {
            return false;
        }
        char c = text.charAt(index);
        if (c == 's' || c == 'S') {
            return index + 1 < text.length() && "bBoOdDhH".indexOf(text.charAt(index + 1)) >= 0;
        }
        return "bBoOdDhH01xXzZ".indexOf(c) >= 0
                && !(index + 1 < text.length() && "01xXzZ".indexOf(c) >= 0
                        && isIdentifierPart(text.charAt(index + 1)));
    }

    private String identifier() {
        int start = pos;
        advance(1);
        consumeWhile(VerilogLexer::isIdentifierPart);
        return text.substring(start, pos);
    }

    private String identifierOrEmpty() {
        if (pos < text.length() && isIdentifierStart(text.charAt(pos))) {
            return identifier();
        }
        return "";
    }

    private String escapedIdentifier() {
        int start = pos;
        consumeWhile(ch -> !isSpace(ch));
        return text.substring(start, pos);
    }

    private String symbol() {
        for (String symbol : SYMBOLS) {
            if (text.startsWith(symbol, pos)) {
                advance(symbol.length());
                return symbol;
            }
        }
        String unknown = String.valueOf(text.charAt(pos));
        throw new SyntaxException("unexpected character '" + unknown + "'", Location.at(sourcePath, line, column));
    }

    // ------------------------------------------------------------- low level

    private void skipWhitespaceAndComments() {
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (isSpace(c)) {
                advance(1);
            } else if (text.startsWith("//", pos)) {
                while (pos < text.length() && !isLineBreak(text.charAt(pos))) {
                    advance(1);
                }
            } else if (text.startsWith("/*", pos)) {
                blockComment("/*", "*/", "comment");
            } else if (text.startsWith("(*", pos) && !text.startsWith("(*)", pos)) {
                blockComment("(*", "*)", "attribute");
            } else {
                return;
            }
        }
    }

    // Unicode spaces such as U+00A0 count too
    private static boolean isSpace(int c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c);
    }

    private void blockComment(String open, String close, String what) {
        int startLine = line;
        int startColumn = column;
        int endIndex = text.indexOf(close, pos + open.length());
        if (endIndex < 0) {
            throw new SyntaxException("unterminated " + what, Location.at(sourcePath, startLine, startColumn));
        }
        advance(endIndex + close.length() - pos);
    }

    private void skipBlanks() {
        while (pos < text.length() && (text.charAt(pos) == ' ' || text.charAt(pos) == '\t')) {
            advance(1);
        }
    }

    private void skipLineBreak() {
        if (peek(0) == '\r') {
            advance(1);
        }
        if (peek(0) == '\n') {
            advance(1);
        }
    }

    private void consumeWhile(IntPredicate predicate) {
        while (pos < text.length() && predicate.test(text.charAt(pos))) {
            advance(1);
        }
    }

    private char peek(int offset) {
        int index = pos + offset;
        return index < text.length() ? text.charAt(index) : '\0';
    }

    private void advance(int count) {
        for (int i = 0; i < count && pos < text.length(); i++) {
            if (text.charAt(pos) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
            pos++;
        }
    }

    private static boolean isLineBreak(char c) {
        return c == '\n' || c == '\r';
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentifierPart(int c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }
}
