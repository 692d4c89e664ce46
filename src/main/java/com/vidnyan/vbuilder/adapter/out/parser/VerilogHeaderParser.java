package com.vidnyan.vbuilder.adapter.out.parser;

import com.vidnyan.vbuilder.domain.error.ParseException;
import com.vidnyan.vbuilder.domain.model.Parameter;
import com.vidnyan.vbuilder.domain.model.Port;
import com.vidnyan.vbuilder.domain.model.PortDirection;
import com.vidnyan.vbuilder.domain.model.VerilogIdentifiers;
import com.vidnyan.vbuilder.domain.model.VerilogModule;
import com.vidnyan.vbuilder.domain.model.WidthSpec;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds a module descriptor from a scanned module header.
 * <p>
 * ANSI headers declare directions in the port list. Non-ANSI headers list
 * bare names and declare directions in the body; every listed name must be
 * declared there, and all missing names are reported in one error.
 * Widths are kept as written, never evaluated.
 */
public class VerilogHeaderParser {

    private static final Set<String> DATA_TYPE_KEYWORDS = Set.of(
            "wire", "reg", "logic", "bit", "byte", "shortint", "int", "longint", "integer",
            "time", "real", "shortreal", "realtime", "string", "tri", "tri0", "tri1",
            "triand", "trior", "trireg", "wand", "wor", "uwire", "supply0", "supply1",
            "var", "signed", "unsigned", "interconnect", "type");

    private static final Set<String> NET_KEYWORDS = Set.of(
            "wire", "reg", "logic", "bit", "tri", "uwire", "var", "integer");

    // Body constructs whose own arguments are not module ports
    private static final Map<String, String> BLOCK_TERMINATORS = Map.of(
            "function", "endfunction",
            "task", "endtask",
            "property", "endproperty",
            "sequence", "endsequence",
            "covergroup", "endgroup",
            "class", "endclass",
            "checker", "endchecker",
            "clocking", "endclocking");

    private final ScannedSource source;
    private final String path;

    public VerilogHeaderParser(ScannedSource source) {
        this.source = source;
        this.path = source.getSourcePath();
    }

    /**
     * Parse the header (and, where needed, the body declarations).
     * @throws ParseException on malformed declarations
     */
    public VerilogModule parse() {
        List<Token> header = source.getHeader();
        checkBalanced(header);

        int i = 1;
        while (i < header.size() && (header.get(i).is("automatic") || header.get(i).is("static"))) {
            i++;
        }
        Token nameToken = header.get(i);
        if (!nameToken.isIdentifier() || VerilogIdentifiers.isReserved(nameToken.text())) {
            throw new ParseException("expected module name, found '" + nameToken.text() + "'",
                    nameToken.location(path));
        }
        i++;

        List<Token> parameterList = null;
        List<Token> portList = null;
        Token portListOpen = nameToken;
        int last = header.size() - 1;
        while (i < last) {
            Token t = header.get(i);
            if (t.isIdentifier() && t.is("import")) {
                while (i < last && !header.get(i).isSymbol(";")) {
                    i++;
                }
                i++;
            } else if (t.isSymbol("#") && parameterList == null && portList == null) {
                if (i + 1 >= last || !header.get(i + 1).isSymbol("(")) {
                    throw new ParseException("expected '(' after '#'", t.location(path));
                }
                int close = matching(header, i + 1);
                parameterList = header.subList(i + 2, close);
                i = close + 1;
            } else if (t.isSymbol("(") && portList == null) {
                int close = matching(header, i);
                portList = header.subList(i + 1, close);
                portListOpen = t;
                i = close + 1;
            } else {
                throw new ParseException("unexpected '" + t.text() + "' in module header", t.location(path));
            }
        }

        List<Parameter> parameters = new ArrayList<>();
        if (parameterList != null) {
            parseParameters(parameterList, header.get(0), parameters);
        }

        List<List<Token>> items = portList == null || portList.isEmpty()
                ? List.of()
                : splitTopLevel(portList, ",", portListOpen);

        List<Port> ports;
        if (isNonAnsi(items)) {
            ports = parseNonAnsi(items, nameToken, parameterList == null ? parameters : null);
        } else {
            ports = parseAnsiPorts(items);
            scanAnsiBody(parameterList == null ? parameters : null, !items.isEmpty());
        }

        return VerilogModule.builder(nameToken.text())
                .sourcePath(path)
                .ports(ports)
                .parameters(parameters)
                .macros(source.getMacros())
                .build();
    }

    // ------------------------------------------------------------ parameters

    /**
     * Parameter keyword and type carried from one declarator to the next,
     * as in {@code parameter int A = 1, B = 2}.
     */
    private static final class ParameterContext {
        boolean local;
        String type;
        List<WidthSpec> packed = List.of();
    }

    private void parseParameters(List<Token> tokens, Token anchor, List<Parameter> out) {
        if (tokens.isEmpty()) {
            return;
        }
        ParameterContext context = new ParameterContext();
        for (List<Token> item : splitTopLevel(tokens, ",", anchor)) {
            out.add(parameter(item, context));
        }
    }

    private Parameter parameter(List<Token> item, ParameterContext context) {
        int start = 0;
        boolean keyword = false;
        Token first = item.get(0);
        if (first.isIdentifier() && (first.is("parameter") || first.is("localparam"))) {
            context.local = first.is("localparam");
            context.type = null;
            context.packed = List.of();
            keyword = true;
            start = 1;
        }

        List<Token> declaration = item.subList(start, item.size());
        int equals = indexOfTopLevel(declaration, "=");
        List<Token> lhs = equals < 0 ? declaration : declaration.subList(0, equals);
        List<Token> rhs = equals < 0 ? List.of() : declaration.subList(equals + 1, declaration.size());

        Declarator declarator = declarator(lhs, first);
        TypeInfo typeInfo = typeInfo(declarator.typeTokens());
        if (!declarator.typeTokens().isEmpty() || keyword) {
            context.type = typeInfo.text().isEmpty() ? null : typeInfo.text();
            context.packed = typeInfo.packed();
        }

        List<WidthSpec> dimensions = new ArrayList<>(context.packed);
        dimensions.addAll(declarator.unpacked());
        return new Parameter(declarator.name().text(), context.type, Tokens.render(rhs),
                dimensions, context.local);
    }

    // ------------------------------------------------------------- ANSI ports

    /**
     * Direction, type and packed widths carried to declarators that omit them,
     * as in {@code input [7:0] a, b}.
     */
    private static final class PortContext {
        PortDirection direction;
        String dataType;
        List<WidthSpec> packed = List.of();
    }

    private boolean isNonAnsi(List<List<Token>> items) {
        if (items.isEmpty()) {
            return false;
        }
        List<Token> first = items.get(0);
        return (first.size() == 1 && first.get(0).isIdentifier() && !PortDirection.isKeyword(first.get(0).text()))
                || first.get(0).isSymbol(".")
                || isPortExpression(first);
    }

    /**
     * A Verilog-2001 list entry such as {@code a[3:0]}: a plain name followed only by selects.
     */
    private boolean isPortExpression(List<Token> item) {
        Token name = item.get(0);
        if (item.size() < 2 || !name.isIdentifier() || PortDirection.isKeyword(name.text())
                || DATA_TYPE_KEYWORDS.contains(name.text())) {
            return false;
        }
        int i = 1;
        while (i < item.size()) {
            if (!item.get(i).isSymbol("[")) {
                return false;
            }
            i = matching(item, i) + 1;
        }
        return true;
    }

    private List<Port> parseAnsiPorts(List<List<Token>> items) {
        List<Port> ports = new ArrayList<>();
        PortContext context = new PortContext();
        Map<String, Token> seen = new LinkedHashMap<>();

        for (List<Token> item : items) {
            Token first = item.get(0);
            PortDirection direction = first.isIdentifier() ? PortDirection.fromKeyword(first.text()) : null;
            List<Token> rest = direction != null ? item.subList(1, item.size()) : item;
            int equals = indexOfTopLevel(rest, "=");
            if (equals >= 0) {
                rest = rest.subList(0, equals);
            }
            rejectInterfacePort(rest);

            Declarator declarator = declarator(rest, first);
            List<Token> typeTokens = declarator.typeTokens();

            if (direction != null) {
                TypeInfo typeInfo = typeInfo(typeTokens);
                context.direction = direction;
                context.dataType = typeInfo.text();
                context.packed = typeInfo.packed();
            } else if (!typeTokens.isEmpty()) {
                Token word = typeTokens.get(0);
                if (word.isIdentifier() && !DATA_TYPE_KEYWORDS.contains(word.text())
                        && (context.direction == null || looksLikeDirection(word.text()))) {
                    throw new ParseException("malformed direction keyword '" + word.text()
                            + "' for port '" + declarator.name().text() + "'", word.location(path));
                }
                TypeInfo typeInfo = typeInfo(typeTokens);
                if (context.direction == null) {
                    context.direction = PortDirection.INOUT;
                }
                context.dataType = typeInfo.text();
                context.packed = typeInfo.packed();
            }

            Token name = declarator.name();
            if (context.direction == null) {
                throw new ParseException("port '" + name.text() + "' has no direction", name.location(path));
            }
            if (seen.putIfAbsent(name.text(), name) != null) {
                throw new ParseException("duplicate port '" + name.text() + "'", name.location(path));
            }
            ports.add(port(name.text(), context.direction, context.dataType, context.packed, declarator.unpacked()));
        }
        return ports;
    }

    private void rejectInterfacePort(List<Token> tokens) {
        if (!tokens.isEmpty() && tokens.get(0).isIdentifier() && tokens.get(0).is("interface")) {
            throw new ParseException("interface port '" + Tokens.render(tokens) + "' is not supported",
                    tokens.get(0).location(path));
        }
        if (tokens.size() >= 3 && tokens.get(0).isIdentifier() && tokens.get(1).isSymbol(".")
                && !DATA_TYPE_KEYWORDS.contains(tokens.get(0).text())) {
            throw new ParseException("interface port '" + Tokens.render(tokens) + "' is not supported",
                    tokens.get(0).location(path));
        }
    }

    private void scanAnsiBody(List<Parameter> bodyParameters, boolean hasPortList) {
        List<Token> body = source.getBody();
        int i = 0;
        while (i < body.size()) {
            Token t = body.get(i);
            if (skippable(t)) {
                i = skipBlock(body, i);
            } else if (t.isIdentifier() && PortDirection.isKeyword(t.text())) {
                int end = statementEnd(body, i);
                Declarator declarator = declarator(body.subList(i + 1, firstItemEnd(body, i + 1, end)), t);
                String name = declarator.name().text();
                throw new ParseException(hasPortList
                        ? "port '" + name + "' declared in the body of a module with an ANSI-style header"
                        : "'" + name + "' is declared " + t.text() + " but is not in the port list",
                        t.location(path));
            } else if (bodyParameters != null && t.isIdentifier() && t.is("parameter")) {
                int end = statementEnd(body, i);
                parseParameters(body.subList(i, end), t, bodyParameters);
                i = end + 1;
            } else {
                i++;
            }
        }
    }

    // --------------------------------------------------------- non-ANSI ports

    private List<Port> parseNonAnsi(List<List<Token>> items, Token moduleName, List<Parameter> bodyParameters) {
        Map<String, Token> listed = new LinkedHashMap<>();
        for (List<Token> item : items) {
            Token name = listedName(item);
            if (listed.putIfAbsent(name.text(), name) != null) {
                throw new ParseException("duplicate port '" + name.text() + "'", name.location(path));
            }
        }

        Map<String, Port> declared = new LinkedHashMap<>();
        Map<String, Port> nets = new LinkedHashMap<>();
        List<Token> body = source.getBody();
        int i = 0;
        while (i < body.size()) {
            Token t = body.get(i);
            if (skippable(t)) {
                i = skipBlock(body, i);
            } else if (t.isIdentifier() && PortDirection.isKeyword(t.text())) {
                int end = statementEnd(body, i);
                for (Port port : declarations(body.subList(i + 1, end), PortDirection.fromKeyword(t.text()), t)) {
                    if (!listed.containsKey(port.name())) {
                        throw new ParseException("'" + port.name() + "' is declared " + t.text()
                                + " but is not in the port list", t.location(path));
                    }
                    if (declared.putIfAbsent(port.name(), port) != null) {
                        throw new ParseException("direction of port '" + port.name() + "' declared twice",
                                t.location(path));
                    }
                }
                i = end + 1;
            } else if (bodyParameters != null && t.isIdentifier() && t.is("parameter")) {
                int end = statementEnd(body, i);
                parseParameters(body.subList(i, end), t, bodyParameters);
                i = end + 1;
            } else if (t.isIdentifier() && NET_KEYWORDS.contains(t.text())) {
                int end = statementEnd(body, i);
                for (Port net : declarations(body.subList(i, end), PortDirection.INOUT, t)) {
                    nets.putIfAbsent(net.name(), net);
                }
                i = end + 1;
            } else {
                i++;
            }
        }

        List<String> undeclared = listed.keySet().stream()
                .filter(name -> !declared.containsKey(name))
                .toList();
        if (!undeclared.isEmpty()) {
            throw new ParseException("ports listed without a direction declaration: "
                    + String.join(", ", undeclared), moduleName.location(path));
        }

        List<Port> ports = new ArrayList<>();
        for (String name : listed.keySet()) {
            ports.add(merge(declared.get(name), nets.get(name)));
        }
        return ports;
    }

    /**
     * Name of a non-ANSI port list entry: {@code name} or {@code .name(expr)}.
     */
    private Token listedName(List<Token> item) {
        Token first = item.get(0);
        if (item.size() == 1 && first.isIdentifier()) {
            return first;
        }
        if (isPortExpression(item)) {
            return first;
        }
        if (first.isSymbol(".") && item.size() >= 2 && item.get(1).isIdentifier()) {
            return item.get(1);
        }
        throw new ParseException("unsupported port list entry '" + Tokens.render(item) + "'", first.location(path));
    }

    /**
     * Ports of a {@code [type] [packed] a [unpacked], b, ...} statement.
     */
    private List<Port> declarations(List<Token> statement, PortDirection direction, Token anchor) {
        List<Port> ports = new ArrayList<>();
        PortContext context = new PortContext();
        context.direction = direction;
        boolean firstItem = true;
        for (List<Token> item : splitTopLevel(statement, ",", anchor)) {
            int equals = indexOfTopLevel(item, "=");
            List<Token> lhs = equals < 0 ? item : item.subList(0, equals);
            Declarator declarator = declarator(lhs, anchor);
            if (firstItem) {
                TypeInfo typeInfo = typeInfo(declarator.typeTokens());
                context.dataType = typeInfo.text();
                context.packed = typeInfo.packed();
                firstItem = false;
            }
            ports.add(port(declarator.name().text(), direction, context.dataType, context.packed,
                    declarator.unpacked()));
        }
        return ports;
    }

    /**
     * A later {@code reg [7:0] q;} gives a width and type to a port declared without them.
     */
    private static Port merge(Port declared, Port net) {
        if (net == null) {
            return declared;
        }
        boolean untyped = Port.DEFAULT_DATA_TYPE.equals(declared.dataType());
        boolean unsized = declared.width().isAbsent() && declared.packedDimensions().isEmpty();
        return new Port(declared.name(), declared.direction(),
                untyped ? net.dataType() : declared.dataType(),
                unsized ? net.width() : declared.width(),
                unsized ? net.packedDimensions() : declared.packedDimensions(),
                declared.dimensions().isEmpty() ? net.dimensions() : declared.dimensions());
    }

    // ---------------------------------------------------------- declarators

    /**
     * {@code <type tokens> name <unpacked dimensions>}.
     */
    private record Declarator(List<Token> typeTokens, Token name, List<WidthSpec> unpacked) {
    }

    /**
     * Packed dimensions and the remaining type words of a declaration.
     */
    private record TypeInfo(String text, List<WidthSpec> packed) {
    }

    private Declarator declarator(List<Token> tokens, Token anchor) {
        int end = tokens.size();
        Deque<WidthSpec> unpacked = new ArrayDeque<>();
        while (end > 0 && tokens.get(end - 1).isSymbol("]")) {
            int open = matchingBackward(tokens, end - 1);
            unpacked.addFirst(dimension(tokens.subList(open + 1, end - 1), tokens.get(open)));
            end = open;
        }
        if (end == 0) {
            Token where = tokens.isEmpty() ? anchor : tokens.get(0);
            throw new ParseException("missing declaration name", where.location(path));
        }
        Token name = tokens.get(end - 1);
        if (!name.isIdentifier() || VerilogIdentifiers.isReserved(name.text())
                || DATA_TYPE_KEYWORDS.contains(name.text())) {
            throw new ParseException("expected a name, found '" + name.text() + "'", name.location(path));
        }
        return new Declarator(tokens.subList(0, end - 1), name, new ArrayList<>(unpacked));
    }

    private TypeInfo typeInfo(List<Token> tokens) {
        List<WidthSpec> packed = new ArrayList<>();
        List<Token> words = new ArrayList<>();
        int i = 0;
        while (i < tokens.size()) {
            Token t = tokens.get(i);
            if (t.isSymbol("[")) {
                int close = matching(tokens, i);
                packed.add(dimension(tokens.subList(i + 1, close), t));
                i = close + 1;
            } else {
                words.add(t);
                i++;
            }
        }
        return new TypeInfo(Tokens.render(words), packed);
    }

    /**
     * One bracketed dimension: {@code msb:lsb} or a SystemVerilog size.
     */
    private WidthSpec dimension(List<Token> inner, Token open) {
        if (inner.isEmpty()) {
            throw new ParseException("unsized dimension '[]' is not supported", open.location(path));
        }
        int colon = rangeColon(inner);
        if (colon < 0) {
            Token only = inner.get(0);
            if (inner.size() == 1 && (only.isSymbol("$") || only.isSymbol("*"))) {
                throw new ParseException("dynamic dimension '[" + only.text() + "]' is not supported",
                        open.location(path));
            }
            return WidthSpec.fromSize(Tokens.render(inner));
        }
        List<Token> msb = inner.subList(0, colon);
        List<Token> lsb = inner.subList(colon + 1, inner.size());
        if (msb.isEmpty() || lsb.isEmpty()) {
            throw new ParseException("incomplete range '[" + Tokens.render(inner) + "]'", open.location(path));
        }
        return WidthSpec.fromRange(Tokens.render(msb), Tokens.render(lsb));
    }

    /**
     * The {@code :} separating msb from lsb, skipping those of {@code ?:} operators.
     */
    private static int rangeColon(List<Token> inner) {
        int depth = 0;
        int pendingTernary = 0;
        for (int i = 0; i < inner.size(); i++) {
            Token t = inner.get(i);
            if (Tokens.isOpener(t)) {
                depth++;
            } else if (Tokens.isCloser(t)) {
                depth--;
            } else if (depth == 0 && t.isSymbol("?")) {
                pendingTernary++;
            } else if (depth == 0 && t.isSymbol(":")) {
                if (pendingTernary == 0) {
                    return i;
                }
                pendingTernary--;
            }
        }
        return -1;
    }

    private static Port port(String name, PortDirection direction, String dataType,
                             List<WidthSpec> packed, List<WidthSpec> unpacked) {
        WidthSpec width = packed.isEmpty() ? WidthSpec.absent() : packed.get(0);
        List<WidthSpec> extra = packed.size() > 1 ? packed.subList(1, packed.size()) : List.of();
        return new Port(name, direction, dataType, width, extra, unpacked);
    }

    /**
     * Misspelt or wrongly-cased direction keyword such as {@code Input} or {@code ouput}.
     */
    static boolean looksLikeDirection(String word) {
        if (word.indexOf('_') >= 0 || word.chars().anyMatch(Character::isDigit)) {
            return false;
        }
        for (PortDirection direction : PortDirection.values()) {
            if (direction.keyword().equalsIgnoreCase(word) || editDistance(direction.keyword(), word) <= 2) {
                return true;
            }
        }
        return false;
    }

    private static int editDistance(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }

    // ------------------------------------------------------------ structure

    private void checkBalanced(List<Token> tokens) {
        Deque<Token> open = new ArrayDeque<>();
        for (Token t : tokens) {
            if (Tokens.isOpener(t)) {
                open.push(t);
            } else if (Tokens.isCloser(t)) {
                if (open.isEmpty()) {
                    throw new ParseException("unmatched '" + t.text() + "'", t.location(path));
                }
                Token opener = open.pop();
                if (!Tokens.closerFor(opener.text()).equals(t.text())) {
                    throw new ParseException("unmatched '" + opener.text() + "' (closed by '" + t.text()
                            + "' at " + t.line() + ":" + t.column() + ")", opener.location(path));
                }
            }
        }
        if (!open.isEmpty()) {
            Token opener = open.peek();
            throw new ParseException("unmatched '" + opener.text() + "'", opener.location(path));
        }
    }

    private int matching(List<Token> tokens, int openIndex) {
        int depth = 0;
        for (int i = openIndex; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (Tokens.isOpener(t)) {
                depth++;
            } else if (Tokens.isCloser(t)) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        Token open = tokens.get(openIndex);
        throw new ParseException("unmatched '" + open.text() + "'", open.location(path));
    }

    private int matchingBackward(List<Token> tokens, int closeIndex) {
        int depth = 0;
        for (int i = closeIndex; i >= 0; i--) {
            Token t = tokens.get(i);
            if (Tokens.isCloser(t)) {
                depth++;
            } else if (Tokens.isOpener(t)) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        Token close = tokens.get(closeIndex);
        throw new ParseException("unmatched '" + close.text() + "'", close.location(path));
    }

    private List<List<Token>> splitTopLevel(List<Token> tokens, String separator, Token anchor) {
        List<List<Token>> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i <= tokens.size(); i++) {
            boolean atEnd = i == tokens.size();
            Token t = atEnd ? null : tokens.get(i);
            if (!atEnd && Tokens.isOpener(t)) {
                depth++;
            } else if (!atEnd && Tokens.isCloser(t)) {
                depth--;
            } else if (atEnd || (depth == 0 && t.isSymbol(separator))) {
                if (i == start) {
                    Token where = atEnd ? (tokens.isEmpty() ? anchor : tokens.get(i - 1)) : t;
                    throw new ParseException("empty declaration", where.location(path));
                }
                parts.add(tokens.subList(start, i));
                start = i + 1;
            }
        }
        return parts;
    }

    private static int indexOfTopLevel(List<Token> tokens, String symbol) {
        int depth = 0;
        for (int i = 0; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (Tokens.isOpener(t)) {
                depth++;
            } else if (Tokens.isCloser(t)) {
                depth--;
            } else if (depth == 0 && t.isSymbol(symbol)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Index of the {@code ;} ending the statement that starts at {@code start}.
     */
    private int statementEnd(List<Token> tokens, int start) {
        int depth = 0;
        for (int i = start; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (Tokens.isOpener(t)) {
                depth++;
            } else if (Tokens.isCloser(t)) {
                depth--;
            } else if (depth <= 0 && t.isSymbol(";")) {
                return i;
            }
        }
        Token first = tokens.get(start);
        throw new ParseException("missing ';' after declaration", first.location(path));
    }

    private static int firstItemEnd(List<Token> tokens, int start, int end) {
        List<Token> statement = tokens.subList(start, end);
        int comma = indexOfTopLevel(statement, ",");
        int equals = indexOfTopLevel(statement, "=");
        int cut = statement.size();
        if (comma >= 0) {
            cut = comma;
        }
        if (equals >= 0 && equals < cut) {
            cut = equals;
        }
        return start + cut;
    }

    /**
     * Subroutine and verification blocks and DPI import/export lines declare no module ports.
     */
    private static boolean skippable(Token t) {
        return t.isIdentifier()
                && (BLOCK_TERMINATORS.containsKey(t.text()) || t.is("import") || t.is("export"));
    }

    private static int skipBlock(List<Token> tokens, int start) {
        Token t = tokens.get(start);
        if (t.is("import") || t.is("export")) {
            for (int i = start + 1; i < tokens.size(); i++) {
                if (tokens.get(i).isSymbol(";")) {
                    return i + 1;
                }
            }
            return tokens.size();
        }
        if (t.is("clocking")) {
            // "default clocking cb;" names an existing block and has no body
            for (int i = start + 1; i < tokens.size() && !tokens.get(i).isSymbol("@"); i++) {
                if (tokens.get(i).isSymbol(";")) {
                    return i + 1;
                }
            }
        }
        String terminator = BLOCK_TERMINATORS.get(t.text());
        for (int i = start + 1; i < tokens.size(); i++) {
            if (tokens.get(i).isIdentifier() && tokens.get(i).is(terminator)) {
                return i + 1;
            }
        }
        return tokens.size();
    }
}
