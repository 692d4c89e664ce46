package com.vidnyan.vbuilder.domain.model;

import com.vidnyan.vbuilder.domain.error.InvalidNameException;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Identifier rules shared by the parser and the design graph.
 */
public final class VerilogIdentifiers {

    private static final Pattern SIMPLE = Pattern.compile("[A-Za-z_][A-Za-z0-9_$]*");
    private static final Pattern ESCAPED = Pattern.compile("\\\\\\S+");

    private static final Set<String> RESERVED = Set.of(
            "module", "endmodule", "macromodule", "input", "output", "inout",
            "wire", "reg", "logic", "parameter", "localparam", "assign",
            "always", "begin", "end", "if", "else", "case", "endcase",
            "function", "endfunction", "task", "endtask", "generate",
            "endgenerate", "genvar", "integer", "initial", "for", "while",
            "posedge", "negedge", "or", "and", "not", "signed", "unsigned",
            "supply0", "supply1", "tri", "default", "interface", "package",
            "import", "typedef", "bit", "byte", "int", "real", "time");

    private VerilogIdentifiers() {
    }

    /**
     * Simple (non-escaped) identifier that is not a reserved word.
     */
    public static boolean isIdentifier(String name) {
        return name != null && SIMPLE.matcher(name).matches() && !RESERVED.contains(name);
    }

    /**
     * Escaped identifier such as {@code \bus[0]}; needs trailing white space when emitted.
     */
    public static boolean isEscaped(String name) {
        return name != null && ESCAPED.matcher(name).matches();
    }

    /**
     * Text to emit for a name, terminating escaped identifiers with a space.
     */
    public static String emit(String name) {
        return isEscaped(name) ? name + " " : name;
    }

    public static boolean isReserved(String word) {
        return RESERVED.contains(word);
    }

    /**
     * Validate a caller-supplied name.
     * @throws InvalidNameException when the name is blank or not an identifier
     */
    public static String require(String what, String name) {
        if (!isIdentifier(name)) {
            throw new InvalidNameException(what, name);
        }
        return name;
    }
}
