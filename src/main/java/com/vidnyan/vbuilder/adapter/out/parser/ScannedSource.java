package com.vidnyan.vbuilder.adapter.out.parser;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Result of scanning one source file: the tokens of the first module's
 * header (from {@code module} through the closing {@code ;}), the tokens of
 * its body up to {@code endmodule}, and every macro defined in the file.
 */
@Value
@Builder
public class ScannedSource {
    String sourcePath;
    List<Token> header;
    List<Token> body;
    Map<String, String> macros; // name -> raw replacement text, definition order
}
