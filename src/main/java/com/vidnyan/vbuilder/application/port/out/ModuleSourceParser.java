package com.vidnyan.vbuilder.application.port.out;

import com.vidnyan.vbuilder.domain.model.VerilogModule;

/**
 * Port for turning Verilog source text into a module descriptor.
 * Implemented by adapters (e.g., the token-based header parser).
 */
public interface ModuleSourceParser {

    /**
     * Parse the first module declared in the text.
     * @param text Full source text
     * @param sourcePath Path recorded on the descriptor and used in error locations
     * @return Descriptor with ports, parameters and macro definitions
     * @throws com.vidnyan.vbuilder.domain.error.SyntaxException on malformed text
     * @throws com.vidnyan.vbuilder.domain.error.ParseException on malformed declarations
     */
    VerilogModule parse(String text, String sourcePath);
}
