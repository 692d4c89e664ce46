package com.vidnyan.vbuilder.adapter.out.parser;

import com.vidnyan.vbuilder.application.port.out.ModuleSourceParser;
import com.vidnyan.vbuilder.domain.model.VerilogModule;
import org.springframework.stereotype.Component;

/**
 * Scanner plus header parser behind the {@link ModuleSourceParser} port.
 * Stateless; every call uses fresh scanner and parser instances.
 */
@Component
public class VerilogModuleParser implements ModuleSourceParser {

    @Override
    public VerilogModule parse(String text, String sourcePath) {
        ScannedSource source = new VerilogLexer(text, sourcePath).scan();
        return new VerilogHeaderParser(source).parse();
    }
}
