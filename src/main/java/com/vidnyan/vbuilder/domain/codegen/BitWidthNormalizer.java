package com.vidnyan.vbuilder.domain.codegen;

import com.vidnyan.vbuilder.domain.model.Port;
import com.vidnyan.vbuilder.domain.model.VerilogIdentifiers;
import com.vidnyan.vbuilder.domain.model.WidthSpec;

import java.util.List;

/**
 * Turns width specifications into declaration fragments.
 * <ol>
 *   <li>absent or literal 1: no fragment</li>
 *   <li>literal N &gt; 1: {@code [N-1:0]} with N-1 computed</li>
 *   <li>expression E: {@code [E-1:0]}, E copied verbatim and never evaluated</li>
 *   <li>unpacked dimensions follow the signal name, each normalized the same way</li>
 * </ol>
 * Verbatim ranges are emitted as written. All methods are pure.
 */
public final class BitWidthNormalizer {

    private BitWidthNormalizer() {
    }

    /**
     * Packed fragment for one width, or the empty string.
     */
    public static String normalize(WidthSpec width) {
        if (width == null) {
            return "";
        }
        return switch (width.kind()) {
            case ABSENT -> "";
            case LITERAL -> width.literalValue() <= 1 ? "" : "[" + (width.literalValue() - 1) + ":0]";
            case EXPRESSION -> "[" + width.text() + "-1:0]";
            case RANGE -> "[" + width.text() + "]";
        };
    }

    /**
     * Convenience for tests and listings: {@code "8"} or {@code "WIDTH"}.
     */
    public static String normalize(String width) {
        return normalize(WidthSpec.expression(width));
    }

    public static String normalize(int width) {
        return normalize(WidthSpec.literal(width));
    }

    /**
     * Declaration body for a signal: packed fragments, the name, then unpacked fragments,
     * separated by single spaces and without empty parts.
     */
    public static String declaration(String signal, WidthSpec width,
                                     List<WidthSpec> packedDimensions, List<WidthSpec> dimensions) {
        StringBuilder sb = new StringBuilder();
        String packed = normalize(width) + join(packedDimensions);
        if (!packed.isEmpty()) {
            sb.append(packed).append(' ');
        }
        sb.append(VerilogIdentifiers.emit(signal).strip());
        String unpacked = join(dimensions);
        if (!unpacked.isEmpty()) {
            sb.append(' ').append(unpacked);
        }
        return sb.toString();
    }

    /**
     * Declaration body for a top-level signal shaped like the given port.
     */
    public static String declaration(String signal, Port shape) {
        return declaration(signal, shape.width(), shape.packedDimensions(), shape.dimensions());
    }

    private static String join(List<WidthSpec> dimensions) {
        StringBuilder sb = new StringBuilder();
        for (WidthSpec dimension : dimensions) {
            sb.append(normalize(dimension));
        }
        return sb.toString();
    }
}
