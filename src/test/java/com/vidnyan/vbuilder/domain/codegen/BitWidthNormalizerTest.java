package com.vidnyan.vbuilder.domain.codegen;

import com.vidnyan.vbuilder.domain.model.WidthSpec;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BitWidthNormalizerTest {

    @Test
    void normalize_ShouldOmitSingleBitWidths() {
        assertEquals("", BitWidthNormalizer.normalize(1));
        assertEquals("", BitWidthNormalizer.normalize(WidthSpec.absent()));
        assertEquals("", BitWidthNormalizer.normalize(""));
    }

    @Test
    void normalize_ShouldComputeLiteralMsb() {
        assertEquals("[7:0]", BitWidthNormalizer.normalize(8));
        assertEquals("[31:0]", BitWidthNormalizer.normalize("32"));
    }

    @Test
    void normalize_ShouldCopyExpressionsVerbatim() {
        assertEquals("[WIDTH-1:0]", BitWidthNormalizer.normalize("WIDTH"));
        assertEquals("[$clog2(DEPTH)-1:0]", BitWidthNormalizer.normalize("$clog2(DEPTH)"));
    }

    @Test
    void normalize_ShouldEmitRangesAsWritten() {
        assertEquals("[15:8]", BitWidthNormalizer.normalize(WidthSpec.range("15", "8")));
    }

    @Test
    void declaration_ShouldPlacePackedBeforeAndUnpackedAfterName() {
        String declaration = BitWidthNormalizer.declaration("bus",
                WidthSpec.literal(4), List.of(WidthSpec.literal(8)), List.of(WidthSpec.range("0", "3")));

        assertEquals("[3:0][7:0] bus [0:3]", declaration);
    }

    @Test
    void declaration_ShouldBeBareNameForScalar() {
        assertEquals("flag", BitWidthNormalizer.declaration("flag", WidthSpec.absent(), List.of(), List.of()));
    }
}
