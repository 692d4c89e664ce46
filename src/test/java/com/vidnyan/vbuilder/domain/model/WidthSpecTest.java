package com.vidnyan.vbuilder.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WidthSpecTest {

    @Test
    void fromRange_ShouldCollapseZeroBasedRanges() {
        assertEquals(WidthSpec.literal(8), WidthSpec.fromRange("7", "0"));
        assertEquals(WidthSpec.expression("WIDTH"), WidthSpec.fromRange("WIDTH - 1", "0"));
        assertEquals(WidthSpec.literal(1), WidthSpec.fromRange("0", "0"));
    }

    @Test
    void fromRange_ShouldKeepOtherRanges() {
        WidthSpec spec = WidthSpec.fromRange("15", "8");

        assertEquals(WidthSpec.Kind.RANGE, spec.kind());
        assertEquals("15:8", spec.text());
        assertEquals(WidthSpec.Kind.RANGE, WidthSpec.fromRange("N", "1").kind());
    }

    @Test
    void expression_ShouldTurnDecimalTextIntoLiteral() {
        assertTrue(WidthSpec.expression("12").isLiteral());
        assertEquals(12, WidthSpec.expression(" 12 ").literalValue());
        assertTrue(WidthSpec.expression("  ").isAbsent());
    }

    @Test
    void literal_ShouldRejectNonPositiveWidths() {
        assertThrows(IllegalArgumentException.class, () -> WidthSpec.literal(0));
    }
}
