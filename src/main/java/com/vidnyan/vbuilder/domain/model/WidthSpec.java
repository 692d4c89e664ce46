package com.vidnyan.vbuilder.domain.model;

/**
 * Width of a port, parameter or dimension as written in the source.
 * <p>
 * ABSENT means one bit. LITERAL holds a decimal bit count, EXPRESSION an
 * unevaluated bit-count expression ({@code WIDTH} for {@code [WIDTH-1:0]}),
 * and RANGE a {@code msb:lsb} pair that is not zero-based and is kept verbatim.
 */
public record WidthSpec(
    Kind kind,
    String text
) {

    public enum Kind {
        ABSENT,
        LITERAL,
        EXPRESSION,
        RANGE
    }

    private static final WidthSpec ABSENT = new WidthSpec(Kind.ABSENT, "");

    public WidthSpec {
        if (kind == null) {
            throw new IllegalArgumentException("Width kind is required");
        }
        text = text == null ? "" : text.strip();
        if (kind != Kind.ABSENT && text.isEmpty()) {
            throw new IllegalArgumentException("A " + kind + " width needs text");
        }
        if (kind == Kind.LITERAL && !isDecimal(text)) {
            throw new IllegalArgumentException("Not a decimal width: " + text);
        }
    }

    public static WidthSpec absent() {
        return ABSENT;
    }

    public static WidthSpec literal(int bits) {
        if (bits < 1) {
            throw new IllegalArgumentException("Width must be positive: " + bits);
        }
        return new WidthSpec(Kind.LITERAL, Integer.toString(bits));
    }

    /**
     * Width given as an expression; decimal text becomes a literal.
     */
    public static WidthSpec expression(String expr) {
        if (expr == null || expr.isBlank()) {
            return ABSENT;
        }
        String trimmed = expr.strip();
        if (isDecimal(trimmed)) {
            return literal(Integer.parseInt(trimmed));
        }
        return new WidthSpec(Kind.EXPRESSION, trimmed);
    }

    /**
     * Verbatim {@code msb:lsb} range.
     */
    public static WidthSpec range(String msb, String lsb) {
        return new WidthSpec(Kind.RANGE, msb.strip() + ":" + lsb.strip());
    }

    /**
     * Convert a declared {@code [msb:lsb]} range into a width specification.
     * Zero-based ranges collapse to a bit count ({@code [7:0]} is 8,
     * {@code [W-1:0]} is {@code W}); anything else stays a range.
     */
    public static WidthSpec fromRange(String msb, String lsb) {
        String high = msb.replaceAll("\\s+", "");
        String low = lsb.replaceAll("\\s+", "");
        if (low.equals("0")) {
            if (isDecimal(high)) {
                return literal(Integer.parseInt(high) + 1);
            }
            if (high.endsWith("-1") && high.length() > 2) {
                return expression(high.substring(0, high.length() - 2));
            }
        }
        return range(high, low);
    }

    /**
     * Convert a SystemVerilog size-only dimension such as {@code [4]} or {@code [DEPTH]}.
     */
    public static WidthSpec fromSize(String size) {
        return expression(size.replaceAll("\\s+", ""));
    }

    public boolean isAbsent() {
        return kind == Kind.ABSENT;
    }

    public boolean isLiteral() {
        return kind == Kind.LITERAL;
    }

    public int literalValue() {
        if (kind != Kind.LITERAL) {
            throw new IllegalStateException("Not a literal width: " + this);
        }
        return Integer.parseInt(text);
    }

    /**
     * Human-readable bit count for listings.
     */
    public String describe() {
        return switch (kind) {
            case ABSENT -> "1";
            case LITERAL, EXPRESSION -> text;
            case RANGE -> "[" + text + "]";
        };
    }

    private static boolean isDecimal(String text) {
        if (text.isEmpty() || text.length() > 9) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            if (!Character.isDigit(text.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
