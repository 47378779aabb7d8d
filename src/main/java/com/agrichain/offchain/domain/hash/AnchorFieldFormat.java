package com.agrichain.offchain.domain.hash;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;


/**
 * Text forms of field values inside hash inputs.  These strings are part of
 * the reproducibility contract of every anchored hash, so each method pins
 * one exact rendering and must not be changed.
 */
public final class AnchorFieldFormat {

    private static final DateTimeFormatter SECONDS =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

    private static final double EXP_LOWER = 1e-4;
    private static final double EXP_UPPER = 1e16;

    private AnchorFieldFormat() {}

    /**
     * Shortest round-trip decimal in plain notation; integral values carry no
     * fractional part ({@code 100.0 -> "100"}, {@code 12.5 -> "12.5"},
     * {@code 1e20 -> "100000000000000000000"}).
     */
    public static String decimal(double v) {
        if (Double.isNaN(v)) {
            return "NaN";
        }
        if (Double.isInfinite(v)) {
            return v > 0 ? "inf" : "-inf";
        }
        if (v == 0.0) {
            return isNegativeZero(v) ? "-0" : "0";
        }
        return shortest(v).toPlainString();
    }

    /**
     * Debug form of a decimal: always shows a fractional part ({@code 22.0}) and
     * switches to exponent form below {@code 1e-4} or from {@code 1e16} on
     * ({@code 1.5e-5}, {@code 1e16}).
     */
    public static String debugDecimal(double v) {
        if (Double.isNaN(v) || Double.isInfinite(v)) {
            return decimal(v);
        }
        if (v == 0.0) {
            return isNegativeZero(v) ? "-0.0" : "0.0";
        }
        double abs = Math.abs(v);
        if (abs < EXP_LOWER || abs >= EXP_UPPER) {
            return scientific(v);
        }
        String plain = decimal(v);
        return plain.indexOf('.') < 0 ? plain + ".0" : plain;
    }

    /** {@code Some(<debug decimal>)} or {@code None}. */
    public static String optionalDecimal(Double v) {
        return v == null ? "None" : "Some(" + debugDecimal(v) + ")";
    }

    /**
     * UTC timestamp as {@code yyyy-MM-dd HH:mm:ss[.f] UTC}; the fraction is
     * omitted when zero and otherwise printed with 3, 6 or 9 digits.
     */
    public static String timestamp(Instant t) {
        StringBuilder sb = new StringBuilder(SECONDS.format(t));
        int nanos = t.getNano();
        if (nanos != 0) {
            String nine = String.format("%09d", nanos);
            if (nanos % 1_000_000 == 0) {
                sb.append('.').append(nine, 0, 3);
            } else if (nanos % 1_000 == 0) {
                sb.append('.').append(nine, 0, 6);
            } else {
                sb.append('.').append(nine);
            }
        }
        return sb.append(" UTC").toString();
    }

    private static String scientific(double v) {
        BigDecimal bd = shortest(v);
        String digits = bd.unscaledValue().abs().toString();
        int exponent = digits.length() - 1 - bd.scale();
        StringBuilder sb = new StringBuilder();
        if (v < 0) {
            sb.append('-');
        }
        sb.append(digits.charAt(0));
        if (digits.length() > 1) {
            sb.append('.').append(digits, 1, digits.length());
        }
        return sb.append('e').append(exponent).toString();
    }

    /**
     * Fewest significant digits that parse back to {@code v}, nearest to the
     * exact binary value. {@link Double#toString} may carry an extra digit.
     */
    private static BigDecimal shortest(double v) {
        BigDecimal exact = new BigDecimal(v);
        for (int precision = 1; precision < 17; precision++) {
            BigDecimal candidate = exact.round(new MathContext(precision, RoundingMode.HALF_EVEN));
            if (candidate.doubleValue() == v) {
                return candidate.stripTrailingZeros();
            }
        }
        return exact.round(new MathContext(17, RoundingMode.HALF_EVEN)).stripTrailingZeros();
    }

    private static boolean isNegativeZero(double v) {
        return Double.doubleToRawLongBits(v) == Double.doubleToRawLongBits(-0.0);
    }
}
