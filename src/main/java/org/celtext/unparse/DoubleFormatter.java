package org.celtext.unparse;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Formats doubles with the fewest digits that read back to the same value, using plain notation
 * for decimal exponents in [-4, 6) and scientific notation ({@code 1e+06}, {@code 2.5e-07}) outside.
 */
final class DoubleFormatter {
    private static final int MIN_PLAIN_EXPONENT = -4;
    private static final int MAX_PLAIN_EXPONENT = 6;
    private static final int MAX_SIGNIFICANT_DIGITS = 17;

    private DoubleFormatter() {}

    static String format(double value) {
        if (Double.isNaN(value)) {
            return "NaN";
        }
        if (Double.isInfinite(value)) {
            return value > 0
                   ? "+Inf"
                   : "-Inf";
        }
        var sign = (Double.doubleToRawLongBits(value) < 0)
                   ? "-"
                   : "";
        if (value == 0) {
            return sign + "0";
        }
        var decimal = shortest(Math.abs(value));
        var digits = decimal.unscaledValue()
                            .toString();
        // Position of the decimal point relative to the first digit.
        int point = digits.length() - decimal.scale();
        int exponent = point - 1;
        if (exponent < MIN_PLAIN_EXPONENT || exponent >= MAX_PLAIN_EXPONENT) {
            return sign + scientific(digits, exponent);
        }
        return sign + plain(digits, point);
    }

    // Nearest decimal with the fewest significant digits that parses back to the same double.
    private static BigDecimal shortest(double magnitude) {
        var exact = new BigDecimal(magnitude);
        for (int precision = 1; precision < MAX_SIGNIFICANT_DIGITS; precision++) {
            var candidate = exact.round(new MathContext(precision, RoundingMode.HALF_EVEN));
            if (candidate.doubleValue() == magnitude) {
                return candidate.stripTrailingZeros();
            }
        }
        return exact.round(new MathContext(MAX_SIGNIFICANT_DIGITS, RoundingMode.HALF_EVEN))
                    .stripTrailingZeros();
    }

    private static String scientific(String digits, int exponent) {
        var sb = new StringBuilder(digits.length() + 6);
        sb.append(digits.charAt(0));
        if (digits.length() > 1) {
            sb.append('.')
              .append(digits, 1, digits.length());
        }
        sb.append('e')
          .append(exponent < 0
                  ? '-'
                  : '+');
        int magnitude = Math.abs(exponent);
        if (magnitude < 10) {
            sb.append('0');
        }
        return sb.append(magnitude)
                 .toString();
    }

    private static String plain(String digits, int point) {
        if (point <= 0) {
            return "0." + "0".repeat(-point) + digits;
        }
        if (point >= digits.length()) {
            return digits + "0".repeat(point - digits.length());
        }
        return digits.substring(0, point) + "." + digits.substring(point);
    }
}
