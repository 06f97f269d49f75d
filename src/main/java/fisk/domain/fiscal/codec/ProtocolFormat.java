package fisk.domain.fiscal.codec;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Locale independent field formatting shared by all command grammars
 * @since 15/10/2026
 */
public final class ProtocolFormat {
    private ProtocolFormat() {
        throw new AssertionError("Utility class cannot be instantiated");
    }

    /**
     * Amount with exactly two fractional digits and '.' as separator
     */
    public static String amount(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    /**
     * Quantity without padding or trailing zeros
     */
    public static String quantity(BigDecimal value) {
        if (value.signum() == 0) {
            return "0";
        }
        return value.stripTrailingZeros().toPlainString();
    }

    public static String withMaxLength(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (maxLength <= 0 || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength);
    }

    public static String padRight(String text, int width) {
        StringBuilder sb = new StringBuilder(text);
        while (sb.length() < width) {
            sb.append(' ');
        }
        return sb.toString();
    }

    /**
     * Department numbers travel as (department + 0x80) in two hex digits
     */
    public static String department(int department) {
        return String.format("%02X", department + 0x80);
    }
}
