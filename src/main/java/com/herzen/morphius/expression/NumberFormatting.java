package com.herzen.morphius.expression;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class NumberFormatting {
    private NumberFormatting() {}

    public static String natural(double value) {
        return new BigDecimal(Double.toString(value)).stripTrailingZeros().toPlainString();
    }

    // rounds the exact binary value, not its shortest decimal form
    public static String rounded(double value) {
        return new BigDecimal(value).setScale(3, RoundingMode.HALF_EVEN).toPlainString();
    }

    // natural form unless it is longer than the three-place rounding: 2 and 2.5 stay, 1/3 becomes 0.333
    public static String result(double value) {
        String rounded = rounded(value);
        String natural = natural(value);
        return natural.length() > rounded.length() ? rounded : natural;
    }
}
