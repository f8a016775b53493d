package org.operaton.hikeprep.util;

import java.math.BigDecimal;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;

/**
 * Utility class for formatting plan values for notes, file names and exports.
 */
public class PlanFormatter {

    private static final DecimalFormatSymbols SYMBOLS = DecimalFormatSymbols.getInstance(Locale.US);

    /**
     * Formats a number without trailing zeros (e.g. 2.50 becomes "2.5", 20.0 becomes "20").
     *
     * @param value the value
     * @return plain decimal string
     */
    public static String formatDecimal(double value) {
        BigDecimal decimal = BigDecimal.valueOf(value).stripTrailingZeros();
        if (decimal.scale() < 0) {
            decimal = decimal.setScale(0);
        }
        return decimal.toPlainString();
    }

    /**
     * Formats whole feet with a thousands separator (e.g. "1,500").
     *
     * @param feet elevation in feet, rounded to whole feet
     * @return formatted feet without unit
     */
    public static String formatFeet(double feet) {
        return new DecimalFormat("#,##0", SYMBOLS).format(Math.round(feet));
    }

    /**
     * Formats minutes with one decimal at most (e.g. "12.5").
     */
    public static String formatMinutes(double minutes) {
        return formatDecimal(GradeMath.roundToStep(minutes, 0.1));
    }

    /**
     * Formats a percentage value with one decimal (e.g. "4.0").
     */
    public static String formatIncline(double inclinePct) {
        return new DecimalFormat("0.0", SYMBOLS).format(inclinePct);
    }

    /**
     * Formats a speed with one decimal (e.g. "3.2").
     */
    public static String formatSpeed(double speedMph) {
        return new DecimalFormat("0.0", SYMBOLS).format(speedMph);
    }

    /**
     * Turns a display name into a lower-case, hyphenated slug.
     * Falls back to "hike" when nothing usable remains.
     *
     * @param name display name, may be null
     * @param maxLength maximum slug length
     * @return slug of at most {@code maxLength} characters
     */
    public static String slugify(String name, int maxLength) {
        if (name == null) {
            return "hike";
        }
        String slug = name.toLowerCase(Locale.ROOT)
            .replaceAll("[^a-z0-9]+", "-")
            .replaceAll("^-+|-+$", "");
        if (slug.length() > maxLength) {
            slug = slug.substring(0, maxLength).replaceAll("-+$", "");
        }
        return slug.isEmpty() ? "hike" : slug;
    }
}
