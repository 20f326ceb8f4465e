package sk.pcola.paddles.common.util;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Deterministické ID pálky zo značky a modelu: "{brand}-{model}" malými písmenami,
 * medzery nahradené pomlčkou.
 *
 * Dve pálky s rovnakou značkou a modelom dostanú rovnaké ID - podľa toho sa deduplikuje
 * naprieč zdrojmi aj v cieľovom katalógu.
 */
public final class IdentityAssigner {

    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    private IdentityAssigner() {
    }

    public static String assignId(String brand, String model) {
        return slugPart(brand) + "-" + slugPart(model);
    }

    private static String slugPart(String value) {
        if (value == null) {
            return "";
        }
        String normalized = TextUtil.replaceSpecialSpaces(value).trim().toLowerCase(Locale.ROOT);
        return WHITESPACE_RUN.matcher(normalized).replaceAll("-");
    }
}
