package sk.pcola.paddles.common.util;

import java.util.regex.Pattern;

/**
 * Utility pre čistenie textu vytiahnutého z HTML stránok obchodov.
 * Stránky často obsahujú NBSP, tenké medzery a zalomenia vo vnútri hodnôt.
 * Príklad: "Paddle Length:  16.5 in" -> "Paddle Length: 16.5 in"
 */
public final class TextUtil {

    private static final Pattern SPECIAL_SPACES = Pattern.compile("[\\u00A0\\u2007\\u2009\\u202F\\u200B\\t]");
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    private TextUtil() {
    }

    /**
     * Nahradí špeciálne medzery obyčajnou medzerou.
     *
     * @param text text zo stránky
     * @return text len s ASCII medzerami
     */
    public static String replaceSpecialSpaces(String text) {
        if (text == null) {
            return null;
        }
        return SPECIAL_SPACES.matcher(text).replaceAll(" ");
    }

    /**
     * Zlúči viacnásobné medzery a zalomenia do jednej medzery.
     */
    public static String collapseWhitespace(String text) {
        if (text == null) {
            return null;
        }
        return WHITESPACE_RUN.matcher(text).replaceAll(" ").trim();
    }

    /**
     * Kombinuje nahradenie špeciálnych medzier a zlúčenie medzier.
     */
    public static String normalize(String text) {
        if (text == null) {
            return null;
        }
        return collapseWhitespace(replaceSpecialSpaces(text));
    }

    /**
     * Prázdny alebo len medzerový text vráti ako null.
     */
    public static String emptyToNull(String text) {
        if (text == null) {
            return null;
        }
        String trimmed = text.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public static boolean isBlank(String text) {
        return text == null || text.isBlank();
    }
}
