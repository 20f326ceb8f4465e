package sk.pcola.paddles.common.util;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Čistenie názvov značiek a modelov z titulkov produktových stránok.
 *
 * Poradie krokov:
 * 1. Oreže text na prvom oddeľovači typu '|' (aj Unicode varianty)
 * 2. Odstráni zvyšné oddeľovače
 * 3. Odstráni pevný zoznam koncoviek ("Pickleball Paddle", " - PBC"...), každú raz, v poradí zoznamu
 * 4. Odstráni zátvorky aj s obsahom
 * 5. Odstráni propagačné slová (New, SALE...) ako celé slová bez ohľadu na veľkosť písmen
 * 6. Zlúči medzery a oreže okraje
 *
 * Celý priechod sa opakuje, kým sa výsledok mení. Odstránenie slova "New" môže odkryť
 * ďalšiu koncovku, preto až ustálený výsledok je idempotentný.
 */
public final class NameCleaner {

    // ASCII '|' a jeho Unicode dvojníky
    private static final String PIPE_CLASS = "[|\u2502\uFF5C\uFE31\u4E28]";

    private static final Pattern PIPE_AND_REST = Pattern.compile("\\s*" + PIPE_CLASS + ".*$", Pattern.DOTALL);

    private static final Pattern PIPES = Pattern.compile(PIPE_CLASS + "+");

    // Case-sensitive, poradie je záväzné
    static final List<String> SUFFIXES = List.of(
            "Pickleball Paddle",
            "Paddle",
            "Pickleball",
            " - PBC",
            " - NEW",
            " - Limited Edition",
            " - LE",
            " - Elongated",
            " - Standard",
            " - Teardrop",
            "(Elongated)",
            "Elongated",
            "(Standard)",
            "Standard",
            "(Lightweight)",
            "Lightweight",
            " -"
    );

    private static final Pattern PARENTHESES = Pattern.compile("\\s*\\([^)]*\\)\\s*");

    private static final List<Pattern> DESCRIPTORS = List.of(
            descriptor("Limited Edition"),
            descriptor("In Stock"),
            descriptor("SALE"),
            descriptor("New")
    );

    private NameCleaner() {
    }

    public static String clean(String raw) {
        if (raw == null) {
            return null;
        }
        // Každý priechod, ktorý niečo zmení, text skráti - cyklus skončí
        String current = TextUtil.replaceSpecialSpaces(raw);
        while (true) {
            String next = cleanOnce(current);
            if (next.equals(current)) {
                return next;
            }
            current = next;
        }
    }

    static String cleanOnce(String raw) {
        String name = PIPE_AND_REST.matcher(raw).replaceFirst("");
        name = PIPES.matcher(name).replaceAll("");
        name = name.trim();

        for (String suffix : SUFFIXES) {
            if (name.endsWith(suffix)) {
                name = name.substring(0, name.length() - suffix.length()).trim();
            }
        }

        name = PARENTHESES.matcher(name).replaceAll(" ").trim();

        for (Pattern descriptor : DESCRIPTORS) {
            name = descriptor.matcher(name).replaceAll("");
        }

        return TextUtil.collapseWhitespace(name);
    }

    private static Pattern descriptor(String word) {
        return Pattern.compile("\\b" + Pattern.quote(word) + "\\b", Pattern.CASE_INSENSITIVE);
    }
}
