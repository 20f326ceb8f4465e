package sk.pcola.paddles.common.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Prevod voľného textu s číslom na double.
 *
 * Postup (poradie je dôležité):
 * 1. Odstráni poznámku pod čiarou (všetko od prvej '*')
 * 2. Pri hodnote v dvoch jednotkách ("8 oz / 227 g") ponechá len prvú
 * 3. Odstráni jednotky (in, oz, ounces, mm...) len ako samostatné slová
 * 4. Zmiešané číslo "4 1/4" -> 4.25, len ak je to celý zvyšný text
 * 5. Zlomok "1/4" -> 0.25, len ak je to celý zvyšný text
 * 6. Rozsah "7.9-8.3" -> priemer 8.1
 * 7. Prvé desatinné číslo v texte
 *
 * Nikdy nevyhadzuje výnimku a nikdy nehádže odhad - pri neúspechu vráti prázdny výsledok.
 */
public final class NumericNormalizer {

    private static final List<String> DEFAULT_UNITS = List.of(
            "inches", "inch", "in", "ounces", "ounce", "oz", "millimeters", "mm", "cm", "grams", "g"
    );

    private static final Pattern DEFAULT_UNIT_PATTERN = unitPattern(DEFAULT_UNITS);

    // Palcové znaky sa držia priamo pri čísle (16.5")
    private static final Pattern INCH_MARKS = Pattern.compile("[\"”″]");

    // Lomka za jednotkou oddeľuje druhú jednotku, nie zlomok ("16.5 in / 41.9 cm")
    private static final Pattern SECOND_UNIT = Pattern.compile("(?<=[\\p{L}\"”″])\\.?\\s*/.*$", Pattern.DOTALL);

    private static final Pattern MIXED_NUMBER = Pattern.compile(
            "^(\\d+)\\s+(\\d+)\\s*/\\s*(\\d+)$");

    private static final Pattern FRACTION = Pattern.compile(
            "^(\\d+(?:\\.\\d+)?)\\s*/\\s*(\\d+(?:\\.\\d+)?)$");

    private static final Pattern RANGE = Pattern.compile(
            "(\\d+(?:\\.\\d+)?)\\s*[-–—]\\s*(\\d+(?:\\.\\d+)?)");

    private static final Pattern DECIMAL = Pattern.compile("\\d+(?:\\.\\d+)?");

    private NumericNormalizer() {
    }

    public static OptionalDouble normalize(String text) {
        return normalize(text, List.of());
    }

    /**
     * @param text       surový text (napr. "4 1/8 in *may vary")
     * @param extraUnits ďalšie jednotky, ktoré sa majú odstrániť pre konkrétne pole
     * @return hodnota alebo prázdny výsledok
     */
    public static OptionalDouble normalize(String text, Collection<String> extraUnits) {
        if (text == null || text.isBlank()) {
            return OptionalDouble.empty();
        }

        String cleaned = TextUtil.replaceSpecialSpaces(text);

        int footnote = cleaned.indexOf('*');
        if (footnote >= 0) {
            cleaned = cleaned.substring(0, footnote);
        }

        cleaned = SECOND_UNIT.matcher(cleaned).replaceFirst("");

        cleaned = stripUnits(cleaned, extraUnits);
        if (cleaned.isBlank()) {
            return OptionalDouble.empty();
        }

        Matcher mixed = MIXED_NUMBER.matcher(cleaned);
        if (mixed.matches()) {
            double denominator = Double.parseDouble(mixed.group(3));
            if (denominator == 0) {
                return OptionalDouble.empty();
            }
            return OptionalDouble.of(Double.parseDouble(mixed.group(1))
                    + Double.parseDouble(mixed.group(2)) / denominator);
        }

        Matcher fraction = FRACTION.matcher(cleaned);
        if (fraction.matches()) {
            double denominator = Double.parseDouble(fraction.group(2));
            if (denominator == 0) {
                return OptionalDouble.empty();
            }
            return OptionalDouble.of(Double.parseDouble(fraction.group(1)) / denominator);
        }

        Matcher range = RANGE.matcher(cleaned);
        if (range.find()) {
            OptionalDouble low = parse(range.group(1));
            OptionalDouble high = parse(range.group(2));
            if (low.isEmpty() || high.isEmpty()) {
                return OptionalDouble.empty();
            }
            return OptionalDouble.of((low.getAsDouble() + high.getAsDouble()) / 2);
        }

        Matcher decimal = DECIMAL.matcher(cleaned);
        if (decimal.find()) {
            return parse(decimal.group());
        }

        return OptionalDouble.empty();
    }

    /**
     * Odstráni jednotky ako samostatné tokeny. Jednotka môže byť nalepená na číslo ("16.5in"),
     * ale nie na iné písmená ("inside" zostane nedotknuté).
     */
    static String stripUnits(String text, Collection<String> extraUnits) {
        String result = DEFAULT_UNIT_PATTERN.matcher(text).replaceAll(" ");
        if (extraUnits != null && extraUnits.stream().anyMatch(u -> u != null && !u.isBlank())) {
            result = unitPattern(extraUnits).matcher(result).replaceAll(" ");
        }
        result = INCH_MARKS.matcher(result).replaceAll(" ");
        return TextUtil.collapseWhitespace(result);
    }

    private static Pattern unitPattern(Collection<String> units) {
        // Dlhšie jednotky najprv, inak by "in" zjedlo začiatok "inches"
        List<String> sorted = new ArrayList<>(units);
        sorted.sort((a, b) -> Integer.compare(b.length(), a.length()));
        StringBuilder alternation = new StringBuilder();
        for (String unit : sorted) {
            if (unit == null || unit.isBlank()) {
                continue;
            }
            if (!alternation.isEmpty()) {
                alternation.append('|');
            }
            alternation.append(Pattern.quote(unit.trim()));
        }
        return Pattern.compile("(?<![\\p{L}])(?:" + alternation + ")\\.?(?![\\p{L}])",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    private static OptionalDouble parse(String number) {
        try {
            return OptionalDouble.of(Double.parseDouble(number));
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }
}
