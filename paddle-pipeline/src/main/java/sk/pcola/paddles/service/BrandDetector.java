package sk.pcola.paddles.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Detekcia značky pálky z titulku produktu.
 *
 * Poradie:
 * 1. známe značky v poradí zoznamu, pri každej sa najprv skúsi začiatok titulku, potom celé slovo
 *    kdekoľvek v titulku; vyhráva prvá značka zoznamu, ktorá sa nájde jedným z dvoch spôsobov
 *    ("Gamma Compass Head Light" je HEAD, lebo HEAD je v zozname pred Gamma)
 * 2. prvé slovo titulku (prvé dve, ak sa spolu objavia v URL alebo v zozname značiek)
 * 3. ak prvé slová nie sú známa značka, skúsi sa nájsť známa značka v URL
 */
@Component
public class BrandDetector {

    private static final Logger log = LoggerFactory.getLogger(BrandDetector.class);

    // Poradie je dôležité - "Selkirk Labs" pred "Selkirk"
    static final List<String> KNOWN_BRANDS = List.of(
            "Selkirk Labs", "Selkirk", "Engage", "Joola", "Paddletek", "Gearbox",
            "Franklin", "CRBN", "Diadem", "HEAD", "Gamma", "Players",
            "adidas", "OneShot", "Electrum", "SLK", "Legacy Pro", "Rokne",
            "Babolat", "TMPR", "Pickleball Apes", "ProKennex", "Vulcan",
            "Wilson", "Onix", "Prince", "Rally", "PROLITE", "Pro-Lite"
    );

    public Optional<String> detect(String title, String url) {
        if (title == null || title.isBlank()) {
            return Optional.empty();
        }
        String trimmed = title.trim();
        String lowerTitle = trimmed.toLowerCase(Locale.ROOT);

        for (String brand : KNOWN_BRANDS) {
            if (lowerTitle.startsWith(brand.toLowerCase(Locale.ROOT))) {
                return Optional.of(brand);
            }
            if (wholeWord(brand).matcher(trimmed).find()) {
                return Optional.of(brand);
            }
        }

        String[] words = trimmed.split("\\s+");
        String brand = words[0];
        String lowerUrl = url == null ? "" : url.toLowerCase(Locale.ROOT);
        if (words.length >= 2) {
            String twoWords = words[0] + " " + words[1];
            String twoWordsLower = twoWords.toLowerCase(Locale.ROOT);
            if (lowerUrl.contains(twoWordsLower.replace(' ', '-'))
                    || KNOWN_BRANDS.stream().anyMatch(b -> b.toLowerCase(Locale.ROOT).contains(twoWordsLower))) {
                brand = twoWords;
            }
        }

        Optional<String> fromUrl = fromUrl(lowerUrl);
        if (fromUrl.isPresent()) {
            log.info("Brand '{}' not in known brands, using '{}' found in URL", brand, fromUrl.get());
            return fromUrl;
        }
        log.warn("Using potentially unknown brand '{}' for title '{}'", brand, trimmed);
        return Optional.of(brand);
    }

    /**
     * Normalizuje explicitne uvedenú značku (napr. "JOOLA" -> "Joola"), neznámu vráti orezanú.
     */
    public Optional<String> canonical(String brand) {
        if (brand == null || brand.isBlank()) {
            return Optional.empty();
        }
        String trimmed = brand.trim();
        return Optional.of(KNOWN_BRANDS.stream()
                .filter(b -> b.equalsIgnoreCase(trimmed))
                .findFirst()
                .orElse(trimmed));
    }

    public boolean isKnown(String brand) {
        return brand != null && KNOWN_BRANDS.stream().anyMatch(b -> b.equalsIgnoreCase(brand.trim()));
    }

    private Optional<String> fromUrl(String lowerUrl) {
        if (lowerUrl.isEmpty()) {
            return Optional.empty();
        }
        for (String brand : KNOWN_BRANDS) {
            if (lowerUrl.contains(brand.toLowerCase(Locale.ROOT).replace(' ', '-'))) {
                return Optional.of(brand);
            }
        }
        return Optional.empty();
    }

    private static Pattern wholeWord(String brand) {
        return Pattern.compile("\\b" + Pattern.quote(brand) + "\\b", Pattern.CASE_INSENSITIVE);
    }
}
