package sk.pcola.paddles.scrape;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Úložisko produktových obrázkov. Pomenovanie súboru určuje značka a model.
 */
public interface ImageStore {

    /**
     * @return cesta k uloženému obrázku, prázdny Optional ak sa obrázok nepodarilo uložiť
     */
    Optional<Path> store(String brand, String model, String imageUrl);
}
