package sk.pcola.paddles.scrape;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import sk.pcola.paddles.config.ScrapeConfig;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Náhodná pauza pred každým ďalším requestom na ten istý obchod.
 */
@Component
public class PoliteDelay {

    private final long minDelayMs;
    private final long maxDelayMs;

    @Autowired
    public PoliteDelay(ScrapeConfig config) {
        this(config.getMinDelayMs(), config.getMaxDelayMs());
    }

    public PoliteDelay(long minDelayMs, long maxDelayMs) {
        if (minDelayMs < 0 || maxDelayMs < minDelayMs) {
            throw new IllegalArgumentException(
                    "Invalid delay bounds: min=" + minDelayMs + ", max=" + maxDelayMs);
        }
        this.minDelayMs = minDelayMs;
        this.maxDelayMs = maxDelayMs;
    }

    /**
     * Bez čakania (testy, lokálne súbory).
     */
    public static PoliteDelay none() {
        return new PoliteDelay(0, 0);
    }

    public long nextDelayMs() {
        if (maxDelayMs == minDelayMs) {
            return minDelayMs;
        }
        return ThreadLocalRandom.current().nextLong(minDelayMs, maxDelayMs + 1);
    }

    /**
     * Uspí aktuálne vlákno. Pri prerušení vráti riadenie hneď a nechá nastavený príznak.
     */
    public void pause() {
        long delay = nextDelayMs();
        if (delay <= 0) {
            return;
        }
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
