package sk.pcola.paddles.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Napojenie na REST API katalógu pálok (POST /api/paddles).
 */
@Component
@ConfigurationProperties(prefix = "paddles.catalog")
public class CatalogConfig {

    private String url = "http://localhost:8080/api/paddles";
    private boolean enabled = true;
    private int timeoutSeconds = 30;

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(int timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }
}
