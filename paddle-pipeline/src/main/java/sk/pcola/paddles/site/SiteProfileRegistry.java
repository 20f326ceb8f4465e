package sk.pcola.paddles.site;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Profily obchodov načítané z {@code classpath:sites/*.json}.
 * Neznámy host dostane profil {@value #GENERIC_ID}.
 */
@Component
public class SiteProfileRegistry {

    private static final Logger log = LoggerFactory.getLogger(SiteProfileRegistry.class);

    public static final String GENERIC_ID = "generic";
    private static final String LOCATION = "classpath:sites/*.json";

    private final Map<String, SiteProfile> profiles;

    public SiteProfileRegistry(ObjectMapper objectMapper) {
        this.profiles = Collections.unmodifiableMap(load(objectMapper));
        if (!profiles.containsKey(GENERIC_ID)) {
            throw new IllegalStateException("Missing '" + GENERIC_ID + "' site profile in " + LOCATION);
        }
        log.info("Loaded {} site profiles: {}", profiles.size(), profiles.keySet());
    }

    public Collection<SiteProfile> all() {
        return profiles.values();
    }

    public Optional<SiteProfile> find(String id) {
        return Optional.ofNullable(profiles.get(id));
    }

    /**
     * @throws IllegalArgumentException pre neznáme ID
     */
    public SiteProfile byId(String id) {
        return find(id).orElseThrow(() ->
                new IllegalArgumentException("Unknown site '" + id + "', known sites: " + profiles.keySet()));
    }

    /**
     * Profil podľa hostiteľa URL, inak generický.
     */
    public SiteProfile forUrl(String url) {
        return profiles.values().stream()
                .filter(p -> p.matchesUrl(url))
                .findFirst()
                .orElse(profiles.get(GENERIC_ID));
    }

    private static Map<String, SiteProfile> load(ObjectMapper objectMapper) {
        Map<String, SiteProfile> loaded = new LinkedHashMap<>();
        try {
            Resource[] resources = new PathMatchingResourcePatternResolver().getResources(LOCATION);
            for (Resource resource : resources) {
                try (InputStream in = resource.getInputStream()) {
                    SiteProfile profile = objectMapper.readValue(in, SiteProfile.class);
                    if (loaded.putIfAbsent(profile.id(), profile) != null) {
                        throw new IllegalStateException("Duplicate site profile id: " + profile.id());
                    }
                    log.debug("Site profile '{}' loaded from {}", profile.id(), resource.getFilename());
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load site profiles from " + LOCATION + ": " + e.getMessage(), e);
        }
        return loaded;
    }
}
