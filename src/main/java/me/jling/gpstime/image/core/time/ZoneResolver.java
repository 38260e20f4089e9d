package me.jling.gpstime.image.core.time;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves IANA zone names against the JDK time-zone database, remembering
 * every answer for the life of the process, failed lookups included.
 *
 * <p>Safe for concurrent use. Two callers missing on the same name may both hit
 * the database; they store the same value.
 */
@Slf4j
@Service
public class ZoneResolver {

    @FunctionalInterface
    public interface ZoneLoader {
        ZoneId load(String zoneName);
    }

    private final Map<String, Optional<ZoneId>> cache = new ConcurrentHashMap<>();
    private final ZoneLoader loader;

    public ZoneResolver() {
        this(ZoneId::of);
    }

    ZoneResolver(ZoneLoader loader) {
        this.loader = loader;
    }

    /**
     * @param zoneName IANA name such as {@code America/New_York}; empty means unknown
     * @return the zone, or empty if the name is empty or the database does not know it
     */
    public Optional<ZoneId> resolve(String zoneName) {
        if (zoneName == null || zoneName.isEmpty()) {
            return Optional.empty();
        }
        Optional<ZoneId> cached = cache.get(zoneName);
        if (cached != null) {
            return cached;
        }

        Optional<ZoneId> loaded;
        try {
            loaded = Optional.of(loader.load(zoneName));
        } catch (DateTimeException e) {
            log.warn("[resolve] failed to load zone {}: {}", zoneName, e.toString());
            loaded = Optional.empty();
        }
        cache.put(zoneName, loaded);
        return loaded;
    }

    int cachedCount() {
        return cache.size();
    }
}
