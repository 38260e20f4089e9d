package me.jling.gpstime.image.core.zone;

import lombok.extern.slf4j.Slf4j;
import net.iakovlev.timeshape.TimeZoneEngine;
import org.springframework.stereotype.Component;

import java.time.ZoneId;
import java.util.concurrent.TimeUnit;

/**
 * {@link ZoneNameLookup} backed by the timeshape boundary polygons.
 *
 * <p>The polygon set takes a few seconds and a few hundred MB to load, so it is
 * only loaded the first time a file actually carries coordinates.
 */
@Slf4j
@Component
public class TimeshapeZoneNameLookup implements ZoneNameLookup {

    private volatile TimeZoneEngine engine;

    @Override
    public String lookupZoneName(double latitude, double longitude) {
        if (Math.abs(latitude) > 90 || Math.abs(longitude) > 180) {
            log.debug("[lookupZoneName] coordinate out of range: {},{}", latitude, longitude);
            return "";
        }
        return engine().query(latitude, longitude).map(ZoneId::getId).orElse("");
    }

    private TimeZoneEngine engine() {
        TimeZoneEngine e = engine;
        if (e == null) {
            synchronized (this) {
                e = engine;
                if (e == null) {
                    long start = System.nanoTime();
                    e = TimeZoneEngine.initialize();
                    engine = e;
                    log.info("[engine] timeshape loaded in {} ms",
                            TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
                }
            }
        }
        return e;
    }
}
