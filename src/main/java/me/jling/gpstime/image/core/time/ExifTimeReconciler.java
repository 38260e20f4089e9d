package me.jling.gpstime.image.core.time;

import me.jling.gpstime.exception.DecodeFailedException;
import me.jling.gpstime.exception.NoTimeAvailableException;
import me.jling.gpstime.image.core.exif.CaptureTime;
import me.jling.gpstime.image.core.exif.ExifField;
import me.jling.gpstime.image.core.exif.ExifFields;
import me.jling.gpstime.image.core.exif.ExifTag;
import me.jling.gpstime.image.core.exif.LatLong;
import me.jling.gpstime.image.core.tool.ImageMetaReader;
import me.jling.gpstime.image.core.tool.ReconciliationResult;
import me.jling.gpstime.image.core.zone.ZoneNameLookup;
import org.springframework.stereotype.Service;

import java.io.InputStream;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Cross-checks the camera clock of one image against its GPS timestamp.
 *
 * <ol>
 *   <li>model, GPS time and camera-local time are read independently; a missing
 *       or broken field only empties that part of the result;</li>
 *   <li>the GPS position is recorded whenever the file has one; a naive
 *       camera-local time is then reinterpreted in the zone found for it.</li>
 * </ol>
 *
 * <p>Only two outcomes are errors: the decoder cannot read the file at all
 * ({@link DecodeFailedException}), or neither a local nor a GPS time exists
 * ({@link NoTimeAvailableException}).
 */
@Service
public class ExifTimeReconciler {

    private final GpsTimestampAssembler gpsAssembler;
    private final LocalTimeCorrector corrector;
    private final ZoneResolver zoneResolver;
    private final ZoneNameLookup zoneNameLookup;

    public ExifTimeReconciler(GpsTimestampAssembler gpsAssembler,
                              LocalTimeCorrector corrector,
                              ZoneResolver zoneResolver,
                              ZoneNameLookup zoneNameLookup) {
        this.gpsAssembler = gpsAssembler;
        this.corrector = corrector;
        this.zoneResolver = zoneResolver;
        this.zoneNameLookup = zoneNameLookup;
    }

    public ReconciliationResult reconcile(Path file) {
        return reconcile(ImageMetaReader.read(file), file.getFileName().toString());
    }

    public ReconciliationResult reconcile(InputStream in, String source) {
        return reconcile(ImageMetaReader.read(in, source), source);
    }

    public ReconciliationResult reconcile(ExifFields fields) {
        return reconcile(fields, "<metadata>");
    }

    ReconciliationResult reconcile(ExifFields fields, String source) {
        ReconciliationSteps steps = new ReconciliationSteps(source);

        String model = steps.attempt("model",
                () -> fields.get(ExifTag.MODEL).map(ExifField::stringValue).orElse("")).orElse("");
        Instant gpsTime = steps.attempt("gps time", () -> gpsAssembler.assemble(fields)).orElse(null);

        Optional<CaptureTime> local = steps.attempt("local time", fields::captureTime);
        if (local.isEmpty()) {
            var partial = new ReconciliationResult(model, null, null, gpsTime, false, steps.diagnostics());
            if (gpsTime == null) {
                throw new NoTimeAvailableException(partial, steps.failure("local time").orElse(null));
            }
            return partial;
        }

        Optional<LatLong> latLong = fields.latLong();
        boolean hasGpsLocation = latLong.isPresent();
        ZonedDateTime corrected = null;
        if (local.get() instanceof CaptureTime.Naive) {
            if (hasGpsLocation) {
                corrected = correct(fields, latLong.get(), steps);
            } else {
                steps.note("correction", "no GPS location");
            }
        } else if (hasGpsLocation) {
            steps.note("correction", "capture time already carries offset " + local.get());
        }
        return new ReconciliationResult(model, local.get(), corrected, gpsTime, hasGpsLocation, steps.diagnostics());
    }

    private ZonedDateTime correct(ExifFields fields, LatLong latLong, ReconciliationSteps steps) {
        String zoneName = zoneNameLookup.lookupZoneName(latLong.latitude(), latLong.longitude());
        Optional<ZoneId> zone = zoneResolver.resolve(zoneName);
        if (zone.isEmpty()) {
            steps.note("correction", "no time zone for " + latLong.latitude() + "," + latLong.longitude()
                    + (zoneName.isEmpty() ? "" : " (" + zoneName + ")"));
            return null;
        }
        return steps.attempt("correction", () -> corrector.correct(fields, zone.get())).orElse(null);
    }
}
