package me.jling.gpstime.image.core.time;

import me.jling.gpstime.exception.DecodeFailedException;
import me.jling.gpstime.exception.NoTimeAvailableException;
import me.jling.gpstime.image.core.exif.CaptureTime;
import me.jling.gpstime.image.core.tool.ReconciliationResult;
import me.jling.gpstime.image.core.tool.ReconciliationStatus;
import me.jling.gpstime.image.core.zone.ZoneNameLookup;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

import static me.jling.gpstime.image.core.exif.ExifFixtures.exif;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ExifTimeReconcilerTest {

    private ZoneNameLookup zoneNameLookup;
    private ExifTimeReconciler reconciler;

    @BeforeEach
    void setUp() {
        zoneNameLookup = mock(ZoneNameLookup.class);
        when(zoneNameLookup.lookupZoneName(anyDouble(), anyDouble())).thenReturn("America/New_York");
        reconciler = new ExifTimeReconciler(
                new GpsTimestampAssembler(), new LocalTimeCorrector(), new ZoneResolver(), zoneNameLookup);
    }

    @Test
    void shouldFailWithPartialResultWhenAllTimesMissing() {
        assertThatThrownBy(() -> reconciler.reconcile(exif().model("Acme X1").build()))
                .isInstanceOfSatisfying(NoTimeAvailableException.class, e -> {
                    ReconciliationResult partial = e.getPartialResult();
                    assertThat(partial.model()).isEqualTo("Acme X1");
                    assertThat(partial.local()).isEmpty();
                    assertThat(partial.gps()).isEmpty();
                    assertThat(partial.corrected()).isEmpty();
                    assertThat(partial.status()).isEqualTo(ReconciliationStatus.ALL_TIMES_MISSING);
                });
    }

    @Test
    void shouldReportOnlyGpsTime() {
        ReconciliationResult result = reconciler.reconcile(exif().model("Acme X1")
                .gpsDate("2014:05:02").gpsTime(14, 30, 0).build());

        assertThat(result.gpsTime()).isEqualTo(Instant.parse("2014-05-02T14:30:00Z"));
        assertThat(result.local()).isEmpty();
        assertThat(result.status()).isEqualTo(ReconciliationStatus.ONLY_GPS_TIME);
        assertThat(result.diagnostics()).anyMatch(d -> d.startsWith("local time:"));
    }

    @Test
    void shouldReconcileNaiveLocalTimeInZoneOfGpsPosition() {
        ReconciliationResult result = reconciler.reconcile(exif().model("Acme X1")
                .dateTimeOriginal("2014:05:02 13:31:02")
                .gpsDate("2014:05:02").gpsTime(14, 30, 0)
                .latLong(40.7128, -74.006)
                .build());

        assertThat(result.hasGpsLocation()).isTrue();
        assertThat(result.correctedTime().toInstant()).isEqualTo(Instant.parse("2014-05-02T17:31:02Z"));
        assertThat(result.delta()).contains(Duration.ofHours(3).plusMinutes(1).plusSeconds(2));
        assertThat(result.status()).isEqualTo(ReconciliationStatus.RECONCILED);
        assertThat(result.diagnostics()).isEmpty();
    }

    @Test
    void shouldReportCorrectionFailureWhenZoneNameIsUnknown() {
        when(zoneNameLookup.lookupZoneName(anyDouble(), anyDouble())).thenReturn("");

        ReconciliationResult result = reconciler.reconcile(exif().model("Acme X1")
                .dateTimeOriginal("2014:05:02 13:31:02")
                .gpsDate("2014:05:02").gpsTime(14, 30, 0)
                .latLong(40.7128, -74.006)
                .build());

        assertThat(result.corrected()).isEmpty();
        assertThat(result.hasGpsLocation()).isTrue();
        assertThat(result.status()).isEqualTo(ReconciliationStatus.CORRECTION_FAILED);
    }

    @Test
    void shouldReportCorrectionFailureWhenZoneDatabaseRejectsName() {
        when(zoneNameLookup.lookupZoneName(anyDouble(), anyDouble())).thenReturn("Nowhere/Land");

        ReconciliationResult result = reconciler.reconcile(exif()
                .dateTimeOriginal("2014:05:02 13:31:02")
                .gpsDate("2014:05:02").gpsTime(14, 30, 0)
                .latLong(40.7128, -74.006)
                .build());

        assertThat(result.status()).isEqualTo(ReconciliationStatus.CORRECTION_FAILED);
        assertThat(result.diagnostics()).anyMatch(d -> d.contains("Nowhere/Land"));
    }

    @Test
    void shouldReportMissingLocation() {
        ReconciliationResult result = reconciler.reconcile(exif()
                .dateTimeOriginal("2014:05:02 13:31:02")
                .gpsDate("2014:05:02").gpsTime(14, 30, 0)
                .build());

        assertThat(result.hasGpsLocation()).isFalse();
        assertThat(result.status()).isEqualTo(ReconciliationStatus.NO_GPS_LOCATION);
        verify(zoneNameLookup, never()).lookupZoneName(anyDouble(), anyDouble());
    }

    @Test
    void shouldNotCorrectCaptureTimeThatCarriesItsOwnOffset() {
        ReconciliationResult result = reconciler.reconcile(exif()
                .dateTimeOriginal("2014:05:02 16:31:02")
                .offsetTimeOriginal("+02:00")
                .gpsDate("2014:05:02").gpsTime(14, 30, 0)
                .latLong(40.7128, -74.006)
                .build());

        assertThat(result.localTime()).isInstanceOf(CaptureTime.OffsetQualified.class);
        assertThat(result.hasGpsLocation()).isTrue();
        assertThat(result.corrected()).isEmpty();
        assertThat(result.diagnostics()).anyMatch(d -> d.startsWith("correction: capture time already carries offset"));
        verify(zoneNameLookup, never()).lookupZoneName(anyDouble(), anyDouble());
    }

    @Test
    void shouldNotReportMissingLocationForPhoneStylePhotoWithOffset() {
        ReconciliationResult result = reconciler.reconcile(exif().model("iPhone")
                .dateTimeOriginal("2014:05:02 10:30:00")
                .offsetTimeOriginal("-04:00")
                .gpsDate("2014:05:02").gpsTime(14, 30, 0)
                .latLong(40.7128, -74.006)
                .build());

        assertThat(result.hasGpsLocation()).isTrue();
        assertThat(result.status()).isEqualTo(ReconciliationStatus.CORRECTION_FAILED);
    }

    @Test
    void shouldReportMissingLocationForOffsetQualifiedTimeWithoutCoordinates() {
        ReconciliationResult result = reconciler.reconcile(exif().model("iPhone")
                .dateTimeOriginal("2014:05:02 10:30:00")
                .offsetTimeOriginal("-04:00")
                .gpsDate("2014:05:02").gpsTime(14, 30, 0)
                .build());

        assertThat(result.hasGpsLocation()).isFalse();
        assertThat(result.status()).isEqualTo(ReconciliationStatus.NO_GPS_LOCATION);
    }

    @Test
    void shouldKeepLocalAndCorrectedTimeWhenGpsTimeIsBroken() {
        ReconciliationResult result = reconciler.reconcile(exif().model("Acme X1")
                .dateTimeOriginal("2014:05:02 13:31:02")
                .gpsDate("not a date").gpsTime(14, 30, 0)
                .latLong(40.7128, -74.006)
                .build());

        assertThat(result.gps()).isEmpty();
        assertThat(result.corrected()).isPresent();
        assertThat(result.status()).isEqualTo(ReconciliationStatus.GPS_TIME_UNAVAILABLE);
        assertThat(result.diagnostics()).anyMatch(d -> d.startsWith("gps time:"));
    }

    @Test
    void shouldFailDecodingStructurallyInvalidFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("broken.jpg");
        Files.writeString(file, "definitely not an image", StandardCharsets.US_ASCII);

        assertThatThrownBy(() -> reconciler.reconcile(file)).isInstanceOf(DecodeFailedException.class);
    }
}
