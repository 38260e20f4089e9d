package me.jling.gpstime.image.core.tool;

import me.jling.gpstime.image.core.exif.CaptureTime;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReconciliationResultTest {

    private static final CaptureTime LOCAL = new CaptureTime.Naive(LocalDateTime.of(2014, 5, 2, 13, 31, 2));
    private static final ZonedDateTime CORRECTED = ZonedDateTime.of(2014, 5, 2, 13, 31, 2, 0,
            ZoneId.of("America/New_York"));
    private static final Instant GPS = Instant.parse("2014-05-02T14:30:00Z");

    @Test
    void shouldClassifyInPriorityOrder() {
        assertThat(result(null, null, null, false).status()).isEqualTo(ReconciliationStatus.ALL_TIMES_MISSING);
        assertThat(result(null, null, GPS, true).status()).isEqualTo(ReconciliationStatus.ONLY_GPS_TIME);
        assertThat(result(LOCAL, null, GPS, true).status()).isEqualTo(ReconciliationStatus.CORRECTION_FAILED);
        assertThat(result(LOCAL, null, GPS, false).status()).isEqualTo(ReconciliationStatus.NO_GPS_LOCATION);
        assertThat(result(LOCAL, CORRECTED, GPS, true).status()).isEqualTo(ReconciliationStatus.RECONCILED);
        assertThat(result(LOCAL, CORRECTED, null, true).status()).isEqualTo(ReconciliationStatus.GPS_TIME_UNAVAILABLE);
        assertThat(result(LOCAL, null, null, false).status()).isEqualTo(ReconciliationStatus.GPS_TIME_UNAVAILABLE);
    }

    @Test
    void shouldComputeSignedDeltaOnlyWhenReconciled() {
        assertThat(result(LOCAL, CORRECTED, GPS, true).delta())
                .contains(Duration.ofHours(3).plusMinutes(1).plusSeconds(2));
        assertThat(result(LOCAL, CORRECTED, Instant.parse("2014-05-02T18:00:00Z"), true).delta())
                .hasValueSatisfying(d -> assertThat(d.isNegative()).isTrue());
        assertThat(result(LOCAL, null, GPS, true).delta()).isEmpty();
    }

    @Test
    void shouldRejectCorrectedTimeWithoutLocalTime() {
        assertThatThrownBy(() -> result(null, CORRECTED, GPS, true))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldDefaultModelAndDiagnostics() {
        ReconciliationResult r = new ReconciliationResult(null, null, null, GPS, false, null);

        assertThat(r.model()).isEmpty();
        assertThat(r.diagnostics()).isEmpty();
    }

    private static ReconciliationResult result(CaptureTime local, ZonedDateTime corrected, Instant gps,
                                               boolean hasLocation) {
        return new ReconciliationResult("Acme X1", local, corrected, gps, hasLocation, List.of());
    }
}
