package me.jling.gpstime.image.core.time;

import me.jling.gpstime.exception.InvalidRationalException;

import java.math.BigInteger;
import java.time.Duration;

/**
 * Converts EXIF rationals into durations.
 */
public final class RationalDurations {

    private static final BigInteger NANOS_PER_SECOND = BigInteger.valueOf(1_000_000_000L);

    private RationalDurations() {
    }

    /**
     * {@code numerator * unit / denominator}, truncated toward zero at nanosecond
     * precision.
     *
     * @throws InvalidRationalException if {@code denominator} is zero
     */
    public static Duration toDuration(long numerator, long denominator, Duration unit) {
        if (denominator == 0) {
            throw new InvalidRationalException("zero denominator");
        }
        // 10^9 * 3.6 * 10^12 overflows a long
        BigInteger nanos = BigInteger.valueOf(numerator)
                .multiply(BigInteger.valueOf(unit.getSeconds()).multiply(NANOS_PER_SECOND)
                        .add(BigInteger.valueOf(unit.getNano())))
                .divide(BigInteger.valueOf(denominator));
        BigInteger[] secondsAndNanos = nanos.divideAndRemainder(NANOS_PER_SECOND);
        try {
            return Duration.ofSeconds(secondsAndNanos[0].longValueExact(), secondsAndNanos[1].longValue());
        } catch (ArithmeticException e) {
            throw new InvalidRationalException(numerator + "/" + denominator + " out of range");
        }
    }
}
