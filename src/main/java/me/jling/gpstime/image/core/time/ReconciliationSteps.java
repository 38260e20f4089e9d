package me.jling.gpstime.image.core.time;

import lombok.extern.slf4j.Slf4j;
import me.jling.gpstime.exception.ExifTimeException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Runs the independent, fallible steps of one reconciliation. A failed step
 * leaves its value empty and adds a diagnostic line; it never stops the steps
 * after it.
 */
@Slf4j
final class ReconciliationSteps {

    private final String source;
    private final List<String> diagnostics = new ArrayList<>();
    private final Map<String, ExifTimeException> failures = new LinkedHashMap<>();

    ReconciliationSteps(String source) {
        this.source = source;
    }

    <T> Optional<T> attempt(String step, Supplier<T> body) {
        try {
            return Optional.ofNullable(body.get());
        } catch (ExifTimeException e) {
            failures.put(step, e);
            note(step, e.getMessage());
            return Optional.empty();
        }
    }

    void note(String step, String message) {
        log.debug("[{}] {}: {}", step, source, message);
        diagnostics.add(step + ": " + message);
    }

    Optional<ExifTimeException> failure(String step) {
        return Optional.ofNullable(failures.get(step));
    }

    List<String> diagnostics() {
        return List.copyOf(diagnostics);
    }
}
