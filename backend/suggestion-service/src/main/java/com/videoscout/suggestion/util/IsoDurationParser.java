package com.videoscout.suggestion.util;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.format.DateTimeParseException;

/**
 * Converts YouTube contentDetails.duration values (ISO-8601, e.g. PT1H2M3S, P1DT2H) to seconds.
 */
@Slf4j
public final class IsoDurationParser {

    private IsoDurationParser() {
    }

    /**
     * @return seconds, or 0 for null, blank or malformed input
     */
    public static long toSeconds(String isoDuration) {
        if (isoDuration == null || isoDuration.isBlank()) {
            return 0L;
        }
        try {
            long seconds = Duration.parse(isoDuration.trim()).getSeconds();
            return Math.max(0L, seconds);
        } catch (DateTimeParseException e) {
            log.debug("Unparseable duration '{}'", isoDuration);
            return 0L;
        }
    }
}
