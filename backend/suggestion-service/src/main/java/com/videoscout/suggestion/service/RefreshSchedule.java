package com.videoscout.suggestion.service;

import com.videoscout.suggestion.config.SuggestionProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Decides when a tracked channel is worth polling again, by the user's star rating.
 *
 * 5★ 5 days, 4★ 7 days, 3★ 10 days, 2★ 14 days (configurable). 1★ channels are never polled.
 * A channel that was never checked is polled once regardless of rating (except 1★);
 * ratings without an interval are not re-polled after that.
 */
@Component
public class RefreshSchedule {

    private final SuggestionProperties.Curation curation;

    public RefreshSchedule(SuggestionProperties properties) {
        this.curation = properties.getCuration();
    }

    public Optional<Duration> refreshInterval(Integer stars) {
        if (stars == null) {
            return Optional.empty();
        }
        Integer days = curation.getRefreshDays().get(stars);
        return days == null ? Optional.empty() : Optional.of(Duration.ofDays(days));
    }

    public boolean isDue(Integer stars, LocalDateTime lastCheck, LocalDateTime now) {
        if (stars != null && stars <= 1) {
            return false;
        }
        if (lastCheck == null) {
            return true;
        }
        return refreshInterval(stars)
                .map(interval -> Duration.between(lastCheck, now).compareTo(interval) >= 0)
                .orElse(false);
    }
}
