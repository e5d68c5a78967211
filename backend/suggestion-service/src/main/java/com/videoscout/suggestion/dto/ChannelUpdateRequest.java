package com.videoscout.suggestion.dto;

import java.time.LocalDateTime;

/**
 * A tracked channel to poll. lastCheck is null for never-checked channels; rating is null when unrated.
 */
public record ChannelUpdateRequest(String channelId, String channelName, LocalDateTime lastCheck, Integer rating) {

    public boolean isLowestTier() {
        return rating != null && rating <= 1;
    }
}
