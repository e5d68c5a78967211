package com.videoscout.suggestion.entity;

/**
 * Stored suggestion states. Expiry is derived from age and never stored.
 */
public enum SuggestionStatus {
    PENDING,
    APPROVED,
    DENIED
}
