package com.videoscout.suggestion.dto;

/**
 * Classification of YouTube API failures. None of these are retried by the client.
 */
public enum ApiErrorType {
    /** 403 from the provider or local budget exhausted; stop spending */
    QUOTA_EXCEEDED,
    /** 400; skip the item */
    INVALID_REQUEST,
    /** 401 or missing key; halts the client until an operator resumes it */
    AUTH_FAILURE,
    /** any other status, timeouts, network and parse errors */
    TRANSIENT
}
