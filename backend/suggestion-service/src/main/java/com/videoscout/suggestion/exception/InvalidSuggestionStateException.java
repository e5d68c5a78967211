package com.videoscout.suggestion.exception;

import com.videoscout.suggestion.entity.SuggestionStatus;

/**
 * 허용되지 않는 상태 전이 (예: 거절된 추천 승인)
 */
public class InvalidSuggestionStateException extends SuggestionServiceException {

    public InvalidSuggestionStateException(String message) {
        super("INVALID_SUGGESTION_STATE", message);
    }

    public static InvalidSuggestionStateException transition(Long id, SuggestionStatus from, SuggestionStatus to) {
        return new InvalidSuggestionStateException(
                String.format("Suggestion %d is %s and cannot become %s", id, from, to));
    }

    public static InvalidSuggestionStateException expired(Long id) {
        return new InvalidSuggestionStateException("Suggestion " + id + " has expired");
    }
}
