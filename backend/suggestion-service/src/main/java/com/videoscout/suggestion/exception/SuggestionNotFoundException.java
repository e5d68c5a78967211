package com.videoscout.suggestion.exception;

public class SuggestionNotFoundException extends SuggestionServiceException {

    public SuggestionNotFoundException(Long suggestionId) {
        super("SUGGESTION_NOT_FOUND", "Suggestion not found: " + suggestionId);
    }
}
