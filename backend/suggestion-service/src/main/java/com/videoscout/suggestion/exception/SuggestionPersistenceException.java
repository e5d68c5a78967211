package com.videoscout.suggestion.exception;

/**
 * 저장소 장애로 추천 배치 전체가 중단된 경우
 */
public class SuggestionPersistenceException extends SuggestionServiceException {

    public SuggestionPersistenceException(String message, Throwable cause) {
        super("PERSISTENCE_FAILURE", message, cause);
    }
}
