package com.videoscout.suggestion.exception;

/**
 * 추천 서비스 예외 기본 클래스
 */
public class SuggestionServiceException extends RuntimeException {

    private final String errorCode;

    public SuggestionServiceException(String message) {
        super(message);
        this.errorCode = "SUGGESTION_ERROR";
    }

    public SuggestionServiceException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = "SUGGESTION_ERROR";
    }

    public SuggestionServiceException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public SuggestionServiceException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
