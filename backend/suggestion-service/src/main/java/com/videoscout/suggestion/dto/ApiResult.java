package com.videoscout.suggestion.dto;

/**
 * Outcome of one client operation. A partial result carries both data and the error that cut it short.
 */
public record ApiResult<T>(T data, ApiErrorType errorType, String errorMessage) {

    public static <T> ApiResult<T> ok(T data) {
        return new ApiResult<>(data, null, null);
    }

    public static <T> ApiResult<T> partial(T data, ApiErrorType errorType, String errorMessage) {
        return new ApiResult<>(data, errorType, errorMessage);
    }

    public static <T> ApiResult<T> failure(ApiErrorType errorType, String errorMessage) {
        return new ApiResult<>(null, errorType, errorMessage);
    }

    public boolean isSuccess() {
        return errorType == null;
    }

    public boolean hasData() {
        return data != null;
    }

    public boolean isQuotaExceeded() {
        return errorType == ApiErrorType.QUOTA_EXCEEDED;
    }
}
