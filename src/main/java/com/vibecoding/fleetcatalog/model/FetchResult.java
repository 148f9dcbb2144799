package com.vibecoding.fleetcatalog.model;

import java.util.Optional;

/**
 * 외부 호출 결과. 실패는 예외 대신 값으로 전달된다.
 */
public final class FetchResult<T> {

    private final T value;
    private final Exception error;

    private FetchResult(T value, Exception error) {
        this.value = value;
        this.error = error;
    }

    public static <T> FetchResult<T> success(T value) {
        return new FetchResult<>(value, null);
    }

    public static <T> FetchResult<T> failure(Exception error) {
        return new FetchResult<>(null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    /**
     * 성공 값, 실패 또는 null 이면 fallback
     */
    public T getOrDefault(T fallback) {
        return isSuccess() && value != null ? value : fallback;
    }

    public Optional<Exception> getError() {
        return Optional.ofNullable(error);
    }

    @Override
    public String toString() {
        return isSuccess() ? "FetchResult[success]" : "FetchResult[failure: " + error.getMessage() + "]";
    }
}
