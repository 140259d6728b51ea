package com.entity.datamining.source;

/**
 * Uniform outcome every external source returns.
 *
 * @param success whether the fetch succeeded
 * @param data    fetched payload, null on failure
 * @param error   source-specific diagnostic, null on success
 */
public record FetchResult(boolean success, Object data, String error) {

    public static FetchResult success(Object data) {
        return new FetchResult(true, data, null);
    }

    public static FetchResult failure(String error) {
        return new FetchResult(false, null, error != null ? error : "Unknown error");
    }
}
