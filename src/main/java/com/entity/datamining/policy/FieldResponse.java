package com.entity.datamining.policy;

import java.util.Objects;

/**
 * Outcome of a field request.
 *
 * @param success   whether data was produced
 * @param data      the value served, null on failure
 * @param error     diagnostic text, null on success
 * @param source    where the data came from, null on failure
 * @param errorKind classification of the failure, null on success
 */
public record FieldResponse(
        boolean success,
        Object data,
        String error,
        ResponseSource source,
        FetchErrorKind errorKind
) {

    public static FieldResponse of(Object data, ResponseSource source) {
        return new FieldResponse(true, data, null, Objects.requireNonNull(source, "source is required"), null);
    }

    public static FieldResponse failure(FetchErrorKind kind, String error) {
        return new FieldResponse(false, null, error, null, Objects.requireNonNull(kind, "kind is required"));
    }
}
