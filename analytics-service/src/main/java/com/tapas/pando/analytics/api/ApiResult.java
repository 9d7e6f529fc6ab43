package com.tapas.pando.analytics.api;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Envelope shared by every data endpoint. Error responses carry only code and message.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResult<T>(
        int code,
        String message,
        T data,
        ApiMeta meta
) {
    public static <T> ApiResult<T> success(T data, int totalRows) {
        return new ApiResult<>(200, "success", data, new ApiMeta(totalRows, ApiMeta.SOURCE));
    }

    public static ApiResult<Void> error(int code, String message) {
        return new ApiResult<>(code, message, null, null);
    }
}
