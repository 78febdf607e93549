package com.linlay.agentroom.model.api;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.springframework.http.HttpStatusCode;

/**
 * Envelope for every HTTP reply: {@code code} 0 on success, the HTTP status otherwise.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(
        int code,
        String msg,
        T data
) {

    public static final int SUCCESS_CODE = 0;

    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(SUCCESS_CODE, "success", data);
    }

    public static <T> ApiResponse<T> failure(HttpStatusCode status, String msg) {
        return new ApiResponse<>(status.value(), msg, null);
    }

    public static <T> ApiResponse<T> failure(HttpStatusCode status, String msg, T data) {
        return new ApiResponse<>(status.value(), msg, data);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return code == SUCCESS_CODE;
    }
}
