package com.eyelevel.videosynthesis.dto.common;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;

/**
 * A standardized, generic wrapper for all API responses.
 * It provides a consistent structure for both successful and failed responses,
 * making it easy for clients to handle them.
 **/
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {
    /**
     * A message to display to the user.
     */
    private final String displayMessage;

    /**
     * The response data. For errors, a technical detail string.
     */
    private final T response;

    /**
     * A flag indicating whether to show the display message.
     */
    private final Boolean showMessage;

    /**
     * The HTTP status code of the response.
     */
    private final Integer statusCode;

    public static <T> ApiResponse<T> success(T response) {
        return ApiResponse.<T>builder().response(response).showMessage(false).build();
    }

    public static ApiResponse<Object> error(String displayMessage) {
        return ApiResponse.builder().displayMessage(displayMessage).showMessage(true).build();
    }

    public static ApiResponse<Object> error(String displayMessage, String detail) {
        return ApiResponse.builder().displayMessage(displayMessage).response(detail).showMessage(true).build();
    }
}
