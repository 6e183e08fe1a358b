package com.keystone.apiserver.routing;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * The JSON envelope every API response uses: {@code {status, message}} or {@code {status, data}}.
 *
 * <p>Success responses use {@value #SUCCESS}; failures use {@value #FAILED}. The capitalization
 * differs and clients match on the exact strings.
 *
 * @param status {@value #SUCCESS} or {@value #FAILED}
 * @param message human-readable message, omitted when null
 * @param data payload, omitted when null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResponseEnvelope(String status, String message, Object data) {

    public static final String SUCCESS = "success";

    public static final String FAILED = "Failed";

    public static ResponseEnvelope successMessage(String message) {
        return new ResponseEnvelope(SUCCESS, message, null);
    }

    public static ResponseEnvelope successData(Object data) {
        return new ResponseEnvelope(SUCCESS, null, data);
    }

    public static ResponseEnvelope failed(String message) {
        return new ResponseEnvelope(FAILED, message, null);
    }
}
