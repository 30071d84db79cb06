package com.linkdeck.linkservice.infrastructure.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.linkdeck.security.ErrorCode;

/**
 * Body of every error response: {@code {error, code, message}}. Permission denials also name the
 * missing permission.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorPayload(String error, String code, String message, String permission) {

    public static ErrorPayload of(ErrorCode code, String message) {
        return new ErrorPayload(code.error(), code.name(), message, null);
    }
}
