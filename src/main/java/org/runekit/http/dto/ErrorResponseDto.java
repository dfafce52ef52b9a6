package org.runekit.http.dto;

import java.time.Instant;

/**
 * JSON body of every error response.
 *
 * @param timestamp ISO-8601 time the error occurred.
 * @param status    HTTP status code.
 * @param error     HTTP reason phrase.
 * @param message   human-readable description.
 */
public record ErrorResponseDto(String timestamp, int status, String error, String message) {

    public static ErrorResponseDto of(int status, String error, String message) {
        return new ErrorResponseDto(Instant.now().toString(), status, error, message);
    }
}
