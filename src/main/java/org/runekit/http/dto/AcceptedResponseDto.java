package org.runekit.http.dto;

/**
 * Body of a {@code 202 Accepted} response.
 *
 * @param accepted number of commands handed to the engine.
 */
public record AcceptedResponseDto(int accepted) {}
