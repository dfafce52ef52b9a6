package org.runekit.http.dto;

/**
 * Body of {@code POST /pointer}: the new pointer position in screen coordinates.
 */
public record PointerRequest(Integer x, Integer y) {}
