package org.runekit.http.dto;

import java.util.List;

/**
 * Body of {@code POST /batch}. Each entry is {@code {"command": ..., "args": [...]}} or
 * {@code [command, [args]]}.
 */
public record BatchRequest(List<Object> commands) {}
