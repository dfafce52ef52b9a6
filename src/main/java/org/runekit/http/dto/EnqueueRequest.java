package org.runekit.http.dto;

import java.util.List;

/**
 * Body of {@code POST /enqueue}.
 *
 * @param callId  sender-assigned call id, {@code 0} resets the engine.
 * @param command wire name of the command.
 * @param args    raw command arguments.
 */
public record EnqueueRequest(Long callId, String command, List<Object> args) {}
