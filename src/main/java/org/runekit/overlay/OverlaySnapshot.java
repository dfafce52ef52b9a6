package org.runekit.overlay;

import java.util.List;
import java.util.Map;

/**
 * Point-in-time view of the engine state, safe to hand to other threads.
 *
 * @param attached              whether a rendering surface is attached.
 * @param lastProcessedCallId   last processed call id, or {@code null} after a reset.
 * @param pendingCallIds        call ids waiting in the sequencer, in drain order.
 * @param activeGroups          active group names and their clamped timeouts.
 * @param frozenGroups          frozen group names.
 * @param contextStack          group context names, most recent first.
 * @param models                bound text models by group name.
 * @param pointerFollowing      groups currently following the pointer.
 */
public record OverlaySnapshot(
        boolean attached,
        Long lastProcessedCallId,
        List<Long> pendingCallIds,
        Map<String, Integer> activeGroups,
        List<String> frozenGroups,
        List<String> contextStack,
        Map<String, Map<String, Object>> models,
        List<String> pointerFollowing) {

    static OverlaySnapshot detached(Long lastProcessedCallId, List<Long> pendingCallIds) {
        return new OverlaySnapshot(false, lastProcessedCallId, pendingCallIds, Map.of(), List.of(), List.of(),
                Map.of(), List.of());
    }
}
