package org.runekit.http;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

import org.runekit.overlay.group.OverlayEventListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.javalin.http.sse.SseClient;

/**
 * Forwards group hide notifications to connected server-sent-event clients.
 * <p>
 * <strong>Thread Safety:</strong> Thread-safe. Clients connect on HTTP worker threads,
 * events are published on the engine thread.
 */
public class HideEventBroadcaster implements OverlayEventListener {

    private static final Logger log = LoggerFactory.getLogger(HideEventBroadcaster.class);

    /** SSE event name of a hide notification. */
    public static final String HIDE_GROUP_EVENT = "hide-group";

    private final Queue<SseClient> clients = new ConcurrentLinkedQueue<>();

    /**
     * Registers a client until its connection closes.
     */
    public void connect(SseClient client) {
        client.keepAlive();
        client.onClose(() -> clients.remove(client));
        clients.add(client);
        log.debug("SSE client connected, {} client(s)", clients.size());
    }

    @Override
    public void onGroupHidden(String name) {
        for (SseClient client : clients) {
            try {
                client.sendEvent(HIDE_GROUP_EVENT, name);
            } catch (RuntimeException e) {
                log.warn("Dropping SSE client after send failure: {}", e.getMessage());
                clients.remove(client);
            }
        }
    }

    public int clientCount() {
        return clients.size();
    }
}
