package org.runekit.http;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.runekit.junit.extensions.logging.ExpectLog;
import org.runekit.junit.extensions.logging.LogLevel;
import org.runekit.junit.extensions.logging.LogWatchExtension;

import io.javalin.http.sse.SseClient;

@Tag("unit")
@ExtendWith({MockitoExtension.class, LogWatchExtension.class})
class HideEventBroadcasterTest {

    @Mock
    private SseClient first;

    @Mock
    private SseClient second;

    private final HideEventBroadcaster broadcaster = new HideEventBroadcaster();

    @Test
    void connectKeepsClientAliveUntilClosed() {
        broadcaster.connect(first);

        verify(first).keepAlive();
        ArgumentCaptor<Runnable> onClose = ArgumentCaptor.forClass(Runnable.class);
        verify(first).onClose(onClose.capture());
        assertThat(broadcaster.clientCount()).isEqualTo(1);

        onClose.getValue().run();

        assertThat(broadcaster.clientCount()).isZero();
    }

    @Test
    void hideIsSentToEveryClient() {
        broadcaster.connect(first);
        broadcaster.connect(second);

        broadcaster.onGroupHidden("hud");

        verify(first).sendEvent(HideEventBroadcaster.HIDE_GROUP_EVENT, "hud");
        verify(second).sendEvent(HideEventBroadcaster.HIDE_GROUP_EVENT, "hud");
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Dropping SSE client after send failure: closed")
    void failingClientIsDropped() {
        doThrow(new IllegalStateException("closed")).when(first).sendEvent(any(String.class), any());
        broadcaster.connect(first);
        broadcaster.connect(second);

        broadcaster.onGroupHidden("hud");
        broadcaster.onGroupHidden("map");

        assertThat(broadcaster.clientCount()).isEqualTo(1);
        verify(second).sendEvent(HideEventBroadcaster.HIDE_GROUP_EVENT, "map");
        verify(first, never()).sendEvent(HideEventBroadcaster.HIDE_GROUP_EVENT, "map");
    }
}
