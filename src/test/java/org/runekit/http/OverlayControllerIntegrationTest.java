package org.runekit.http;

import static io.restassured.RestAssured.given;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.nullValue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;

import java.awt.Rectangle;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import javax.imageio.ImageIO;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.runekit.junit.extensions.logging.AllowLog;
import org.runekit.junit.extensions.logging.ExpectLog;
import org.runekit.junit.extensions.logging.LogLevel;
import org.runekit.junit.extensions.logging.LogWatchExtension;
import org.runekit.overlay.OverlayEngine;
import org.runekit.overlay.OverlaySettings;
import org.runekit.overlay.render.scene.SceneRenderSurface;
import org.runekit.overlay.scheduling.DeferredExecutor;
import org.runekit.overlay.scheduling.EngineThreadExecutor;
import org.runekit.overlay.window.StaticWindowTracker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import io.javalin.Javalin;
import io.restassured.http.ContentType;
import io.restassured.specification.RequestSpecification;

/**
 * Drives a running overlay host over HTTP.
 */
@Tag("integration")
@ExtendWith(LogWatchExtension.class)
@AllowLog(level = LogLevel.WARN, loggerPattern = "org\\.eclipse\\.jetty.*")
class OverlayControllerIntegrationTest {

    private static final String BASE_PATH = "/overlay";

    private OverlayHost host;
    private Javalin app;
    private EngineThreadExecutor extraExecutor;

    @BeforeEach
    void setUp() {
        Config config = ConfigFactory.parseResources("test-config.conf")
                .withFallback(ConfigFactory.defaultReferenceUnresolved())
                .resolve();
        host = OverlayHost.start(config);
    }

    @AfterEach
    void tearDown() {
        if (app != null) {
            app.stop();
        }
        if (extraExecutor != null) {
            extraExecutor.close();
        }
        if (host != null) {
            host.close();
        }
    }

    private RequestSpecification api() {
        return given().port(host.port()).basePath(BASE_PATH).contentType(ContentType.JSON);
    }

    @Test
    void sequencedCommandsBuildGroupState() {
        api().body("{\"callId\": 1, \"command\": \"overlay_set_group\", \"args\": [\"hud\"]}")
                .post("/enqueue")
                .then()
                .statusCode(202)
                .body("accepted", equalTo(1));
        api().body("{\"callId\": 2, \"command\": \"overlay_rect\", \"args\": [4278190335, 10, 10, 50, 50, 5000, 10]}")
                .post("/enqueue")
                .then()
                .statusCode(202);

        api().get("/state")
                .then()
                .statusCode(200)
                .body("attached", equalTo(true))
                .body("lastProcessedCallId", equalTo(2))
                .body("activeGroups.hud", equalTo(5000))
                .body("contextStack", contains("hud"));
    }

    @Test
    void barrierOvertakingItsPredecessorIsReportedAsPending() {
        api().body("{\"callId\": 1, \"command\": \"overlay_set_group\", \"args\": [\"hud\"]}").post("/enqueue");
        api().body("{\"callId\": 3, \"command\": \"overlay_freeze_group\", \"args\": [\"hud\"]}")
                .post("/enqueue")
                .then()
                .statusCode(202);

        api().get("/state").then().body("pendingCallIds", contains(3));

        api().body("{\"callId\": 2, \"command\": \"overlay_rect\", \"args\": [4278190335, 0, 0, 5, 5, 5000, 10]}")
                .post("/enqueue");

        api().get("/state")
                .then()
                .body("pendingCallIds.size()", equalTo(0))
                .body("frozenGroups", contains("hud"));
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Rejected command #5 '_overlay_secret'.*")
    void rejectedCommandIsBadRequest() {
        api().body("{\"callId\": 5, \"command\": \"_overlay_secret\", \"args\": []}")
                .post("/enqueue")
                .then()
                .statusCode(400)
                .body("status", equalTo(400))
                .body("message", containsString("_overlay_secret"));
    }

    @Test
    void negativeCallIdIsBadRequest() {
        api().body("{\"callId\": -1, \"command\": \"overlay_set_group\", \"args\": [\"hud\"]}")
                .post("/enqueue")
                .then()
                .statusCode(400)
                .body("message", containsString("callId"));
    }

    @Test
    void missingCommandIsBadRequest() {
        api().body("{\"callId\": 1}")
                .post("/enqueue")
                .then()
                .statusCode(400)
                .body("message", equalTo("command is required"));
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Malformed EnqueueRequest body.*")
    void malformedBodyIsBadRequest() {
        api().body("{not json")
                .post("/enqueue")
                .then()
                .statusCode(400)
                .body("error", equalTo("Bad Request"));
    }

    @Test
    void batchRunsUnsequenced() {
        api().body("{\"commands\": ["
                        + "[\"overlay_set_group\", [\"pinned\"]],"
                        + "{\"command\": \"overlay_rect\", \"args\": [4278190335, 0, 0, 5, 5, 0, 10]}"
                        + "]}")
                .post("/batch")
                .then()
                .statusCode(202)
                .body("accepted", equalTo(2));

        api().get("/state")
                .then()
                .body("frozenGroups", hasItem("pinned"))
                .body("lastProcessedCallId", nullValue());
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Rejected batch: Malformed batch entry.*")
    void malformedBatchEntryRejectsTheBatch() {
        api().body("{\"commands\": [[\"overlay_set_group\", [\"a\"]], 42]}")
                .post("/batch")
                .then()
                .statusCode(400);

        api().get("/state").then().body("contextStack.size()", equalTo(0));
    }

    @Test
    void pointerMovesFollowingGroups() {
        api().body("{\"commands\": ["
                        + "[\"overlay_set_group\", [\"cursor\"]],"
                        + "[\"overlay_text\", [\"{self.mouse_x}\", 4294967295, 12, 0, 0, 0, \"\", false, false]],"
                        + "[\"overlay_move_group\", [\"cursor\", true]]"
                        + "]}")
                .post("/batch")
                .then()
                .statusCode(202);

        api().body("{\"x\": 200, \"y\": 100}")
                .post("/pointer")
                .then()
                .statusCode(202);

        await().atMost(5, TimeUnit.SECONDS).untilAsserted(() ->
                api().get("/state").then().body("models.cursor.mouse_x", equalTo(200)));
    }

    @Test
    void pointerRequiresCoordinates() {
        api().body("{\"x\": 1}").post("/pointer").then().statusCode(400);
    }

    @Test
    void frameIsRenderedAsPng() throws IOException {
        api().body("{\"callId\": 1, \"command\": \"overlay_rect\", \"args\": [4278190335, 10, 10, 50, 50, 0, 10]}")
                .post("/enqueue");

        byte[] png = api().get("/frame.png")
                .then()
                .statusCode(200)
                .contentType("image/png")
                .extract()
                .asByteArray();

        BufferedImage frame = ImageIO.read(new ByteArrayInputStream(png));
        assertThat(frame.getWidth()).isEqualTo(320);
        assertThat(frame.getHeight()).isEqualTo(240);
    }

    @Test
    void resetViaCallIdZeroClearsState() {
        api().body("{\"callId\": 7, \"command\": \"overlay_set_group\", \"args\": [\"old\"]}").post("/enqueue");
        api().body("{\"callId\": 0, \"command\": \"overlay_set_group\", \"args\": [\"new\"]}").post("/enqueue");

        api().get("/state")
                .then()
                .body("contextStack", contains("new"))
                .body("lastProcessedCallId", equalTo(0));
    }

    @Test
    void detachedEngineIsUnavailable() {
        extraExecutor = new EngineThreadExecutor("detached-engine");
        OverlayEngine detached = new OverlayEngine(extraExecutor, null,
                new StaticWindowTracker(new Rectangle(0, 0, 10, 10)), OverlaySettings.defaults(),
                new HideEventBroadcaster());
        app = Javalin.create().start(0);
        new OverlayController(detached, new ObjectMapper(), Duration.ofSeconds(2), new HideEventBroadcaster(), null)
                .registerRoutes(app, "");

        given().port(app.port()).contentType(ContentType.JSON)
                .body("{\"callId\": 1, \"command\": \"overlay_set_group\", \"args\": [\"hud\"]}")
                .post("/enqueue")
                .then()
                .statusCode(503);
        given().port(app.port()).get("/frame.png").then().statusCode(404);
        given().port(app.port()).contentType(ContentType.JSON).body("{\"x\": 1, \"y\": 1}")
                .post("/pointer").then().statusCode(404);
        given().port(app.port()).get("/state").then().statusCode(200).body("attached", equalTo(false));
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Engine unavailable: Engine did not respond within 200 ms")
    void unresponsiveEngineIsUnavailable() {
        DeferredExecutor stuck = mock(DeferredExecutor.class);
        doReturn(new CompletableFuture<>()).when(stuck).submit(any());
        OverlayEngine engine = new OverlayEngine(stuck, new SceneRenderSurface(10, 10, () -> 0L),
                new StaticWindowTracker(new Rectangle(0, 0, 10, 10)), OverlaySettings.defaults(),
                new HideEventBroadcaster());
        app = Javalin.create().start(0);
        new OverlayController(engine, new ObjectMapper(), Duration.ofMillis(200), new HideEventBroadcaster(), null)
                .registerRoutes(app, "");

        given().port(app.port()).get("/state")
                .then()
                .statusCode(503)
                .body("message", containsString("did not respond"));
    }
}
