package org.runekit.overlay.primitives;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.awt.Color;
import java.awt.geom.Point2D;
import java.awt.geom.Rectangle2D;
import java.io.IOException;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.runekit.overlay.OverlaySettings;
import org.runekit.overlay.group.GroupContextStack;
import org.runekit.overlay.group.GroupRegistry;
import org.runekit.overlay.group.OverlayEventListener;
import org.runekit.overlay.render.DropShadow;
import org.runekit.overlay.render.PrimitiveHandle;
import org.runekit.overlay.render.scene.SceneRenderSurface;
import org.runekit.overlay.scheduling.VirtualTimeExecutor;
import org.runekit.overlay.template.TemplateBindings;

@Tag("unit")
class PrimitiveBuilderTest {

    private VirtualTimeExecutor executor;
    private SceneRenderSurface surface;
    private GroupRegistry registry;
    private GroupContextStack contexts;
    private TemplateBindings bindings;
    private PrimitiveBuilder builder;

    @BeforeEach
    void setUp() {
        OverlaySettings settings = OverlaySettings.defaults();
        executor = new VirtualTimeExecutor();
        surface = new SceneRenderSurface(400, 300, executor::currentTimeMillis);
        registry = new GroupRegistry(surface, executor, settings, OverlayEventListener.NONE);
        contexts = new GroupContextStack();
        bindings = new TemplateBindings(surface, registry);
        builder = new PrimitiveBuilder(surface, registry, contexts, bindings,
                new OverlayFonts(settings.maxFontSize(), settings.macFallbackFont(), "Linux"),
                new ImageDecoder(settings.imageCacheSize()), settings);
    }

    @Test
    void rectIsFiledUnderCurrentGroup() {
        contexts.push("hud");

        PrimitiveHandle rect = builder.rect(0xFF0000FF, 10, 10, 50, 50, 5000, 10);

        assertThat(registry.isActive("hud")).isTrue();
        assertThat(surface.children(registry.handle("hud").orElseThrow())).containsExactly(rect);
        assertThat(surface.color(rect)).isEqualTo(new Color(0, 0, 255, 255));
        assertThat(surface.strokeWidth(rect)).isEqualTo(1.0f);
    }

    @Test
    void withoutContextPrimitivesGoToDefaultGroup() {
        builder.line(0xFFFFFFFF, 30, 0, 0, 10, 10, 0);

        assertThat(registry.isFrozen(GroupContextStack.DEFAULT_GROUP)).isTrue();
    }

    @Test
    void strokeWidthIsTenthsWithMinimum() {
        assertThat(builder.strokeWidth(30)).isEqualTo(3.0f);
        assertThat(builder.strokeWidth(5)).isEqualTo(1.0f);
        assertThat(builder.strokeWidth(0)).isEqualTo(1.0f);
    }

    @Test
    void textIsFormattedAgainstGroupModelAndKeepsTemplate() {
        contexts.push("hud");
        bindings.bind("hud", Map.of("hp", 99));

        PrimitiveHandle text = builder.text("HP {self.hp}", 0xFFFFFFFF, 12, 5, 5, 0, "", false, true);

        assertThat(surface.text(text)).isEqualTo("HP 99");
        assertThat(surface.data(text, TemplateBindings.TEMPLATE_DATA_KEY)).isEqualTo("HP {self.hp}");
        assertThat(surface.shadow(text)).isEqualTo(DropShadow.HARD_BLACK);
    }

    @Test
    void textWithoutModelShowsRawTemplate() {
        PrimitiveHandle text = builder.text("HP {self.hp}", 0xFFFFFFFF, 12, 5, 5, 0, "", false, false);

        assertThat(surface.text(text)).isEqualTo("HP {self.hp}");
        assertThat(surface.shadow(text)).isNull();
    }

    @Test
    void fontSizeIsClamped() {
        PrimitiveHandle text = builder.text("big", 0xFFFFFFFF, 400, 0, 0, 0, "", false, false);

        assertThat(surface.font(text).getSize()).isEqualTo(50);
    }

    @Test
    void uncenteredTextHasTopLeftAtPointAndPivotsAroundCentre() {
        PrimitiveHandle text = builder.text("hello", 0xFFFFFFFF, 12, 100, 80, 0, "", false, false);
        Rectangle2D bounds = surface.boundingBox(text);

        Point2D position = surface.position(text);
        Point2D origin = surface.transformOrigin(text);

        assertThat(position).isEqualTo(new Point2D.Double(100, 80));
        assertThat(origin.getX()).isCloseTo(bounds.getWidth() / 2, within(1e-9));
        assertThat(origin.getY()).isCloseTo(bounds.getHeight() / 2, within(1e-9));
    }

    @Test
    void centeredTextIsPositionedAroundPoint() {
        PrimitiveHandle text = builder.text("hello", 0xFFFFFFFF, 12, 100, 80, 0, "", true, false);
        Rectangle2D bounds = surface.boundingBox(text);

        Point2D topLeft = surface.mapPointToScene(text, 0, 0);
        Point2D origin = surface.transformOrigin(text);

        assertThat(topLeft.getX()).isCloseTo(100 - bounds.getWidth() / 2, within(1e-9));
        assertThat(topLeft.getY()).isCloseTo(80 - bounds.getHeight() / 2, within(1e-9));
        assertThat(surface.mapPointToScene(text, origin.getX(), origin.getY()).getX()).isCloseTo(100, within(1e-9));
        assertThat(surface.mapPointToScene(text, origin.getX(), origin.getY()).getY()).isCloseTo(80, within(1e-9));
    }

    @Test
    void imageIsDecodedAndPositioned() throws IOException {
        contexts.push("icons");

        PrimitiveHandle image = builder.image(ImageDecoderTest.png(8, 8, Color.BLUE), 20, 30, 1000);

        assertThat(surface.mapPointToScene(image, 0, 0)).isEqualTo(new Point2D.Double(20, 30));
        assertThat(surface.boundingBox(image).getWidth()).isEqualTo(8.0);
        assertThat(registry.timeout("icons")).isEqualTo(1000);
    }

    @Test
    void undecodableImageFails() {
        assertThatThrownBy(() -> builder.image(new byte[] {9, 9, 9}, 0, 0, 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(registry.frozenNames()).isEmpty();
    }

    @Test
    void primitivesMergeIntoExistingGroup() {
        contexts.push("hud");
        PrimitiveHandle first = builder.rect(0xFFFFFFFF, 0, 0, 1, 1, 0, 10);
        PrimitiveHandle second = builder.rect(0xFFFFFFFF, 5, 5, 1, 1, 9000, 10);

        assertThat(registry.isFrozen("hud")).isTrue();
        assertThat(surface.children(registry.handle("hud").orElseThrow())).containsExactly(first, second);
    }
}
