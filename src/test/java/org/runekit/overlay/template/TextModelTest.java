package org.runekit.overlay.template;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.runekit.overlay.template.ModelValue.Flag;
import org.runekit.overlay.template.ModelValue.Num;
import org.runekit.overlay.template.ModelValue.Text;

@Tag("unit")
class TextModelTest {

    @Test
    void convertsDecodedJson() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("name", "Bob");
        raw.put("hp", 10);
        raw.put("ratio", 0.5);
        raw.put("alive", true);
        raw.put("pet", null);
        raw.put("inventory", List.of("rune", Map.of("qty", 3)));

        TextModel model = TextModel.fromMap(raw);

        assertThat(model.get("name")).contains(new Text("Bob"));
        assertThat(model.get("hp")).contains(Num.of(10L));
        assertThat(model.get("ratio")).contains(Num.of(0.5));
        assertThat(model.get("alive")).contains(new Flag(true));
        assertThat(model.get("pet")).contains(ModelValue.Null.INSTANCE);
        assertThat(model.get("inventory").orElseThrow()).isInstanceOf(ModelList.class);
        assertThat(model.fields().keySet()).containsExactly("name", "hp", "ratio", "alive", "pet", "inventory");
    }

    @Test
    void toMapReturnsPlainValues() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("hp", 10);
        raw.put("nested", Map.of("flag", false));
        raw.put("list", Arrays.asList(1.5, null));

        Map<String, Object> plain = TextModel.fromMap(raw).toMap();

        assertThat(plain).containsEntry("hp", 10L);
        assertThat(plain.get("nested")).isEqualTo(Map.of("flag", false));
        assertThat(plain.get("list")).isEqualTo(Arrays.asList(1.5, null));
    }

    @Test
    void bigNumbersConvert() {
        assertThat(ModelValue.of(BigInteger.valueOf(7))).isEqualTo(Num.of(7L));
        assertThat(ModelValue.of(BigInteger.TWO.pow(70))).isEqualTo(Num.of(Math.pow(2, 70)));
        assertThat(ModelValue.of(new BigDecimal("1.25"))).isEqualTo(Num.of(1.25));
        assertThat(ModelValue.of(3.0f)).isEqualTo(Num.of(3.0));
    }

    @Test
    void numRejectsOtherNumberTypes() {
        assertThatThrownBy(() -> new Num(3))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void animationIsRequestedByMarkerKey() {
        TextModel model = TextModel.fromMap(Map.of("hp", 1));
        assertThat(model.requestsAnimation()).isFalse();

        model.put(TextModel.ANIMATE_KEY, true);

        assertThat(model.requestsAnimation()).isTrue();
    }

    @Test
    void putReplacesFieldInPlace() {
        TextModel model = new TextModel();
        model.put("mouse_x", 5);
        model.put("mouse_x", Num.of(6L));

        assertThat(model.get("mouse_x")).contains(Num.of(6L));
        assertThat(model.has("mouse_y")).isFalse();
    }

    @Test
    void equalityFollowsFields() {
        assertThat(TextModel.fromMap(Map.of("a", 1))).isEqualTo(TextModel.fromMap(Map.of("a", 1)))
                .hasSameHashCodeAs(TextModel.fromMap(Map.of("a", 1)));
        assertThat(TextModel.fromMap(Map.of("a", 1))).isNotEqualTo(TextModel.fromMap(Map.of("a", 2)));
    }

    @Test
    void toStringIsReprForm() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("name", "Bob");
        raw.put("hp", 10);

        assertThat(TextModel.fromMap(raw)).hasToString("TextModel(name='Bob', hp=10)");
    }

    @Test
    void listIndexesCountFromTheEnd() {
        ModelList list = new ModelList(List.of(Num.of(1L), Num.of(2L)));

        assertThat(list.get(-1)).isEqualTo(Num.of(2L));
        assertThatThrownBy(() -> list.get(2)).isInstanceOf(TemplateException.class);
        assertThatThrownBy(() -> list.get(-3)).isInstanceOf(TemplateException.class);
    }
}
