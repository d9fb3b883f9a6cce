package com.libragraph.chatvault.formats.postbox;

import com.libragraph.chatvault.types.ValueType;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class TaggedStreamTest {

    private static byte[] sample() {
        return new TaggedStreamEncoder()
                .putString("fn", "Grace")
                .putInt64("id", 99L)
                .putInt32Array("tags", 4, 5)
                .putObject("_", 77, new TaggedStreamEncoder().putString("t", "Team"))
                .putNil("gone")
                .putDouble("score", 0.5)
                .putStringArray("aliases", List.of("g", "gh"))
                .toByteArray();
    }

    @Test
    void shouldSeekFieldInAgreementWithDecodeAll() {
        TaggedStream stream = new TaggedStream(sample());
        Map<String, TaggedValue> all = stream.decodeAll();

        assertThat(all).hasSize(7);
        for (Map.Entry<String, TaggedValue> entry : all.entrySet()) {
            TaggedValue expected = entry.getValue();
            TaggedValue sought = stream.seekField(entry.getKey(), expected.type()).orElseThrow();

            assertThat(sought.type()).isEqualTo(expected.type());
            if (expected.value() instanceof int[] ints) {
                assertThat((int[]) sought.value()).isEqualTo(ints);
            } else {
                assertThat(sought.value()).isEqualTo(expected.value());
            }
        }
    }

    @Test
    void shouldRequireMatchingTypeWhenSeeking() {
        TaggedStream stream = new TaggedStream(sample());

        assertThat(stream.seekField("id", ValueType.INT32)).isEmpty();
        assertThat(stream.int64("id")).contains(99L);
        assertThat(stream.string("missing")).isEmpty();
    }

    @Test
    void shouldKeepLastDuplicate() {
        byte[] data = new TaggedStreamEncoder()
                .putString("k", "first")
                .putInt32("x", 1)
                .putString("k", "second")
                .toByteArray();
        TaggedStream stream = new TaggedStream(data);

        assertThat(stream.decodeAll().get("k").asString()).isEqualTo("second");
        assertThat(stream.decodeAll().keySet()).containsExactly("k", "x");
        assertThat(stream.string("k")).contains("first");
    }

    @Test
    void shouldReturnPrefixOnTruncation() {
        byte[] full = sample();
        byte[] cut = Arrays.copyOf(full, full.length - 3);

        Map<String, TaggedValue> fields = new TaggedStream(cut).decodeAll();

        assertThat(fields.keySet()).containsExactly("fn", "id", "tags", "_", "gone", "score");
    }

    @Test
    void shouldStopAtUnknownTag() {
        byte[] data = new TaggedStreamEncoder()
                .putInt32("a", 1)
                .putRaw(new byte[]{1, 'b', (byte) 200, 0, 0})
                .putInt32("c", 3)
                .toByteArray();

        assertThat(new TaggedStream(data).decodeAll()).containsOnlyKeys("a");
    }

    @Test
    void shouldReportAbsenceOnMalformedData() {
        byte[] data = new TaggedStreamEncoder()
                .putInt32("a", 1)
                .putRaw(new byte[]{1, 'b', (byte) ValueType.BYTES.id(), (byte) 0xF0, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF})
                .putString("c", "after")
                .toByteArray();
        TaggedStream stream = new TaggedStream(data);

        assertThat(stream.int32("a")).contains(1);
        assertThat(stream.string("c")).isEmpty();
    }

    @Test
    void shouldHandleEmptyStream() {
        TaggedStream stream = new TaggedStream(new byte[0]);

        assertThat(stream.decodeAll()).isEmpty();
        assertThat(stream.seekField("_", ValueType.OBJECT)).isEmpty();
    }

    @Test
    void shouldDecodeToUnmodifiableMap() {
        Map<String, TaggedValue> fields = new TaggedStream(sample()).decodeAll();

        assertThatThrownBy(() -> fields.put("x", TaggedValue.nil()))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
