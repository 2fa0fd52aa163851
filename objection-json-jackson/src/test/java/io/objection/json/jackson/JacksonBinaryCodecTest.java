package io.objection.json.jackson;

import io.objection.json.spi.JsonException;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JacksonBinaryCodecTest {

    private final JacksonBinaryCodec codec = new JacksonBinaryCodec();

    record Item(String name, int position) {}

    @Test
    void roundTripsRecordsAndScalars() throws Exception {
        assertThat(codec.readBinary(codec.writeBinary(new Item("apple", 4)), Item.class)).isEqualTo(new Item("apple", 4));
        assertThat(codec.readBinary(codec.writeBinary("hello"), String.class)).isEqualTo("hello");
        assertThat(codec.readBinary(codec.writeBinary(42), Integer.class)).isEqualTo(42);
    }

    @Test
    void equalMapsEncodeToEqualBytesRegardlessOfInsertionOrder() throws Exception {
        Map<String, Integer> ab = new LinkedHashMap<>();
        ab.put("a", 1);
        ab.put("b", 2);
        Map<String, Integer> ba = new LinkedHashMap<>();
        ba.put("b", 2);
        ba.put("a", 1);

        assertThat(codec.writeBinary(ab)).isEqualTo(codec.writeBinary(ba));
    }

    @Test
    void rejectsBytesOfAnotherShape() throws Exception {
        byte[] item = codec.writeBinary(new Item("apple", 4));

        assertThatThrownBy(() -> codec.readBinary(item, Long.class)).isInstanceOf(JsonException.class);
    }

    @Test
    void rejectsEmptyAndTrailingData() throws Exception {
        assertThatThrownBy(() -> codec.readBinary(new byte[0], String.class))
                .isInstanceOf(JsonException.class)
                .hasMessageContaining("empty");

        byte[] one = codec.writeBinary(1);
        byte[] twice = new byte[one.length * 2];
        System.arraycopy(one, 0, twice, 0, one.length);
        System.arraycopy(one, 0, twice, one.length, one.length);
        assertThatThrownBy(() -> codec.readBinary(twice, Integer.class)).isInstanceOf(JsonException.class);
    }
}
