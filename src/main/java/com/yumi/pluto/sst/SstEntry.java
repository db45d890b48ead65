package com.yumi.pluto.sst;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.yumi.pluto.util.Kv;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * sst 文件中的一项，key 和 value 都以 UTF-8 文本保存
 */
@JsonPropertyOrder({"key", "value"})
public class SstEntry {
    private final String key;
    private final String value;

    @JsonCreator
    public SstEntry(@JsonProperty("key") String key, @JsonProperty("value") String value) {
        this.key = key;
        this.value = value;
    }

    public static SstEntry of(Kv kv) {
        return new SstEntry(new String(kv.getKey(), StandardCharsets.UTF_8),
                new String(kv.getValue(), StandardCharsets.UTF_8));
    }

    @JsonProperty("key")
    public String getKey() {
        return key;
    }

    @JsonProperty("value")
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SstEntry that = (SstEntry) o;
        return Objects.equals(key, that.key) && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, value);
    }

    @Override
    public String toString() {
        return key + "=" + value;
    }
}
