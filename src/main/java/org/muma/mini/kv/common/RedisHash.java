package org.muma.mini.kv.common;

import java.util.LinkedHashMap;
import java.util.Map;

public class RedisHash {

    // 字段名按 StorageEngine.KEY_CHARSET 解码，字节无损
    private final Map<String, byte[]> fields = new LinkedHashMap<>();

    /**
     * @return 新字段返回 1，覆盖已有字段返回 0
     */
    public int put(String field, byte[] value) {
        return fields.put(field, value) == null ? 1 : 0;
    }

    public byte[] get(String field) {
        return fields.get(field);
    }

    public int remove(String field) {
        return fields.remove(field) != null ? 1 : 0;
    }

    public int size() {
        return fields.size();
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    /**
     * 获取全量数据的拷贝 (用于 HGETALL)
     */
    public Map<String, byte[]> toMap() {
        return new LinkedHashMap<>(fields);
    }
}
