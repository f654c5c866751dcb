package org.muma.mini.kv.common;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RedisDataTest {

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void testPayloadMustMatchType() {
        assertThrows(IllegalArgumentException.class, () -> new RedisData<>(RedisDataType.LIST, bytes("x")));
        assertThrows(IllegalArgumentException.class, () -> new RedisData<>(RedisDataType.STRING, null));
        assertThrows(IllegalArgumentException.class, () -> new RedisData<>(null, new RedisSet()));
    }

    @Test
    void testGetValueChecksClass() {
        RedisData<RedisHash> hash = RedisData.newHash();
        assertSame(hash.getData(), hash.getValue(RedisHash.class));
        assertThrows(IllegalStateException.class, () -> hash.getValue(RedisList.class));
    }

    @Test
    void testExpiry() {
        RedisData<byte[]> data = RedisData.ofString(bytes("v"));
        assertFalse(data.hasExpire());
        assertFalse(data.isExpired(Long.MAX_VALUE));

        data.setExpireAt(1000);
        assertTrue(data.hasExpire());
        assertFalse(data.isExpired(999));
        assertTrue(data.isExpired(1000));

        data.setExpireAt(RedisData.NO_EXPIRE);
        assertFalse(data.hasExpire());
    }

    @Test
    void testTypeNames() {
        assertEquals("string", RedisDataType.STRING.getTypeName());
        assertEquals("list", RedisData.newList().getType().getTypeName());
        assertEquals("set", RedisData.newSet().getType().getTypeName());
        assertEquals("hash", RedisData.newHash().getType().getTypeName());
        assertEquals("zset", RedisData.newZSet().getType().getTypeName());
    }

    @Test
    void testListEnds() {
        RedisList list = new RedisList();
        assertNull(list.lpop());
        assertNull(list.rpop());

        list.rpush(bytes("b"));
        list.lpush(bytes("a"));
        list.rpush(bytes("c"));

        List<byte[]> snapshot = list.toList();
        assertEquals(3, snapshot.size());
        assertArrayEquals(bytes("a"), snapshot.get(0));
        assertArrayEquals(bytes("c"), snapshot.get(2));
        assertEquals(3, list.size());
    }

    @Test
    void testSetAndHashCounts() {
        RedisSet set = new RedisSet();
        assertEquals(1, set.add("m"));
        assertEquals(0, set.add("m"));
        assertEquals(List.of("m"), set.getAll());
        assertEquals(1, set.remove("m"));
        assertTrue(set.isEmpty());

        RedisHash hash = new RedisHash();
        assertEquals(1, hash.put("f", bytes("1")));
        assertEquals(0, hash.put("f", bytes("2")));
        assertEquals(1, hash.size());

        Map<String, byte[]> copy = hash.toMap();
        copy.clear();
        assertArrayEquals(bytes("2"), hash.get("f"));
    }

    @Test
    void testZSetIsPlaceholderPayload() {
        RedisData<RedisZSet> zset = RedisData.newZSet();
        assertEquals(RedisDataType.ZSET, zset.getType());
        assertSame(zset.getData(), zset.getValue(RedisZSet.class));
    }
}
