package org.muma.mini.kv.command.impl.set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.muma.mini.kv.command.impl.string.SetCommand;
import org.muma.mini.kv.protocol.*;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.store.StorageEngine;
import org.muma.mini.kv.store.impl.MemoryStorageEngine;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SetCommandTest {

    private StorageEngine storage;
    private RedisContext context;
    private SAddCommand sAdd;
    private SRemCommand sRem;
    private SIsMemberCommand sIsMember;
    private SMembersCommand sMembers;

    @BeforeEach
    void setUp() {
        storage = new MemoryStorageEngine();
        context = new RedisContext();
        sAdd = new SAddCommand();
        sRem = new SRemCommand();
        sIsMember = new SIsMemberCommand();
        sMembers = new SMembersCommand();
    }

    private RedisArray args(String... args) {
        RedisMessage[] msgs = new RedisMessage[args.length];
        for (int i = 0; i < args.length; i++) msgs[i] = new BulkString(args[i]);
        return new RedisArray(msgs);
    }

    private long asLong(RedisMessage msg) {
        if (msg instanceof RedisInteger i) return i.value();
        throw new RuntimeException("Not an integer: " + msg);
    }

    private Set<String> members(String key) {
        RedisArray arr = (RedisArray) sMembers.execute(storage, args("SMEMBERS", key), context);
        Set<String> result = new HashSet<>();
        for (RedisMessage m : arr.elements()) {
            result.add(((BulkString) m).asString());
        }
        return result;
    }

    @Test
    void testSAddCountsOnlyNewMembers() {
        assertEquals(2, asLong(sAdd.execute(storage, args("SADD", "s", "a", "b"), context)));
        assertEquals(1, asLong(sAdd.execute(storage, args("SADD", "s", "b", "c", "c"), context)));
        assertEquals(Set.of("a", "b", "c"), members("s"));
    }

    @Test
    void testSIsMember() {
        sAdd.execute(storage, args("SADD", "s", "a"), context);
        assertEquals(1, asLong(sIsMember.execute(storage, args("SISMEMBER", "s", "a"), context)));
        assertEquals(0, asLong(sIsMember.execute(storage, args("SISMEMBER", "s", "z"), context)));
        assertEquals(0, asLong(sIsMember.execute(storage, args("SISMEMBER", "nope", "a"), context)));
    }

    @Test
    void testSRemRemovesKeyWhenEmpty() {
        sAdd.execute(storage, args("SADD", "s", "a", "b"), context);
        assertEquals(1, asLong(sRem.execute(storage, args("SREM", "s", "a", "x"), context)));
        assertEquals(1, asLong(sRem.execute(storage, args("SREM", "s", "b"), context)));

        assertNull(storage.get("s"));
        assertEquals(0, asLong(sRem.execute(storage, args("SREM", "s", "b"), context)));
    }

    @Test
    void testSMembersOfMissingKeyIsEmpty() {
        assertEquals(RedisArray.EMPTY, sMembers.execute(storage, args("SMEMBERS", "none"), context));
    }

    @Test
    void testWrongType() {
        new SetCommand().execute(storage, args("SET", "k", "v"), context);

        assertEquals(ErrorMessage.wrongType(), sAdd.execute(storage, args("SADD", "k", "a"), context));
        assertEquals(ErrorMessage.wrongType(), sRem.execute(storage, args("SREM", "k", "a"), context));
        assertEquals(ErrorMessage.wrongType(), sIsMember.execute(storage, args("SISMEMBER", "k", "a"), context));
        assertEquals(ErrorMessage.wrongType(), sMembers.execute(storage, args("SMEMBERS", "k"), context));
    }

    @Test
    void testBinaryMembersRoundTrip() {
        byte[] ff = {(byte) 0xff};
        byte[] fe = {(byte) 0xfe};
        RedisArray add = RedisArray.of(new BulkString("SADD"), new BulkString("s"), new BulkString(ff), new BulkString(fe));
        assertEquals(2, asLong(sAdd.execute(storage, add, context)));

        RedisArray members = (RedisArray) sMembers.execute(storage, args("SMEMBERS", "s"), context);
        assertEquals(2, members.size());
        assertArrayEquals(ff, ((BulkString) members.elements()[0]).content());
        assertArrayEquals(fe, ((BulkString) members.elements()[1]).content());

        RedisArray isMember = RedisArray.of(new BulkString("SISMEMBER"), new BulkString("s"), new BulkString(new byte[]{(byte) 0xfd}));
        assertEquals(0, asLong(sIsMember.execute(storage, isMember, context)));
    }
}
