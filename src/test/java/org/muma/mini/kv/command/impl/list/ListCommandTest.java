package org.muma.mini.kv.command.impl.list;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.muma.mini.kv.command.impl.key.ExpireCommand;
import org.muma.mini.kv.command.impl.key.TypeCommand;
import org.muma.mini.kv.command.impl.string.GetCommand;
import org.muma.mini.kv.command.impl.string.SetCommand;
import org.muma.mini.kv.protocol.*;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.store.StorageEngine;
import org.muma.mini.kv.store.impl.MemoryStorageEngine;

import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class ListCommandTest {

    private AtomicLong clock;
    private StorageEngine storage;
    private RedisContext context;
    private LPushCommand lPush;
    private RPushCommand rPush;
    private LPopCommand lPop;
    private RPopCommand rPop;
    private LLenCommand lLen;

    @BeforeEach
    void setUp() {
        clock = new AtomicLong(1_000_000L);
        storage = new MemoryStorageEngine(clock::get);
        context = new RedisContext();
        lPush = new LPushCommand();
        rPush = new RPushCommand();
        lPop = new LPopCommand();
        rPop = new RPopCommand();
        lLen = new LLenCommand();
    }

    // 辅助方法：构造参数
    private RedisArray args(String... args) {
        RedisMessage[] msgs = new RedisMessage[args.length];
        for (int i = 0; i < args.length; i++) msgs[i] = new BulkString(args[i]);
        return new RedisArray(msgs);
    }

    private long asLong(RedisMessage msg) {
        if (msg instanceof RedisInteger i) return i.value();
        throw new RuntimeException("Not an integer: " + msg);
    }

    private String asString(RedisMessage msg) {
        if (msg instanceof BulkString b) return b.asString();
        if (msg instanceof ErrorMessage e) return e.content();
        return null;
    }

    @Test
    void testLPushReversesArgumentOrder() {
        assertEquals(3, asLong(lPush.execute(storage, args("LPUSH", "l", "a", "b", "c"), context)));

        // LPUSH a b c -> [c, b, a]
        assertEquals("c", asString(lPop.execute(storage, args("LPOP", "l"), context)));
        assertEquals("b", asString(lPop.execute(storage, args("LPOP", "l"), context)));
        assertEquals("a", asString(lPop.execute(storage, args("LPOP", "l"), context)));
    }

    @Test
    void testRPushKeepsArgumentOrder() {
        assertEquals(3, asLong(rPush.execute(storage, args("RPUSH", "l", "a", "b", "c"), context)));

        assertEquals("a", asString(lPop.execute(storage, args("LPOP", "l"), context)));
        assertEquals("c", asString(rPop.execute(storage, args("RPOP", "l"), context)));
        assertEquals("b", asString(rPop.execute(storage, args("RPOP", "l"), context)));
    }

    @Test
    void testPushReturnsLengthAfterPush() {
        assertEquals(1, asLong(rPush.execute(storage, args("RPUSH", "l", "x"), context)));
        assertEquals(3, asLong(lPush.execute(storage, args("LPUSH", "l", "y", "z"), context)));
        assertEquals(3, asLong(lLen.execute(storage, args("LLEN", "l"), context)));
    }

    @Test
    void testMixedEnds() {
        rPush.execute(storage, args("RPUSH", "l", "m"), context);
        lPush.execute(storage, args("LPUSH", "l", "head"), context);
        rPush.execute(storage, args("RPUSH", "l", "tail"), context);

        assertEquals("head", asString(lPop.execute(storage, args("LPOP", "l"), context)));
        assertEquals("tail", asString(rPop.execute(storage, args("RPOP", "l"), context)));
        assertEquals("m", asString(lPop.execute(storage, args("LPOP", "l"), context)));
    }

    @Test
    void testPopMissingKey() {
        assertEquals(BulkString.NULL, lPop.execute(storage, args("LPOP", "nope"), context));
        assertEquals(BulkString.NULL, rPop.execute(storage, args("RPOP", "nope"), context));
        assertEquals(0, asLong(lLen.execute(storage, args("LLEN", "nope"), context)));
    }

    @Test
    void testEmptyListIsRemoved() {
        rPush.execute(storage, args("RPUSH", "l", "only"), context);
        rPop.execute(storage, args("RPOP", "l"), context);

        assertNull(storage.get("l"));
        assertEquals(0, storage.size());
        assertEquals(BulkString.NULL, lPop.execute(storage, args("LPOP", "l"), context));
    }

    @Test
    void testWrongTypeLeavesValueUnchanged() {
        new SetCommand().execute(storage, args("SET", "s", "text"), context);

        RedisMessage push = lPush.execute(storage, args("LPUSH", "s", "a"), context);
        assertEquals(ErrorMessage.wrongType(), push);
        assertEquals(ErrorMessage.WRONG_TYPE, asString(rPush.execute(storage, args("RPUSH", "s", "a"), context)));
        assertEquals(ErrorMessage.WRONG_TYPE, asString(lPop.execute(storage, args("LPOP", "s"), context)));
        assertEquals(ErrorMessage.WRONG_TYPE, asString(rPop.execute(storage, args("RPOP", "s"), context)));
        assertEquals(ErrorMessage.WRONG_TYPE, asString(lLen.execute(storage, args("LLEN", "s"), context)));

        assertEquals(new BulkString("text"), new GetCommand().execute(storage, args("GET", "s"), context));
    }

    @Test
    void testBinaryElements() {
        byte[] element = {0, (byte) 0x80, 10, 13};
        rPush.execute(storage, RedisArray.of(new BulkString("RPUSH"), new BulkString("l"), new BulkString(element)), context);

        BulkString popped = (BulkString) lPop.execute(storage, args("LPOP", "l"), context);
        assertArrayEquals(element, popped.content());
    }

    @Test
    void testExpiredListIsAbsent() {
        rPush.execute(storage, args("RPUSH", "l", "a", "b"), context);
        new ExpireCommand().execute(storage, args("EXPIRE", "l", "2"), context);

        clock.addAndGet(2_000);

        assertEquals(0, asLong(lLen.execute(storage, args("LLEN", "l"), context)));
        // 一次访问后物理删除
        assertEquals(0, storage.size());
        assertEquals(new SimpleString("none"), new TypeCommand().execute(storage, args("TYPE", "l"), context));
        assertEquals(BulkString.NULL, lPop.execute(storage, args("LPOP", "l"), context));
    }
}
