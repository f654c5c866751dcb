package org.muma.mini.kv.command.impl.key;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.muma.mini.kv.command.impl.hash.HSetCommand;
import org.muma.mini.kv.command.impl.list.LPushCommand;
import org.muma.mini.kv.command.impl.set.SAddCommand;
import org.muma.mini.kv.command.impl.string.GetCommand;
import org.muma.mini.kv.command.impl.string.SetCommand;
import org.muma.mini.kv.protocol.*;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.store.StorageEngine;
import org.muma.mini.kv.store.impl.MemoryStorageEngine;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class KeyCommandTest {

    private AtomicLong clock;
    private StorageEngine storage;
    private RedisContext context;

    private SetCommand set;
    private GetCommand get;
    private DelCommand del;
    private TypeCommand type;
    private ExpireCommand expire;
    private TTLCommand ttl;
    private PersistCommand persist;

    @BeforeEach
    void setUp() {
        clock = new AtomicLong(1_700_000_000_000L);
        storage = new MemoryStorageEngine(clock::get);
        context = new RedisContext();
        set = new SetCommand();
        get = new GetCommand();
        del = new DelCommand();
        type = new TypeCommand();
        expire = new ExpireCommand();
        ttl = new TTLCommand();
        persist = new PersistCommand();
    }

    // --- 辅助方法：构建参数 ---
    private RedisArray args(String... args) {
        RedisMessage[] msgs = new RedisMessage[args.length];
        for (int i = 0; i < args.length; i++) {
            msgs[i] = new BulkString(args[i]);
        }
        return new RedisArray(msgs);
    }

    private long asLong(RedisMessage msg) {
        if (msg instanceof RedisInteger i) return i.value();
        throw new RuntimeException("Not an integer: " + msg);
    }

    @Test
    void testDel() {
        set.execute(storage, args("SET", "k", "v"), context);

        assertEquals(1, asLong(del.execute(storage, args("DEL", "k"), context)));
        assertEquals(0, asLong(del.execute(storage, args("DEL", "k"), context)));
        assertEquals(BulkString.NULL, get.execute(storage, args("GET", "k"), context));
    }

    @Test
    void testTypeOfEachKind() {
        set.execute(storage, args("SET", "s", "v"), context);
        new LPushCommand().execute(storage, args("LPUSH", "l", "a"), context);
        new SAddCommand().execute(storage, args("SADD", "st", "a"), context);
        new HSetCommand().execute(storage, args("HSET", "h", "f", "v"), context);

        assertEquals(new SimpleString("string"), type.execute(storage, args("TYPE", "s"), context));
        assertEquals(new SimpleString("list"), type.execute(storage, args("TYPE", "l"), context));
        assertEquals(new SimpleString("set"), type.execute(storage, args("TYPE", "st"), context));
        assertEquals(new SimpleString("hash"), type.execute(storage, args("TYPE", "h"), context));
        assertEquals(new SimpleString("none"), type.execute(storage, args("TYPE", "nothing"), context));
    }

    @Test
    void testExpireAndTtl() {
        set.execute(storage, args("SET", "k", "v"), context);
        assertEquals(-1, asLong(ttl.execute(storage, args("TTL", "k"), context)));

        assertEquals(1, asLong(expire.execute(storage, args("EXPIRE", "k", "10"), context)));
        assertEquals(10, asLong(ttl.execute(storage, args("TTL", "k"), context)));

        // 四舍五入: 剩余 7.6 秒 -> 8
        clock.addAndGet(2_400);
        assertEquals(8, asLong(ttl.execute(storage, args("TTL", "k"), context)));
    }

    @Test
    void testExpiredKeyBehavesAsAbsent() {
        set.execute(storage, args("SET", "k", "v"), context);
        expire.execute(storage, args("EXPIRE", "k", "5"), context);

        clock.addAndGet(5_000);

        assertEquals(BulkString.NULL, get.execute(storage, args("GET", "k"), context));
        assertEquals(new SimpleString("none"), type.execute(storage, args("TYPE", "k"), context));
        assertEquals(-2, asLong(ttl.execute(storage, args("TTL", "k"), context)));
        assertEquals(0, asLong(del.execute(storage, args("DEL", "k"), context)));
    }

    @Test
    void testExpireMissingKey() {
        assertEquals(0, asLong(expire.execute(storage, args("EXPIRE", "ghost", "10"), context)));
        assertEquals(-2, asLong(ttl.execute(storage, args("TTL", "ghost"), context)));
    }

    @Test
    void testExpireNonPositiveDeletes() {
        set.execute(storage, args("SET", "k", "v"), context);
        assertEquals(1, asLong(expire.execute(storage, args("EXPIRE", "k", "0"), context)));
        assertNull(storage.get("k"));

        set.execute(storage, args("SET", "k2", "v"), context);
        assertEquals(1, asLong(expire.execute(storage, args("EXPIRE", "k2", "-5"), context)));
        assertNull(storage.get("k2"));
    }

    @Test
    void testExpireRejectsBadSeconds() {
        set.execute(storage, args("SET", "k", "v"), context);

        assertEquals(new ErrorMessage("ERR value is not an integer or out of range"),
                expire.execute(storage, args("EXPIRE", "k", "ten"), context));
        assertEquals(new ErrorMessage("ERR invalid expire time in 'expire' command"),
                expire.execute(storage, args("EXPIRE", "k", String.valueOf(Long.MAX_VALUE)), context));
        // 失败后值和 TTL 都不变
        assertEquals(-1, asLong(ttl.execute(storage, args("TTL", "k"), context)));
    }

    @Test
    void testPersist() {
        set.execute(storage, args("SET", "k", "v"), context);
        assertEquals(0, asLong(persist.execute(storage, args("PERSIST", "k"), context)));

        expire.execute(storage, args("EXPIRE", "k", "3"), context);
        assertEquals(1, asLong(persist.execute(storage, args("PERSIST", "k"), context)));
        assertEquals(-1, asLong(ttl.execute(storage, args("TTL", "k"), context)));

        clock.addAndGet(10_000);
        assertEquals(new BulkString("v"), get.execute(storage, args("GET", "k"), context));
        assertEquals(0, asLong(persist.execute(storage, args("PERSIST", "missing"), context)));
    }

    @Test
    void testExpireAppliesToAnyKind() {
        new LPushCommand().execute(storage, args("LPUSH", "l", "a"), context);
        assertEquals(1, asLong(expire.execute(storage, args("EXPIRE", "l", "1"), context)));

        clock.addAndGet(1_000);
        assertEquals(new SimpleString("none"), type.execute(storage, args("TYPE", "l"), context));
    }

    @Test
    void testTtlReadsExpireInsideCriticalSection() {
        StorageEngine spyStorage = spy(new MemoryStorageEngine(clock::get));
        set.execute(spyStorage, args("SET", "k", "v"), context);
        expire.execute(spyStorage, args("EXPIRE", "k", "30"), context);
        clearInvocations(spyStorage);

        assertEquals(30, asLong(ttl.execute(spyStorage, args("TTL", "k"), context)));
        verify(spyStorage).atomically(any(Supplier.class));
    }

    /**
     * 测试场景：一个线程反复 EXPIRE/PERSIST，另一个线程 TTL；结果只能是 -1 或完整的剩余秒数
     */
    @Test
    void testTtlNeverSeesHalfUpdatedExpire() throws InterruptedException {
        set.execute(storage, args("SET", "k", "v"), context);
        AtomicBoolean running = new AtomicBoolean(true);

        Thread writer = new Thread(() -> {
            while (running.get()) {
                expire.execute(storage, args("EXPIRE", "k", "100"), context);
                persist.execute(storage, args("PERSIST", "k"), context);
            }
        });
        writer.start();
        try {
            for (int i = 0; i < 20_000; i++) {
                long res = asLong(ttl.execute(storage, args("TTL", "k"), context));
                assertTrue(res == -1 || res == 100, "unexpected TTL " + res);
            }
        } finally {
            running.set(false);
            writer.join();
        }
    }
}
