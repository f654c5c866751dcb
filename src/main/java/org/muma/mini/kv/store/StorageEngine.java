package org.muma.mini.kv.store;

import org.muma.mini.kv.common.RedisData;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Set;
import java.util.function.Supplier;

/**
 * 存储引擎
 * <p>
 * 所有访问都是同步的，每个操作是一个原子临界区。
 * 过期采用惰性策略：任何访问器发现 {@code now >= expireAt} 时删除该 Key 并当作不存在。
 * <p>
 * Key (以及 Set 成员、Hash 字段) 是按 {@link #KEY_CHARSET} 解码的字符串：一个字节对应一个 char，
 * 任意字节序列都能无损往返，不同的字节序列永远不会映射到同一个 Key。
 */
public interface StorageEngine {

    Charset KEY_CHARSET = StandardCharsets.ISO_8859_1;

    /**
     * 获取字符串值。Key 不存在、不是 String 类型或已过期都返回 null；
     * 类型不符不报错，类型检查由命令层通过 {@link #get(String)} 完成。
     */
    byte[] getString(String key);

    /**
     * 获取任意类型的值，已过期或不存在返回 null。
     * 返回的对象属于存储引擎，只能在 {@link #atomically(Supplier)} 内修改。
     */
    RedisData<?> get(String key);

    /**
     * 无条件写入 String，覆盖旧值和旧类型，同时清除过期时间
     */
    void putString(String key, byte[] value);

    /**
     * 无条件写入整个值 (命令新建 List/Set/Hash 时使用)
     */
    void put(String key, RedisData<?> data);

    /**
     * @return Key 之前是否存在
     */
    boolean remove(String key);

    /**
     * 在互斥锁内执行一段"读-改-写"，对其他命令原子可见
     */
    <T> T atomically(Supplier<T> action);

    /**
     * 当前 Key 数量 (包含尚未被访问到的过期 Key)
     */
    int size();

    /**
     * Key 的快照拷贝
     */
    Set<String> keys();

    // 清空数据
    void flush();

    /**
     * 存储引擎使用的毫秒时钟，命令计算过期时间时必须用它，保证与惰性过期判断一致
     */
    long now();
}
