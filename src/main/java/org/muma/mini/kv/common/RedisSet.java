package org.muma.mini.kv.common;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public class RedisSet {

    // 成员按 StorageEngine.KEY_CHARSET 解码，字节无损
    private final Set<String> members = new LinkedHashSet<>();

    // 新成员返回 1，已存在返回 0
    public int add(String member) {
        return members.add(member) ? 1 : 0;
    }

    public int remove(String member) {
        return members.remove(member) ? 1 : 0;
    }

    public boolean contains(String member) {
        return members.contains(member);
    }

    public int size() {
        return members.size();
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }

    public List<String> getAll() {
        return new ArrayList<>(members);
    }
}
