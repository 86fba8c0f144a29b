package com.example.learningsession.kv;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface KvClient {
    Optional<String> get(String key);
    Map<String, String> mget(List<String> keys);
    /**
     * Writes every entry in one atomic step; readers never observe a subset.
     */
    void mset(Map<String, String> entries);
    List<String> scan(String prefix, int limit);
}
