package com.example.learningsession.kv;

import java.nio.charset.StandardCharsets;
import java.util.*;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.stereotype.Component;

@Component
public class RedisKvClient implements KvClient {

    private final StringRedisTemplate redis;

    @Autowired
    public RedisKvClient(StringRedisTemplate redis) {
        this.redis = redis;
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(redis.opsForValue().get(key));
    }

    @Override
    public Map<String, String> mget(List<String> keys) {
        // MGET answers positionally, so the request order must be kept
        List<String> values = redis.opsForValue().multiGet(keys);
        Map<String,String> result = new LinkedHashMap<>();
        int i = 0;
        for (String k : keys) {
            String v = (values != null && i < values.size()) ? values.get(i) : null;
            result.put(k, v);
            i++;
        }
        return result;
    }

    @Override
    public void mset(Map<String, String> entries) {
        if (entries == null || entries.isEmpty()) return;
        redis.opsForValue().multiSet(entries);
    }

    @Override
    public List<String> scan(String prefix, int limit) {
        ScanOptions options = ScanOptions.scanOptions()
                .match(prefix + "*")
                .count(Math.max(limit, 100)).build();
        try (RedisConnection conn = Objects.requireNonNull(redis.getConnectionFactory()).getConnection()) {
            List<String> keys = new ArrayList<>();
            try (var cursor = conn.keyCommands().scan(options)) {
                while (cursor.hasNext() && keys.size() < limit) {
                    keys.add(new String(cursor.next(), StandardCharsets.UTF_8));
                }
            }
            return keys;
        }
    }
}
