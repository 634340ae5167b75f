package com.tablehub.combatservice.infrastructure.redis;

import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.serializer.SerializationException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Redis 原语封装：只提供 String / Hash / List / Key 级别的方法，
 * 业务键名与字段名由各仓储通过 RedisKeys 组织。
 */
@Component
@RequiredArgsConstructor
public class RedisOps {

    private final RedisTemplate<String, Object> redis;

    // -------------- String --------------

    /** 写入对象（带 TTL） */
    public void setEx(String key, Object val, Duration ttl) {
        redis.opsForValue().set(key, val, ttl);
    }

    /** 读取对象；类型不符视为数据损坏，抛 SerializationException */
    public <T> T get(String key, Class<T> type) {
        return checked(key, redis.opsForValue().get(key), type);
    }

    // -------------- Hash --------------

    /**
     * 写入 Hash 字段并续期整个 key，MULTI/EXEC 中一起提交：要么都生效，要么都不生效。
     */
    public void hSetWithTtl(String key, String field, Object val, Duration ttl) {
        redis.execute(new SessionCallback<List<Object>>() {
            @SuppressWarnings("unchecked")
            @Override
            public <K, V> List<Object> execute(RedisOperations<K, V> operations) throws DataAccessException {
                operations.multi();
                operations.opsForHash().put((K) key, field, val);
                operations.expire((K) key, ttl);
                return operations.exec();
            }
        });
    }

    public <T> T hGet(String key, String field, Class<T> type) {
        return checked(key + "#" + field, redis.opsForHash().get(key, field), type);
    }

    /** 读取整个 Hash */
    public Map<String, Object> hGetAll(String key) {
        Map<Object, Object> raw = redis.opsForHash().entries(key);
        Map<String, Object> out = new LinkedHashMap<>();
        raw.forEach((k, v) -> out.put(String.valueOf(k), v));
        return out;
    }

    // -------------- List --------------

    /**
     * 追加到列表尾部，只保留最近 maxLen 条，并续期；同样在一个事务里提交。
     */
    public void rPushCapped(String key, Object val, long maxLen, Duration ttl) {
        redis.execute(new SessionCallback<List<Object>>() {
            @SuppressWarnings("unchecked")
            @Override
            public <K, V> List<Object> execute(RedisOperations<K, V> operations) throws DataAccessException {
                operations.multi();
                operations.opsForList().rightPush((K) key, (V) val);
                operations.opsForList().trim((K) key, -maxLen, -1);
                operations.expire((K) key, ttl);
                return operations.exec();
            }
        });
    }

    /** 读取列表区间；元素类型不符时抛 SerializationException */
    public <T> List<T> lRange(String key, long start, long end, Class<T> type) {
        List<Object> raw = redis.opsForList().range(key, start, end);
        List<T> out = new ArrayList<>();
        if (raw == null) {
            return out;
        }
        for (int i = 0; i < raw.size(); i++) {
            out.add(checked(key + "[" + i + "]", raw.get(i), type));
        }
        return out;
    }

    // -------------- Key & TTL --------------

    public Long del(String... keys) {
        return redis.delete(Arrays.asList(keys));
    }

    private static <T> T checked(String where, Object v, Class<T> type) {
        if (v == null) {
            return null;
        }
        if (!type.isInstance(v)) {
            throw new SerializationException("unexpected " + v.getClass().getName() + " at " + where);
        }
        return type.cast(v);
    }
}
