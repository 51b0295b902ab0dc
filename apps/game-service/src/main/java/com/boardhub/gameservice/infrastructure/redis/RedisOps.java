package com.boardhub.gameservice.infrastructure.redis;

import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

/**
 * 公用 Redis 工具类：
 * - 封装常用 String/Hash/Key/计数 操作
 * - 仅提供“原语级”方法；业务键名放在 Repo 层组织
 */
@Component
@RequiredArgsConstructor
public class RedisOps {
    /** 通用对象模板：用于 JSON 存储与反序列化 */
    private final RedisTemplate<String, Object> redis;
    /** 字符串模板：计数器 */
    private final StringRedisTemplate strRedis;

    // -------------- String --------------
    /**
     * 写入键值（带 TTL）
     */
    public boolean setEx(String key, Object val, Duration ttl) {
        redis.opsForValue().set(key, val, ttl);
        return true;
    }
    /**
     * 获取键值；类型不符返回 null
     */
    public <T> T get(String key, Class<T> type) {
        Object v = redis.opsForValue().get(key);
        return type.isInstance(v) ? type.cast(v) : null;
    }

    // -------------- 计数器 --------------
    /**
     * 自增（纯字符串值，避免 JSON 值类型带来的数字类型差异）
     * @return 新值
     */
    public Long incrBy(String key, long delta) {
        return strRedis.opsForValue().increment(key, delta);
    }

    // -------------- Hash --------------
    /**
     * 写入 Hash 字段
     */
    public boolean hSet(String key, String field, Object val) {
        redis.opsForHash().put(key, field, val);
        return true;
    }
    /**
     * 获取整个 Hash（转为 Map<String,Object>）
     */
    public Map<String, Object> hGetAll(String key) {
        Map<Object, Object> raw = redis.opsForHash().entries(key);
        Map<String, Object> out = new HashMap<>();
        raw.forEach((k, v) -> out.put(String.valueOf(k), v));
        return out;
    }

    // -------------- Key & TTL --------------
    /**
     * 设置过期时间（TTL）
     */
    public Boolean expire(String key, Duration ttl) {
        return redis.expire(key, ttl);
    }
    /**
     * 删除一个或多个 Key
     */
    public Long del(String... keys) {
        return redis.delete(Arrays.asList(keys));
    }
}
