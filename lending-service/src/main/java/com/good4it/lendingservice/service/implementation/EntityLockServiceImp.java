package com.good4it.lendingservice.service.implementation;

import com.good4it.lendingservice.service.EntityLockService;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Collections;
import java.util.UUID;

@Service
@Slf4j
@RequiredArgsConstructor
public class EntityLockServiceImp implements EntityLockService {

    private static final DefaultRedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then " +
                    "return redis.call('del', KEYS[1]) " +
                    "else return 0 end",
            Long.class);

    private final RedisTemplate<String, String> redisTemplate;

    @Value("${app.locks.ttl-seconds}")
    private long ttlSeconds;

    private Duration lockTimeout;

    // Each instance only ever releases its own locks
    private final String ownerId = UUID.randomUUID().toString();

    @PostConstruct
    public void init() {
        lockTimeout = Duration.ofSeconds(ttlSeconds);
    }

    @Override
    public boolean acquire(String key) {
        Boolean success = redisTemplate.opsForValue()
                .setIfAbsent(key, ownerId, lockTimeout);

        if (!Boolean.TRUE.equals(success)) {
            log.warn("Lock {} is already held", key);
            return false;
        }
        return true;
    }

    @Override
    public void release(String key) {
        redisTemplate.execute(RELEASE_SCRIPT, Collections.singletonList(key), ownerId);
    }
}
