package com.good4it.lendingservice;

import com.good4it.lendingservice.core.exception.ConcurrentTransitionException;
import com.good4it.lendingservice.service.EntityLockService;
import com.good4it.lendingservice.service.implementation.EntityLockServiceImp;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.kafka.test.context.EmbeddedKafka;
import org.springframework.test.context.ActiveProfiles;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest(properties = {
        "app.locks.ttl-seconds=5",
        "spring.kafka.bootstrap-servers=${spring.embedded.kafka.brokers}"
})
@EmbeddedKafka(partitions = 1)
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
public class EntityLockServiceTest {

    @Container
    @ServiceConnection
    static GenericContainer<?> redis = new GenericContainer<>("redis:7-alpine").withExposedPorts(6379);

    @Container
    @ServiceConnection
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine");

    @Autowired
    private EntityLockServiceImp lockService;

    @Autowired
    private RedisTemplate<String, String> redisTemplate;

    private final String TEST_KEY = EntityLockService.transactionKey(UUID.fromString("11111111-2222-3333-4444-555555555555"));

    @BeforeEach
    void cleanRedis() {
        redisTemplate.delete(TEST_KEY);
    }

    @Test
    @DisplayName("Should acquire lock when key is free")
    void testAcquire_Success() {
        boolean acquired = lockService.acquire(TEST_KEY);

        assertThat(acquired).isTrue();
        assertThat(redisTemplate.opsForValue().get(TEST_KEY)).isNotNull();
    }

    @Test
    @DisplayName("Should fail to acquire lock when key is already taken")
    void testAcquire_Duplicate() {
        lockService.acquire(TEST_KEY);

        assertThat(lockService.acquire(TEST_KEY)).isFalse();
    }

    @Test
    @DisplayName("Should not release a lock held by another instance")
    void testRelease_OtherOwner() {
        redisTemplate.opsForValue().set(TEST_KEY, "someone-else");

        lockService.release(TEST_KEY);

        assertThat(redisTemplate.opsForValue().get(TEST_KEY)).isEqualTo("someone-else");
    }

    @Test
    @DisplayName("Lock expires after the configured TTL")
    void testLockExpiration() {
        lockService.acquire(TEST_KEY);

        Long expire = redisTemplate.getExpire(TEST_KEY);

        assertThat(expire).isNotNull();
        assertThat(expire).isGreaterThan(0).isLessThanOrEqualTo(5);
    }

    @Test
    @DisplayName("withLock runs the action and frees the key afterwards")
    void testWithLock_Releases() {
        String result = lockService.withLock(TEST_KEY, () -> {
            assertThat(redisTemplate.hasKey(TEST_KEY)).isTrue();
            return "done";
        });

        assertThat(result).isEqualTo("done");
        assertThat(redisTemplate.hasKey(TEST_KEY)).isFalse();
    }

    @Test
    @DisplayName("withLock frees the key when the action fails")
    void testWithLock_ReleasesOnFailure() {
        assertThatThrownBy(() -> lockService.withLock(TEST_KEY, () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(redisTemplate.hasKey(TEST_KEY)).isFalse();
    }

    @Test
    @DisplayName("Concurrent transition on a held key fails fast")
    void testWithLock_Busy() {
        redisTemplate.opsForValue().set(TEST_KEY, "someone-else");

        assertThatThrownBy(() -> lockService.withLock(TEST_KEY, () -> "never"))
                .isInstanceOf(ConcurrentTransitionException.class);
        assertThat(redisTemplate.opsForValue().get(TEST_KEY)).isEqualTo("someone-else");
    }
}
