package com.ueep.core.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

@ExtendWith(MockitoExtension.class)
class RedisCacheClientTest {

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private RedisCacheClient client;

    @BeforeEach
    void setUp() {
        client = new RedisCacheClient(redisTemplate);
    }

    @Test
    void getReturnsCachedValue() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("ueep:data:version")).thenReturn("1.0.0");

        assertEquals(Optional.of("1.0.0"), client.get("ueep:data:version"));
    }

    @Test
    void getTreatsMissingKeyAsAbsent() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("ueep:data:none")).thenReturn(null);

        assertTrue(client.get("ueep:data:none").isEmpty());
    }

    @Test
    void setWritesWithTtl() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);

        client.set("ueep:data:version", "1.0.0", Duration.ofSeconds(60));

        verify(valueOperations).set("ueep:data:version", "1.0.0", Duration.ofSeconds(60));
    }

    @Test
    @SuppressWarnings("unchecked")
    void pingAcceptsPong() {
        when(redisTemplate.execute(any(RedisCallback.class))).thenReturn("PONG");

        client.ping();
    }

    @Test
    @SuppressWarnings("unchecked")
    void pingRejectsUnexpectedReply() {
        when(redisTemplate.execute(any(RedisCallback.class))).thenReturn(null);

        assertThrows(IllegalStateException.class, client::ping);
    }
}
