package com.funnelanalytics.infrastructure.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.funnelanalytics.domain.model.FunnelResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class QueryCacheServiceTest {

    @Mock
    private RedisTemplate<String, String> redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private QueryCacheService cacheService;

    @BeforeEach
    void setUp() {
        cacheService = new QueryCacheService(redisTemplate, new ObjectMapper().findAndRegisterModules());
    }

    @Test
    void testGenerateCacheKey_StableAndPrefixed() {
        String first = cacheService.generateCacheKey("analysis:funnel", "w", List.of("/a", "/b"), null);
        String second = cacheService.generateCacheKey("analysis:funnel", "w", List.of("/a", "/b"), null);
        String other = cacheService.generateCacheKey("analysis:funnel", "w", List.of("/b", "/a"), null);

        assertEquals(first, second);
        assertNotEquals(first, other);
        assertTrue(first.startsWith("analysis:funnel:"));
    }

    @Test
    void testGet_ReadsJson() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("k")).thenReturn("{\"data\":[],\"cached\":false,\"queryTimeMs\":12}");

        Optional<FunnelResponse> result = cacheService.get("k", FunnelResponse.class);

        assertTrue(result.isPresent());
        assertEquals(12, result.get().getQueryTimeMs());
    }

    @Test
    void testGet_UnreadableEntryIsDropped() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("k")).thenReturn("not json");

        assertTrue(cacheService.get("k", FunnelResponse.class).isEmpty());
        verify(redisTemplate).delete("k");
    }

    @Test
    void testSet_SkipsNonPositiveTtl() {
        cacheService.set("k", FunnelResponse.builder().build(), 0);

        verifyNoInteractions(redisTemplate);
    }

    @Test
    void testSet_WritesWithTtl() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);

        cacheService.set("k", FunnelResponse.builder().data(List.of()).build(), 60);

        verify(valueOperations).set(eq("k"), anyString(), eq(60L), eq(TimeUnit.SECONDS));
    }
}
