package com.secops.threatintel.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.secops.threatintel.config.ThreatIntelProperties;
import com.secops.threatintel.model.CacheEntry;
import com.secops.threatintel.model.CacheTier;
import com.secops.threatintel.model.CachingTier;
import com.secops.threatintel.model.ThreatEntity;
import com.secops.threatintel.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * 分层结果缓存单元测试
 */
@ExtendWith(MockitoExtension.class)
class TieredResultCacheTest {

    private static final String KEY = "ti:org-1:entity:ioc:i1";

    @Mock
    private SharedCacheTier sharedTier;

    @Mock
    private CacheInvalidationBroadcaster broadcaster;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MutableClock clock;
    private LocalCacheTier localTier;
    private TieredResultCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(1_700_000_000_000L);
        localTier = new LocalCacheTier(Caffeine.newBuilder().maximumSize(100).build(), clock);
        cache = new TieredResultCache(localTier, sharedTier, objectMapper, clock,
            new ThreatIntelProperties(), new SimpleMeterRegistry(), Optional.of(broadcaster));
    }

    private static ThreatEntity ioc(String id) {
        return ThreatEntity.builder().type("ioc").id(id).organizationId("org-1")
            .attributes(new java.util.LinkedHashMap<>(Map.of("value", "1.2.3.4"))).build();
    }

    @Test
    @DisplayName("NORMAL 只写 LOCAL")
    void testNormalWritesLocalOnly() {
        cache.set(KEY, ioc("i1"), CachingTier.NORMAL);

        Optional<ThreatEntity> hit = cache.get(KEY, CacheTier.LOCAL, ThreatEntity.class);

        assertTrue(hit.isPresent());
        assertEquals("i1", hit.get().getId());
        verify(sharedTier, never()).set(anyString(), anyString(), any());
    }

    @Test
    @DisplayName("EXTENDED 只写 SHARED，信封带绝对过期时间")
    void testExtendedWritesSharedEnvelope() throws Exception {
        cache.set(KEY, ioc("i1"), CachingTier.EXTENDED);

        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(sharedTier).set(eq(KEY), json.capture(), eq(Duration.ofMinutes(15)));
        Map<?, ?> envelope = objectMapper.readValue(json.getValue(), Map.class);
        assertEquals(clock.millis() + Duration.ofMinutes(15).toMillis(), ((Number) envelope.get("expiresAt")).longValue());
        assertEquals("i1", ((Map<?, ?>) envelope.get("value")).get("id"));
        assertNull(localTier.get(KEY));
    }

    @Test
    @DisplayName("AGGRESSIVE 两层都写")
    void testAggressiveWritesBoth() {
        cache.set(KEY, ioc("i1"), CachingTier.AGGRESSIVE);

        assertNotNull(localTier.get(KEY));
        assertEquals(clock.millis() + Duration.ofHours(1).toMillis(), localTier.get(KEY).expiresAt());
        verify(sharedTier).set(eq(KEY), anyString(), eq(Duration.ofHours(1)));
    }

    @Test
    @DisplayName("SHARED 命中以相同过期时间回填 LOCAL")
    void testSharedHitBackfillsLocal() throws Exception {
        long expiresAt = clock.millis() + 30_000;
        String envelope = objectMapper.writeValueAsString(Map.of("expiresAt", expiresAt, "value", ioc("i1")));
        when(sharedTier.get(KEY)).thenReturn(envelope);

        Optional<ThreatEntity> hit = cache.get(KEY, CacheTier.SHARED, ThreatEntity.class);

        assertTrue(hit.isPresent());
        assertEquals("1.2.3.4", hit.get().attribute("value"));
        CacheEntry backfilled = localTier.get(KEY);
        assertNotNull(backfilled);
        assertEquals(expiresAt, backfilled.expiresAt());

        // 第二次读取直接命中 LOCAL
        cache.get(KEY, CacheTier.SHARED, ThreatEntity.class);
        verify(sharedTier, times(1)).get(KEY);
    }

    @Test
    @DisplayName("SHARED 条目过期视为未命中")
    void testExpiredSharedEnvelope() throws Exception {
        String envelope = objectMapper.writeValueAsString(Map.of("expiresAt", clock.millis() - 1, "value", ioc("i1")));
        when(sharedTier.get(KEY)).thenReturn(envelope);

        assertTrue(cache.get(KEY, CacheTier.SHARED, ThreatEntity.class).isEmpty());
        assertNull(localTier.get(KEY));
    }

    @Test
    @DisplayName("SHARED 不可用视为未命中")
    void testSharedUnavailable() {
        when(sharedTier.get(KEY)).thenReturn(null);

        assertTrue(cache.get(KEY, CacheTier.SHARED, ThreatEntity.class).isEmpty());
    }

    @Test
    @DisplayName("SHARED 中的损坏数据视为未命中")
    void testCorruptSharedEntry() {
        when(sharedTier.get(KEY)).thenReturn("not-json");

        assertTrue(cache.get(KEY, CacheTier.SHARED, ThreatEntity.class).isEmpty());
    }

    @Test
    @DisplayName("LOCAL 读取不访问 SHARED")
    void testLocalReadSkipsShared() {
        assertTrue(cache.get(KEY, CacheTier.LOCAL, ThreatEntity.class).isEmpty());
        verifyNoInteractions(sharedTier);
    }

    @Test
    @DisplayName("失效同时作用于两层并广播")
    void testInvalidate() {
        cache.set(KEY, ioc("i1"));
        cache.invalidate(KEY);

        assertNull(localTier.get(KEY));
        verify(sharedTier).delete(KEY);
        verify(broadcaster).broadcastLocalInvalidate(KEY);
    }

    @Test
    @DisplayName("按模式失效返回两层删除总数")
    void testInvalidatePattern() {
        cache.set("ti:org-1:query:q:1", "a");
        cache.set("ti:org-1:query:q:2", "b");
        when(sharedTier.deletePattern("ti:org-1:query:*")).thenReturn(3L);

        long removed = cache.invalidatePattern("ti:org-1:query:*");

        assertEquals(5, removed);
        verify(broadcaster).broadcastLocalInvalidate("ti:org-1:query:*");
    }

    @Test
    @DisplayName("键格式")
    void testKeyFormat() {
        assertEquals("ti:org-1:entity:ioc:i1", cache.key("org-1", "entity", "ioc", "i1"));
        assertEquals(CacheTier.LOCAL, cache.readTier(CachingTier.NORMAL));
        assertEquals(CacheTier.SHARED, cache.readTier(CachingTier.EXTENDED));
    }
}
