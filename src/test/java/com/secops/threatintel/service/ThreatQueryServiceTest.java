package com.secops.threatintel.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.secops.threatintel.config.ThreatIntelProperties;
import com.secops.threatintel.dto.QueryRequest;
import com.secops.threatintel.dto.QueryResult;
import com.secops.threatintel.exception.AuthenticationException;
import com.secops.threatintel.exception.ForbiddenException;
import com.secops.threatintel.exception.ValidationException;
import com.secops.threatintel.model.ExecutionStrategy;
import com.secops.threatintel.model.ThreatEntity;
import com.secops.threatintel.monitor.QueryPerformanceMonitor;
import com.secops.threatintel.optimization.OptimizationExecutor;
import com.secops.threatintel.optimization.QueryCostAnalyzer;
import com.secops.threatintel.optimization.StrategySelector;
import com.secops.threatintel.repository.InMemoryStorageAdapter;
import com.secops.threatintel.security.AccessPolicy;
import com.secops.threatintel.security.IdentityContext;
import com.secops.threatintel.security.Role;
import com.secops.threatintel.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * 读服务端到端测试：真实的分析、批量缓存和 LOCAL 层，SHARED 层为 mock
 */
class ThreatQueryServiceTest {

    private static final IdentityContext ANALYST = new IdentityContext("org-1", "u-1", Role.ANALYST);

    private ScheduledExecutorService dispatchScheduler;
    private ExecutorService fetchExecutor;
    private ExecutorService resolverExecutor;
    private InMemoryStorageAdapter storage;
    private SharedCacheTier sharedTier;
    private QueryPerformanceMonitor monitor;
    private ThreatQueryService service;

    @BeforeEach
    void setUp() {
        ThreatIntelProperties properties = new ThreatIntelProperties();
        // 窗口放宽，同层加载由解析器主动派发
        properties.getOptimizer().setBatchWindow(Duration.ofMillis(50));
        MutableClock clock = new MutableClock(1_700_000_000_000L);
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        ObjectMapper objectMapper = new ObjectMapper();

        dispatchScheduler = Executors.newSingleThreadScheduledExecutor();
        fetchExecutor = Executors.newFixedThreadPool(2);
        resolverExecutor = Executors.newFixedThreadPool(4);

        storage = spy(new InMemoryStorageAdapter());
        seed();

        sharedTier = mock(SharedCacheTier.class);
        LocalCacheTier localTier = new LocalCacheTier(Caffeine.newBuilder().maximumSize(1000).build(), clock);
        TieredResultCache tieredCache = new TieredResultCache(localTier, sharedTier, objectMapper, clock,
            properties, registry, Optional.empty());
        monitor = new QueryPerformanceMonitor(clock, registry, properties);

        BatchingCacheFactory factory = new BatchingCacheFactory(storage, tieredCache, monitor,
            dispatchScheduler, fetchExecutor, properties);
        service = new ThreatQueryService(new AccessPolicy(),
            new QueryCostAnalyzer(new StrategySelector(properties)),
            new OptimizationExecutor(properties),
            factory, tieredCache, monitor, storage, resolverExecutor, objectMapper, properties);
    }

    @AfterEach
    void tearDown() {
        dispatchScheduler.shutdownNow();
        fetchExecutor.shutdownNow();
        resolverExecutor.shutdownNow();
    }

    private void seed() {
        storage.save(entity("threat", "t1", "org-1", Map.of(
            "name", "Operation Nightfall", "severity", "HIGH",
            "threatActors", List.of("a1", "a2"), "indicators", List.of("i1", "i2"))));
        storage.save(entity("threat", "t2", "org-1", Map.of(
            "name", "Credential Spray", "severity", "LOW",
            "threatActors", List.of("a1", "a9"), "indicators", List.of("i2", "i3"))));
        storage.save(entity("threat", "t3", "org-2", Map.of("name", "Other tenant", "severity", "HIGH")));
        storage.save(entity("actor", "a1", "org-1", Map.of("name", "APT-1")));
        storage.save(entity("actor", "a2", "org-1", Map.of("name", "APT-2")));
        storage.save(entity("actor", "a9", "org-2", Map.of("name", "Foreign actor")));
        storage.save(entity("ioc", "i1", "org-1", Map.of("value", "10.0.0.1")));
        storage.save(entity("ioc", "i2", "org-1", Map.of("value", "evil.example")));
        storage.save(entity("ioc", "i3", "org-1", Map.of("value", "d41d8cd98f00b204")));
    }

    private static ThreatEntity entity(String type, String id, String org, Map<String, Object> attributes) {
        return ThreatEntity.builder().type(type).id(id).organizationId(org)
            .attributes(new LinkedHashMap<>(attributes)).build();
    }

    private static QueryRequest threatsWithRelations(List<String> ids) {
        Map<String, Object> actorFields = new LinkedHashMap<>();
        actorFields.put("id", true);
        actorFields.put("name", true);
        Map<String, Object> iocFields = new LinkedHashMap<>();
        iocFields.put("id", true);
        iocFields.put("value", true);
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("id", true);
        fields.put("name", true);
        fields.put("threatActors", actorFields);
        fields.put("indicators", iocFields);

        Map<String, Object> rootArguments = new LinkedHashMap<>();
        rootArguments.put("ids", ids);
        return QueryRequest.builder()
            .queryName("threatDetails")
            .entityType("threat")
            .rootArguments(rootArguments)
            .fields(fields)
            .build();
    }

    @Test
    @DisplayName("关系字段批量解析，每个实体最多拉取一次")
    @SuppressWarnings("unchecked")
    void testRelationshipsResolvedOncePerKey() {
        QueryResult result = service.execute(ANALYST, threatsWithRelations(List.of("t1", "t2")));

        assertTrue(result.getErrors().isEmpty());
        assertEquals(2, result.getData().size());
        Map<String, Object> t1 = result.getData().get(0);
        assertEquals("Operation Nightfall", t1.get("name"));
        List<Map<String, Object>> actors = (List<Map<String, Object>>) t1.get("threatActors");
        assertEquals(List.of("APT-1", "APT-2"), actors.stream().map(a -> a.get("name")).toList());

        ArgumentCaptor<List<String>> iocIds = ArgumentCaptor.forClass(List.class);
        verify(storage, atLeastOnce()).fetchByIds(eq("ioc"), iocIds.capture());
        List<String> fetched = new ArrayList<>();
        iocIds.getAllValues().forEach(fetched::addAll);
        assertEquals(fetched.size(), new HashSet<>(fetched).size(), "an ioc was fetched twice");
        assertEquals(Set.of("i1", "i2", "i3"), new HashSet<>(fetched));

        assertEquals(ExecutionStrategy.STANDARD, result.getMetrics().getStrategy());
        assertFalse(result.getMetrics().isFromCache());
    }

    @Test
    @DisplayName("同一层兄弟实体的关系加载合并为一次下游拉取")
    @SuppressWarnings("unchecked")
    void testSiblingRelationshipsShareOneBatch() {
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            storage.save(entity("threat", "w" + i, "org-1",
                Map.of("name", "Wave " + i, "indicators", List.of("wi" + i))));
            storage.save(entity("ioc", "wi" + i, "org-1", Map.of("value", "198.51.100." + i)));
            ids.add("w" + i);
        }
        Map<String, Object> iocFields = new LinkedHashMap<>();
        iocFields.put("id", true);
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("id", true);
        fields.put("indicators", iocFields);
        Map<String, Object> rootArguments = new LinkedHashMap<>();
        rootArguments.put("ids", ids);
        QueryRequest request = QueryRequest.builder()
            .queryName("waves")
            .entityType("threat")
            .rootArguments(rootArguments)
            .fields(fields)
            .build();

        QueryResult result = service.execute(ANALYST, request);

        assertTrue(result.getErrors().isEmpty());
        assertEquals(5, result.getData().size());
        List<Map<String, Object>> first = (List<Map<String, Object>>) result.getData().get(0).get("indicators");
        assertEquals("wi0", first.get(0).get("id"));

        ArgumentCaptor<List<String>> iocIds = ArgumentCaptor.forClass(List.class);
        verify(storage, times(1)).fetchByIds(eq("ioc"), iocIds.capture());
        assertEquals(Set.of("wi0", "wi1", "wi2", "wi3", "wi4"), new HashSet<>(iocIds.getValue()));
    }

    @Test
    @DisplayName("嵌套层同样按层合并批次")
    @SuppressWarnings("unchecked")
    void testNestedLevelBatched() {
        storage.save(entity("actor", "a1", "org-1", Map.of("name", "APT-1", "campaigns", List.of("c1"))));
        storage.save(entity("actor", "a2", "org-1", Map.of("name", "APT-2", "campaigns", List.of("c2"))));
        storage.save(entity("campaign", "c1", "org-1", Map.of("name", "Winter")));
        storage.save(entity("campaign", "c2", "org-1", Map.of("name", "Summer")));

        Map<String, Object> campaignFields = new LinkedHashMap<>();
        campaignFields.put("name", true);
        Map<String, Object> actorFields = new LinkedHashMap<>();
        actorFields.put("id", true);
        actorFields.put("campaigns", campaignFields);
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("id", true);
        fields.put("threatActors", actorFields);
        Map<String, Object> rootArguments = new LinkedHashMap<>();
        rootArguments.put("ids", List.of("t1"));
        QueryRequest request = QueryRequest.builder()
            .entityType("threat")
            .rootArguments(rootArguments)
            .fields(fields)
            .build();

        QueryResult result = service.execute(ANALYST, request);

        List<Map<String, Object>> actors = (List<Map<String, Object>>) result.getData().get(0).get("threatActors");
        List<Map<String, Object>> campaigns = (List<Map<String, Object>>) actors.get(1).get("campaigns");
        assertEquals("Summer", campaigns.get(0).get("name"));
        verify(storage, times(1)).fetchByIds(eq("campaign"), anyList());
    }

    @Test
    @DisplayName("其它组织的实体被丢弃")
    @SuppressWarnings("unchecked")
    void testForeignEntitiesDropped() {
        QueryResult result = service.execute(ANALYST, threatsWithRelations(List.of("t2", "t3")));

        assertEquals(1, result.getData().size());
        Map<String, Object> t2 = result.getData().get(0);
        List<Map<String, Object>> actors = (List<Map<String, Object>>) t2.get("threatActors");
        assertEquals(List.of("a1"), actors.stream().map(a -> a.get("id")).toList());
    }

    @Test
    @DisplayName("相同请求第二次从结果缓存返回")
    void testSecondCallServedFromCache() {
        service.execute(ANALYST, threatsWithRelations(List.of("t1")));
        clearInvocations(storage);

        QueryResult second = service.execute(ANALYST, threatsWithRelations(List.of("t1")));

        assertTrue(second.getMetrics().isFromCache());
        assertEquals("Operation Nightfall", second.getData().get(0).get("name"));
        verifyNoInteractions(storage);
    }

    @Test
    @DisplayName("单个关系字段失败返回部分结果，且不缓存")
    void testPartialResultOnFieldFailure() {
        doThrow(new IllegalStateException("ioc store unavailable"))
            .when(storage).fetchByIds(eq("ioc"), anyList());

        QueryResult result = service.execute(ANALYST, threatsWithRelations(List.of("t1")));

        Map<String, Object> t1 = result.getData().get(0);
        assertNotNull(t1.get("threatActors"));
        assertNull(t1.get("indicators"));
        assertEquals(1, result.getErrors().size());
        assertEquals("threat[t1].indicators", result.getErrors().get(0).path());
        assertEquals("ioc store unavailable", result.getErrors().get(0).message());

        QueryResult retry = service.execute(ANALYST, threatsWithRelations(List.of("t1")));
        assertFalse(retry.getMetrics().isFromCache());
    }

    @Test
    @DisplayName("过滤查询限定在调用方组织内")
    void testFilterQueryScopedToOrganization() {
        Map<String, Object> rootArguments = new LinkedHashMap<>();
        rootArguments.put("filter", Map.of("severity", "HIGH"));
        QueryRequest request = QueryRequest.builder()
            .entityType("threat")
            .rootArguments(rootArguments)
            .fields(new LinkedHashMap<>(Map.of("id", true)))
            .build();

        QueryResult result = service.execute(ANALYST, request);

        assertEquals(1, result.getData().size());
        assertEquals("t1", result.getData().get(0).get("id"));
    }

    @Test
    @DisplayName("跨组织读取仅 SUPER_ADMIN 允许")
    void testCrossOrganization() {
        QueryRequest request = threatsWithRelations(List.of("t3"));
        request.getRootArguments().put("organizationId", "org-2");

        assertThrows(ForbiddenException.class, () -> service.execute(ANALYST, request));

        QueryResult result = service.execute(new IdentityContext("org-1", "root", Role.SUPER_ADMIN), request);
        assertEquals("Other tenant", result.getData().get(0).get("name"));
    }

    @Test
    @DisplayName("缺少身份或实体类型")
    void testInvalidRequests() {
        assertThrows(AuthenticationException.class,
            () -> service.execute(null, threatsWithRelations(List.of("t1"))));
        assertThrows(ForbiddenException.class,
            () -> service.execute(new IdentityContext("org-1", "u-1", null), threatsWithRelations(List.of("t1"))));
        assertThrows(ValidationException.class,
            () -> service.execute(ANALYST, QueryRequest.builder().build()));
    }

    @Test
    @DisplayName("写路径通知失效实体与查询缓存")
    void testEntityChangeInvalidates() {
        service.execute(ANALYST, threatsWithRelations(List.of("t1")));
        storage.save(entity("threat", "t1", "org-1", Map.of("name", "Renamed", "severity", "HIGH")));

        service.onEntityChanged("org-1", "threat", "t1", null);
        QueryResult result = service.execute(ANALYST, threatsWithRelations(List.of("t1")));

        assertFalse(result.getMetrics().isFromCache());
        assertEquals("Renamed", result.getData().get(0).get("name"));
        verify(sharedTier).delete("ti:org-1:entity:threat:t1");
        verify(sharedTier).deletePattern("ti:org-1:query:*");
    }

    @Test
    @DisplayName("查询结束后监控中无进行中查询")
    void testMonitorCompletes() {
        service.execute(ANALYST, threatsWithRelations(List.of("t1")));

        assertEquals(0, monitor.activeQueryCount());
        assertEquals(1, monitor.getQueryStats().totalQueries());
    }
}
