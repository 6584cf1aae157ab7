package com.secops.threatintel.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.hash.Hashing;
import com.secops.threatintel.config.ThreatIntelProperties;
import com.secops.threatintel.constant.CacheConstants;
import com.secops.threatintel.constant.FieldCatalog;
import com.secops.threatintel.dto.QueryRequest;
import com.secops.threatintel.dto.QueryResult;
import com.secops.threatintel.exception.ValidationException;
import com.secops.threatintel.model.BatchKey;
import com.secops.threatintel.model.CacheTier;
import com.secops.threatintel.model.FieldError;
import com.secops.threatintel.model.FieldSelection;
import com.secops.threatintel.model.QueryAnalysis;
import com.secops.threatintel.model.ThreatEntity;
import com.secops.threatintel.monitor.QueryPerformanceMonitor;
import com.secops.threatintel.optimization.OptimizationExecutor;
import com.secops.threatintel.optimization.QueryCostAnalyzer;
import com.secops.threatintel.optimization.RequestCacheConfig;
import com.secops.threatintel.repository.StorageAdapter;
import com.secops.threatintel.security.AccessPolicy;
import com.secops.threatintel.security.IdentityContext;
import com.secops.threatintel.security.Role;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 威胁情报读服务
 * <p>
 * 流程：鉴权 → 成本分析 → 策略执行 → 结果缓存 → 字段解析。
 * 关系字段通过请求级 {@link BatchingCache} 批量加载；
 * 单个关系字段失败只产生字段级错误，其它字段照常返回。
 */
@Service
public class ThreatQueryService {

    private static final Logger log = LoggerFactory.getLogger(ThreatQueryService.class);

    private static final String DEFAULT_QUERY_NAME = "query";

    private final AccessPolicy accessPolicy;
    private final QueryCostAnalyzer analyzer;
    private final OptimizationExecutor optimizationExecutor;
    private final BatchingCacheFactory batchingCacheFactory;
    private final TieredResultCache tieredResultCache;
    private final QueryPerformanceMonitor monitor;
    private final StorageAdapter storageAdapter;
    private final ExecutorService resolverExecutor;
    private final ObjectMapper objectMapper;
    private final long resolverTimeoutMillis;

    public ThreatQueryService(AccessPolicy accessPolicy,
                              QueryCostAnalyzer analyzer,
                              OptimizationExecutor optimizationExecutor,
                              BatchingCacheFactory batchingCacheFactory,
                              TieredResultCache tieredResultCache,
                              QueryPerformanceMonitor monitor,
                              StorageAdapter storageAdapter,
                              @Qualifier("resolverExecutor") ExecutorService resolverExecutor,
                              ObjectMapper objectMapper,
                              ThreatIntelProperties properties) {
        this.accessPolicy = accessPolicy;
        this.analyzer = analyzer;
        this.optimizationExecutor = optimizationExecutor;
        this.batchingCacheFactory = batchingCacheFactory;
        this.tieredResultCache = tieredResultCache;
        this.monitor = monitor;
        this.storageAdapter = storageAdapter;
        this.resolverExecutor = resolverExecutor;
        this.objectMapper = objectMapper;
        this.resolverTimeoutMillis = properties.getOptimizer().getResolverTimeout().toMillis();
    }

    public QueryResult execute(IdentityContext identity, QueryRequest request) {
        accessPolicy.authorize(identity, Role.VIEWER);
        if (request == null || request.getEntityType() == null || request.getEntityType().isBlank()) {
            throw new ValidationException("entityType is required");
        }
        Map<String, Object> rootArguments = request.getRootArguments() == null
            ? Map.of() : request.getRootArguments();
        String organizationId = resolveOrganization(identity, rootArguments);
        String queryName = request.getQueryName() == null || request.getQueryName().isBlank()
            ? DEFAULT_QUERY_NAME : request.getQueryName();
        List<FieldSelection> selections = FieldSelection.fromTree(request.getFields());

        String queryId = monitor.startQuery(queryName, organizationId);
        try {
            QueryAnalysis analysis = analyzer.analyze(selections);
            RequestCacheConfig cacheConfig = new RequestCacheConfig();
            BatchingCache batchingCache = batchingCacheFactory.create(organizationId, queryId, cacheConfig);
            ExecutionContext context = new ExecutionContext(identity, organizationId, queryId,
                analysis, cacheConfig, batchingCache);

            optimizationExecutor.apply(context, request.getEntityType(), rootArguments);

            String resultKey = queryKey(organizationId, queryName, request);
            CacheTier readTier = tieredResultCache.readTier(cacheConfig.getCachingTier());
            Optional<CachedRows> cached = tieredResultCache.get(resultKey, readTier, CachedRows.class);
            if (cached.isPresent()) {
                monitor.recordCacheHit(queryId);
                return buildResult(context, cached.get().rows(), List.of(), true);
            }
            monitor.recordCacheMiss(queryId);

            List<FieldError> errors = new CopyOnWriteArrayList<>();
            List<Map<String, Object>> rows = resolveRoots(context, request.getEntityType(),
                rootArguments, selections, errors);

            // 部分结果不进入缓存
            if (errors.isEmpty()) {
                tieredResultCache.set(resultKey, new CachedRows(rows), cacheConfig.getCachingTier());
            }
            return buildResult(context, rows, errors, false);
        } finally {
            monitor.endQuery(queryId);
        }
    }

    /**
     * 写路径通知：失效实体缓存和本组织的查询结果缓存
     *
     * @param activeCache 同一进程内仍在使用的请求级缓存，可为 null
     */
    public void onEntityChanged(String organizationId, String entityType, String id, BatchingCache activeCache) {
        tieredResultCache.invalidate(batchingCacheFactory.entityKey(organizationId, entityType, id));
        tieredResultCache.invalidatePattern(
            tieredResultCache.key(organizationId, CacheConstants.QUERY_SEGMENT, "*"));
        if (activeCache != null) {
            activeCache.clear(new BatchKey(entityType, id));
        }
        log.info("Entity change propagated: org={}, type={}, id={}", organizationId, entityType, id);
    }

    /**
     * 按组织内相对模式失效，例如 "query:*"
     */
    public long invalidateOrganizationPattern(String organizationId, String relativePattern) {
        String glob = tieredResultCache.key(organizationId, relativePattern);
        return tieredResultCache.invalidatePattern(glob);
    }

    private String resolveOrganization(IdentityContext identity, Map<String, Object> rootArguments) {
        Object requested = rootArguments.get("organizationId");
        if (requested == null) {
            return identity.organizationId();
        }
        String organizationId = requested.toString();
        accessPolicy.checkOrganization(identity, organizationId);
        return organizationId;
    }

    private List<Map<String, Object>> resolveRoots(ExecutionContext context, String entityType,
                                                   Map<String, Object> rootArguments,
                                                   List<FieldSelection> selections,
                                                   List<FieldError> errors) {
        List<ThreatEntity> roots;
        try {
            roots = loadRoots(context, entityType, rootArguments);
        } catch (Exception e) {
            Throwable cause = unwrap(e);
            monitor.recordError(context.queryId(), cause);
            errors.add(new FieldError(entityType, cause.getMessage()));
            log.warn("Root fetch failed: queryId={}, type={}, error={}", context.queryId(), entityType, cause.toString());
            return List.of();
        }

        List<Map<String, Object>> rows = new ArrayList<>(roots.size());
        List<LevelNode> level = new ArrayList<>(roots.size());
        for (ThreatEntity root : roots) {
            Map<String, Object> row = projectRow(root, selections);
            rows.add(row);
            level.add(new LevelNode(root, row, selections, entityType + "[" + root.getId() + "]"));
        }
        resolveLevels(context, level, errors);
        return rows;
    }

    private List<ThreatEntity> loadRoots(ExecutionContext context, String entityType,
                                         Map<String, Object> rootArguments) {
        Object ids = rootArguments.get("ids");
        if (ids instanceof Collection<?> idList) {
            List<String> keys = idList.stream().filter(Objects::nonNull).map(Object::toString).toList();
            return await(context.batchingCache().loadMany(entityType, keys)).stream()
                .filter(Objects::nonNull)
                .toList();
        }

        Map<String, Object> filter = new LinkedHashMap<>();
        if (rootArguments.get("filter") instanceof Map<?, ?> requested) {
            requested.forEach((k, v) -> filter.put(String.valueOf(k), v));
        }
        filter.put("organizationId", context.organizationId());
        List<ThreatEntity> roots = storageAdapter.fetchByFilter(entityType, filter).stream()
            .filter(e -> context.organizationId().equals(e.getOrganizationId()))
            .toList();
        // 过滤查询得到的根实体直接填入批量缓存，关系字段引用到它们时不再拉取
        for (ThreatEntity root : roots) {
            context.batchingCache().prime(new BatchKey(entityType, root.getId()), root);
        }
        return roots;
    }

    /**
     * 按层解析关系字段
     * <p>
     * 同一层所有父实体、所有关系字段的加载先全部发起，再统一派发和等待，
     * 同类型的兄弟加载因此落在同一批次。单个字段失败只记录字段级错误，值保持 null。
     */
    private void resolveLevels(ExecutionContext context, List<LevelNode> level, List<FieldError> errors) {
        while (!level.isEmpty()) {
            List<PendingLoad> loads = new ArrayList<>();
            for (LevelNode node : level) {
                for (FieldSelection field : node.selections()) {
                    if (FieldCatalog.isRelationship(field.name())) {
                        String path = node.path() + "." + field.name();
                        loads.add(new PendingLoad(node.row(), field.name(), path,
                            startLoad(context, node, field, path)));
                    }
                }
            }
            if (loads.isEmpty()) {
                return;
            }
            context.batchingCache().dispatchAll();
            awaitAll(loads);

            List<LevelNode> next = new ArrayList<>();
            for (PendingLoad load : loads) {
                try {
                    List<LevelNode> children = completed(load.future());
                    List<Map<String, Object>> resolved = new ArrayList<>(children.size());
                    for (LevelNode child : children) {
                        resolved.add(child.row());
                    }
                    load.row().put(load.name(), resolved);
                    next.addAll(children);
                } catch (Exception e) {
                    Throwable cause = unwrap(e);
                    monitor.recordError(context.queryId(), cause);
                    errors.add(new FieldError(load.path(), cause.getMessage()));
                    log.warn("Field resolution failed: queryId={}, path={}, error={}",
                        context.queryId(), load.path(), cause.toString());
                }
            }
            level = next;
        }
    }

    /**
     * 发起一个关系字段的加载；并行执行时子实体的投影在解析线程池上完成
     */
    private CompletableFuture<List<LevelNode>> startLoad(ExecutionContext context, LevelNode parent,
                                                         FieldSelection field, String path) {
        try {
            String targetType = FieldCatalog.targetType(field.name()).orElseThrow();
            CompletableFuture<List<ThreatEntity>> children = context.batchingCache()
                .loadMany(targetType, idsOf(parent.entity().attribute(field.name())));
            if (context.cacheConfig().isParallelExecution()) {
                return children.thenApplyAsync(list -> childNodes(list, field, path), resolverExecutor);
            }
            return children.thenApply(list -> childNodes(list, field, path));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private List<LevelNode> childNodes(List<ThreatEntity> children, FieldSelection field, String path) {
        List<LevelNode> nodes = new ArrayList<>(children.size());
        for (ThreatEntity child : children) {
            if (child != null) {
                nodes.add(new LevelNode(child, projectRow(child, field.selections()), field.selections(),
                    path + "[" + child.getId() + "]"));
            }
        }
        return nodes;
    }

    /**
     * 标量字段直接投影，关系字段先占位保持字段顺序
     */
    private Map<String, Object> projectRow(ThreatEntity entity, List<FieldSelection> selections) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (FieldSelection field : selections) {
            row.put(field.name(), FieldCatalog.isRelationship(field.name()) ? null : projectScalar(entity, field));
        }
        return row;
    }

    private Object projectScalar(ThreatEntity entity, FieldSelection field) {
        Object value = switch (field.name()) {
            case "id" -> entity.getId();
            case "organizationId" -> entity.getOrganizationId();
            case "type" -> entity.attribute("type") != null ? entity.attribute("type") : entity.getType();
            default -> entity.attribute(field.name());
        };
        if (value instanceof Map<?, ?> nested && !field.isLeaf()) {
            Map<String, Object> projected = new LinkedHashMap<>();
            for (FieldSelection child : field.selections()) {
                projected.put(child.name(), nested.get(child.name()));
            }
            return projected;
        }
        return value;
    }

    private static List<String> idsOf(Object value) {
        if (value == null) {
            return List.of();
        }
        if (value instanceof Collection<?> collection) {
            return collection.stream().filter(Objects::nonNull).map(Object::toString).toList();
        }
        return List.of(value.toString());
    }

    private <T> T await(CompletableFuture<T> future) {
        try {
            return future.get(resolverTimeoutMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CompletionException(e);
        } catch (ExecutionException e) {
            throw new CompletionException(e.getCause());
        } catch (TimeoutException e) {
            throw new CompletionException(new TimeoutException("Resolver timed out after " + resolverTimeoutMillis + "ms"));
        }
    }

    private void awaitAll(List<PendingLoad> loads) {
        CompletableFuture<?>[] futures = loads.stream()
            .map(PendingLoad::future)
            .toArray(CompletableFuture[]::new);
        try {
            CompletableFuture.allOf(futures).get(resolverTimeoutMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            // 失败和超时在逐个取结果时按字段记录
            log.debug("Relationship level completed with failures: {}", e.toString());
        }
    }

    private <T> T completed(CompletableFuture<T> future) {
        if (!future.isDone()) {
            throw new CompletionException(new TimeoutException("Resolver timed out after " + resolverTimeoutMillis + "ms"));
        }
        return future.join();
    }

    private static Throwable unwrap(Throwable e) {
        Throwable current = e;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private QueryResult buildResult(ExecutionContext context, List<Map<String, Object>> rows,
                                    List<FieldError> errors, boolean fromCache) {
        QueryAnalysis analysis = context.analysis();
        return QueryResult.builder()
            .data(rows)
            .errors(List.copyOf(errors))
            .metrics(QueryResult.Metrics.builder()
                .queryId(context.queryId())
                .strategy(analysis.strategy())
                .cachingTier(context.cacheConfig().getCachingTier())
                .complexityScore(analysis.complexityScore())
                .cacheHitRatio(monitor.cacheHitRatio(context.queryId()))
                .fromCache(fromCache)
                .build())
            .build();
    }

    private String queryKey(String organizationId, String queryName, QueryRequest request) {
        Map<String, Object> identity = new LinkedHashMap<>();
        identity.put("entityType", request.getEntityType());
        identity.put("rootArguments", request.getRootArguments());
        identity.put("fields", request.getFields());
        String json;
        try {
            json = objectMapper.writeValueAsString(identity);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Request is not serializable: " + e.getOriginalMessage());
        }
        String hash = Hashing.murmur3_128().hashString(json, StandardCharsets.UTF_8).toString();
        return tieredResultCache.key(organizationId, CacheConstants.QUERY_SEGMENT, queryName, hash);
    }

    /**
     * 查询结果缓存值
     */
    public record CachedRows(List<Map<String, Object>> rows) {
    }

    private record LevelNode(ThreatEntity entity, Map<String, Object> row,
                             List<FieldSelection> selections, String path) {
    }

    private record PendingLoad(Map<String, Object> row, String name, String path,
                               CompletableFuture<List<LevelNode>> future) {
    }
}
