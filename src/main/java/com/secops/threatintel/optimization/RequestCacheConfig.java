package com.secops.threatintel.optimization;

import com.secops.threatintel.constant.FieldCatalog;
import com.secops.threatintel.model.BatchKey;
import com.secops.threatintel.model.CachingTier;

import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 单个请求的缓存/批量配置
 * 由 {@link OptimizationExecutor} 在解析开始前写入，解析过程中只读
 */
public class RequestCacheConfig {

    private volatile CachingTier cachingTier = CachingTier.NORMAL;
    private volatile boolean parallelExecution;
    private volatile boolean batchingEnabled;

    /** 字段名 -> 批次大小 */
    private final Map<String, Integer> batchSizes = new ConcurrentHashMap<>();
    private final Set<BatchKey> prefetchKeys = ConcurrentHashMap.newKeySet();
    private final Set<String> preRegisteredTypes = ConcurrentHashMap.newKeySet();

    public CachingTier getCachingTier() {
        return cachingTier;
    }

    public void setCachingTier(CachingTier cachingTier) {
        this.cachingTier = cachingTier;
    }

    public boolean isParallelExecution() {
        return parallelExecution;
    }

    public void setParallelExecution(boolean parallelExecution) {
        this.parallelExecution = parallelExecution;
    }

    public boolean isBatchingEnabled() {
        return batchingEnabled;
    }

    public void setBatchingEnabled(boolean batchingEnabled) {
        this.batchingEnabled = batchingEnabled;
    }

    public void setBatchSize(String field, int size) {
        batchSizes.put(field, size);
    }

    public Integer getBatchSize(String field) {
        return batchSizes.get(field);
    }

    /**
     * 实体类型的最大批次：取映射到该类型的所有已调优字段中的最大值
     */
    public int maxBatchSizeFor(String entityType, int defaultSize) {
        int max = -1;
        for (Map.Entry<String, Integer> entry : batchSizes.entrySet()) {
            String target = FieldCatalog.targetType(entry.getKey()).orElse(null);
            if (entityType.equals(target)) {
                max = Math.max(max, entry.getValue());
            }
        }
        return max > 0 ? max : defaultSize;
    }

    public void addPrefetchKey(BatchKey key) {
        prefetchKeys.add(key);
    }

    public Set<BatchKey> getPrefetchKeys() {
        return Set.copyOf(prefetchKeys);
    }

    public void addPreRegisteredType(String entityType) {
        preRegisteredTypes.add(entityType);
    }

    public Set<String> getPreRegisteredTypes() {
        return Set.copyOf(preRegisteredTypes);
    }

    /**
     * 当前配置的不可变快照，便于比较和日志输出
     */
    public Snapshot snapshot() {
        return new Snapshot(cachingTier, parallelExecution, batchingEnabled,
            new TreeMap<>(batchSizes), Set.copyOf(prefetchKeys), new TreeSet<>(preRegisteredTypes));
    }

    public record Snapshot(
        CachingTier cachingTier,
        boolean parallelExecution,
        boolean batchingEnabled,
        Map<String, Integer> batchSizes,
        Set<BatchKey> prefetchKeys,
        Set<String> preRegisteredTypes
    ) {}
}
