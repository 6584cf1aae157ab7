package com.secops.threatintel.dto;

import com.secops.threatintel.model.CachingTier;
import com.secops.threatintel.model.ExecutionStrategy;
import com.secops.threatintel.model.FieldError;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * 读结果，附带带外指标
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryResult {

    private List<Map<String, Object>> data;
    private List<FieldError> errors;
    private Metrics metrics;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Metrics {
        private String queryId;
        private ExecutionStrategy strategy;
        private CachingTier cachingTier;
        private int complexityScore;
        private double cacheHitRatio;
        private boolean fromCache;
    }
}
