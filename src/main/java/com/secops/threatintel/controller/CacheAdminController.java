package com.secops.threatintel.controller;

import com.secops.threatintel.dto.ApiResponse;
import com.secops.threatintel.dto.InvalidateRequest;
import com.secops.threatintel.exception.ValidationException;
import com.secops.threatintel.monitor.DashboardSnapshotReporter;
import com.secops.threatintel.monitor.QueryPerformanceMonitor;
import com.secops.threatintel.security.AccessPolicy;
import com.secops.threatintel.security.IdentityContext;
import com.secops.threatintel.security.Role;
import com.secops.threatintel.service.ThreatQueryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 运维管理 API
 * 查询统计、仪表盘快照与手动缓存失效，均要求 ADMIN 角色
 */
@Slf4j
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
public class CacheAdminController {

    private final AccessPolicy accessPolicy;
    private final QueryPerformanceMonitor queryMonitor;
    private final DashboardSnapshotReporter dashboardReporter;
    private final ThreatQueryService threatQueryService;

    /**
     * 查询统计；传入 name 时附带该查询名的平均耗时
     */
    @GetMapping("/query-stats")
    public ApiResponse<Map<String, Object>> queryStats(IdentityContext identity,
                                                       @RequestParam(required = false) String name) {
        accessPolicy.authorize(identity, Role.ADMIN);
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("overall", queryMonitor.getQueryStats());
        stats.put("activeQueries", queryMonitor.activeQueryCount());
        if (name != null && !name.isBlank()) {
            stats.put("averageQueryTime", queryMonitor.getAverageQueryTime(name));
        }
        return ApiResponse.success(stats);
    }

    @GetMapping("/dashboard")
    public ApiResponse<DashboardSnapshotReporter.DashboardSnapshot> dashboard(IdentityContext identity) {
        accessPolicy.authorize(identity, Role.ADMIN);
        return ApiResponse.success(dashboardReporter.snapshot());
    }

    /**
     * 手动失效
     */
    @PostMapping("/cache/invalidate")
    public ApiResponse<Map<String, Object>> invalidate(IdentityContext identity,
                                                       @RequestBody InvalidateRequest request) {
        accessPolicy.authorize(identity, Role.ADMIN);
        String organizationId = request.getOrganizationId() != null
            ? request.getOrganizationId() : identity.organizationId();
        accessPolicy.checkOrganization(identity, organizationId);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("organizationId", organizationId);
        if (request.getEntityType() != null && request.getId() != null) {
            threatQueryService.onEntityChanged(organizationId, request.getEntityType(), request.getId(), null);
            result.put("entity", request.getEntityType() + ":" + request.getId());
        } else if (request.getPattern() != null && !request.getPattern().isBlank()) {
            long removed = threatQueryService.invalidateOrganizationPattern(organizationId, request.getPattern());
            result.put("pattern", request.getPattern());
            result.put("removedSharedKeys", removed);
        } else {
            throw new ValidationException("entityType and id, or pattern, is required");
        }
        log.info("Manual cache invalidation: user={}, {}", identity.userId(), result);
        return ApiResponse.success(result);
    }
}
