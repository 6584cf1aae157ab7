package com.secops.threatintel.controller;

import com.secops.threatintel.monitor.DashboardSnapshotReporter;
import com.secops.threatintel.monitor.QueryPerformanceMonitor;
import com.secops.threatintel.security.AccessPolicy;
import com.secops.threatintel.service.ThreatQueryService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * 运维管理控制器测试
 */
@WebMvcTest(CacheAdminController.class)
@Import(AccessPolicy.class)
class CacheAdminControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private QueryPerformanceMonitor queryMonitor;

    @MockBean
    private DashboardSnapshotReporter dashboardReporter;

    @MockBean
    private ThreatQueryService threatQueryService;

    @Test
    @DisplayName("查询统计 - 带查询名")
    void testQueryStats() throws Exception {
        when(queryMonitor.getQueryStats()).thenReturn(new QueryPerformanceMonitor.QueryStats(10, 12.5, 1, 0.8));
        when(queryMonitor.activeQueryCount()).thenReturn(2);
        when(queryMonitor.getAverageQueryTime("threatById")).thenReturn(8.0);

        mockMvc.perform(get("/api/admin/query-stats")
                .param("name", "threatById")
                .header("X-Organization-Id", "org-1")
                .header("X-User-Id", "admin")
                .header("X-User-Role", "ADMIN"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.overall.totalQueries").value(10))
            .andExpect(jsonPath("$.data.activeQueries").value(2))
            .andExpect(jsonPath("$.data.averageQueryTime").value(8.0));
    }

    @Test
    @DisplayName("非管理员访问 - 403")
    void testQueryStats_forbidden() throws Exception {
        mockMvc.perform(get("/api/admin/query-stats")
                .header("X-Organization-Id", "org-1")
                .header("X-User-Id", "u-1")
                .header("X-User-Role", "ANALYST"))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.code").value(403));
        verifyNoInteractions(queryMonitor);
    }

    @Test
    @DisplayName("按实体失效")
    void testInvalidateEntity() throws Exception {
        mockMvc.perform(post("/api/admin/cache/invalidate")
                .header("X-Organization-Id", "org-1")
                .header("X-User-Id", "admin")
                .header("X-User-Role", "ADMIN")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"entityType\":\"threat\",\"id\":\"t1\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.organizationId").value("org-1"))
            .andExpect(jsonPath("$.data.entity").value("threat:t1"));

        verify(threatQueryService).onEntityChanged("org-1", "threat", "t1", null);
    }

    @Test
    @DisplayName("按模式失效")
    void testInvalidatePattern() throws Exception {
        when(threatQueryService.invalidateOrganizationPattern("org-1", "query:*")).thenReturn(3L);

        mockMvc.perform(post("/api/admin/cache/invalidate")
                .header("X-Organization-Id", "org-1")
                .header("X-User-Id", "admin")
                .header("X-User-Role", "ADMIN")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"pattern\":\"query:*\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.removedSharedKeys").value(3));
    }

    @Test
    @DisplayName("失效其它组织 - 非 SUPER_ADMIN 拒绝")
    void testInvalidate_crossOrganization() throws Exception {
        mockMvc.perform(post("/api/admin/cache/invalidate")
                .header("X-Organization-Id", "org-1")
                .header("X-User-Id", "admin")
                .header("X-User-Role", "ADMIN")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"organizationId\":\"org-2\",\"pattern\":\"query:*\"}"))
            .andExpect(status().isForbidden());

        verify(threatQueryService, never()).invalidateOrganizationPattern(anyString(), anyString());
    }

    @Test
    @DisplayName("缺少失效目标 - 400")
    void testInvalidate_missingTarget() throws Exception {
        mockMvc.perform(post("/api/admin/cache/invalidate")
                .header("X-Organization-Id", "org-1")
                .header("X-User-Id", "admin")
                .header("X-User-Role", "ADMIN")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value(400));

        verify(threatQueryService, never()).onEntityChanged(anyString(), anyString(), anyString(), any());
    }
}
