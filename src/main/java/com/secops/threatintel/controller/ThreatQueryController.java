package com.secops.threatintel.controller;

import com.secops.threatintel.dto.ApiResponse;
import com.secops.threatintel.dto.QueryRequest;
import com.secops.threatintel.dto.QueryResult;
import com.secops.threatintel.security.IdentityContext;
import com.secops.threatintel.service.ThreatQueryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 威胁情报查询 API
 */
@Slf4j
@RestController
@RequestMapping("/api/threat-intel")
@RequiredArgsConstructor
public class ThreatQueryController {

    private final ThreatQueryService threatQueryService;

    /**
     * 按字段树查询实体，返回数据、字段级错误与执行指标
     */
    @PostMapping("/query")
    public ApiResponse<QueryResult> query(IdentityContext identity, @RequestBody QueryRequest request) {
        QueryResult result = threatQueryService.execute(identity, request);
        if (result.getErrors() != null && !result.getErrors().isEmpty()) {
            log.debug("Query returned partial result: queryId={}, errors={}",
                result.getMetrics().getQueryId(), result.getErrors().size());
        }
        return ApiResponse.success(result);
    }
}
