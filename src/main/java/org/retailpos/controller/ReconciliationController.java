package org.retailpos.controller;

import lombok.extern.slf4j.Slf4j;
import org.retailpos.business.ReconciliationService;
import org.retailpos.util.TraceIdUtil;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * 库存对账
 * - 查询扣减失败的行
 * - 人工触发重试
 */
@Slf4j
@RestController
@RequestMapping("/api/reconciliation")
public class ReconciliationController {

    private final ReconciliationService reconciliationService;

    public ReconciliationController(ReconciliationService reconciliationService) {
        this.reconciliationService = reconciliationService;
    }

    @GetMapping("/failed")
    public ResponseEntity<Map<String, Object>> failed() {
        return ApiResponses.execute("listFailed", reconciliationService::listFailed);
    }

    @PostMapping("/{transactionId}/retry")
    public ResponseEntity<Map<String, Object>> retry(@PathVariable String transactionId) {
        log.info("[对账重试请求] transactionId={}, traceId={}", transactionId, TraceIdUtil.getTraceId());
        return ApiResponses.execute("retry", () -> reconciliationService.retry(transactionId));
    }
}
