package org.retailpos.controller;

import lombok.extern.slf4j.Slf4j;
import org.retailpos.business.TransactionAdminService;
import org.retailpos.controller.dto.DeleteTransactionRequest;
import org.retailpos.service.ITransactionStore;
import org.retailpos.util.TraceIdUtil;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 交易查询与管理
 */
@Slf4j
@RestController
@RequestMapping("/api/transactions")
public class TransactionController {

    private final ITransactionStore transactionStore;
    private final TransactionAdminService transactionAdminService;

    public TransactionController(ITransactionStore transactionStore,
                                 TransactionAdminService transactionAdminService) {
        this.transactionStore = transactionStore;
        this.transactionAdminService = transactionAdminService;
    }

    /**
     * 按时间范围查询交易，最新的在前；不传边界表示不限
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> list(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime to) {
        return ApiResponses.execute("listTransactions", () -> transactionStore.listTransactions(from, to));
    }

    @GetMapping("/{transactionId}")
    public ResponseEntity<Map<String, Object>> get(@PathVariable String transactionId) {
        return ApiResponses.execute("getTransaction", () -> transactionStore.getTransaction(transactionId));
    }

    /**
     * 删除交易（仅管理员）
     */
    @DeleteMapping("/{transactionId}")
    public ResponseEntity<Map<String, Object>> delete(
            @PathVariable String transactionId,
            @RequestBody(required = false) DeleteTransactionRequest request,
            @RequestParam(required = false) String userRole) {
        String role = request != null && request.getUserRole() != null ? request.getUserRole() : userRole;
        log.info("[删除交易请求] transactionId={}, userRole={}, traceId={}",
                transactionId, role, TraceIdUtil.getTraceId());
        return ApiResponses.execute("deleteTransaction", () -> {
            transactionAdminService.deleteTransaction(transactionId, role);
            return Map.of("id", transactionId);
        });
    }
}
