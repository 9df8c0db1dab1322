package org.retailpos.controller;

import lombok.extern.slf4j.Slf4j;
import org.retailpos.exception.AccessDeniedException;
import org.retailpos.exception.InventoryApplyException;
import org.retailpos.exception.PosException;
import org.retailpos.exception.ProductNotFoundException;
import org.retailpos.exception.TerminalBusyException;
import org.retailpos.exception.TransactionNotFoundException;
import org.retailpos.exception.TransactionPersistException;
import org.retailpos.util.TraceIdUtil;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * 统一响应：{code, message, data, traceId}
 * <p>
 * 错误码与 HTTP 状态：
 * - 业务拒绝（未知条码、缺货、库存不足、支付校验失败等）200 + 对应错误码
 * - 商品/交易不存在 404，权限不足 403，交易落库失败与终端超时 503
 * - 库存扣减未完全生效 200 + SETTLED_WITH_INVENTORY_FAILURE
 * - 请求参数错误 400，购物车结账中被锁定 409，其他异常 500
 */
@Slf4j
final class ApiResponses {

    static final String SUCCESS = "SUCCESS";
    static final String SETTLED_WITH_INVENTORY_FAILURE = "SETTLED_WITH_INVENTORY_FAILURE";

    private ApiResponses() {
    }

    /**
     * 执行操作并转换结果/异常
     *
     * @param operation 操作名（日志用）
     * @param action 操作
     */
    static ResponseEntity<Map<String, Object>> execute(String operation, Supplier<Object> action) {
        String traceId = TraceIdUtil.getTraceId();
        try {
            return success(action.get(), "OK");
        } catch (InventoryApplyException e) {
            Map<String, Object> data = new HashMap<>();
            data.put("transaction", e.getTransaction());
            data.put("failedLines", e.getFailedLines());
            Map<String, Object> response = body(SETTLED_WITH_INVENTORY_FAILURE, e.getMessage(), data);
            return ResponseEntity.ok(response);
        } catch (PosException e) {
            log.info("[请求被拒绝] operation={}, code={}, message={}, traceId={}",
                    operation, e.getCode(), e.getMessage(), traceId);
            return ResponseEntity.status(statusOf(e)).body(body(e.getCode(), e.getMessage(), null));
        } catch (IllegalArgumentException e) {
            log.warn("[请求参数错误] operation={}, errorMsg={}, traceId={}", operation, e.getMessage(), traceId);
            return ResponseEntity.badRequest().body(body("BAD_REQUEST", e.getMessage(), null));
        } catch (IllegalStateException e) {
            log.warn("[请求冲突] operation={}, errorMsg={}, traceId={}", operation, e.getMessage(), traceId);
            return ResponseEntity.status(HttpStatus.CONFLICT).body(body("CONFLICT", e.getMessage(), null));
        } catch (Exception e) {
            log.error("[请求异常] operation={}, errorMsg={}, traceId={}", operation, e.getMessage(), traceId, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(body("ERROR", "系统异常：" + e.getMessage(), null));
        }
    }

    static ResponseEntity<Map<String, Object>> success(Object data, String message) {
        return ResponseEntity.ok(body(SUCCESS, message, data));
    }

    static HttpStatus statusOf(PosException e) {
        if (e instanceof ProductNotFoundException || e instanceof TransactionNotFoundException) {
            return HttpStatus.NOT_FOUND;
        }
        if (e instanceof AccessDeniedException) {
            return HttpStatus.FORBIDDEN;
        }
        if (e instanceof TransactionPersistException || e instanceof TerminalBusyException) {
            return HttpStatus.SERVICE_UNAVAILABLE;
        }
        return HttpStatus.OK;
    }

    private static Map<String, Object> body(String code, String message, Object data) {
        Map<String, Object> response = new HashMap<>();
        response.put("code", code);
        response.put("message", message);
        response.put("data", data);
        response.put("traceId", TraceIdUtil.getTraceId());
        return response;
    }
}
