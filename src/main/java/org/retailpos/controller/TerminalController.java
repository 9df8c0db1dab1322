package org.retailpos.controller;

import lombok.extern.slf4j.Slf4j;
import org.retailpos.checkout.PaymentDetails;
import org.retailpos.controller.dto.CartItemRequest;
import org.retailpos.controller.dto.KeyBatchRequest;
import org.retailpos.controller.dto.ScanRequest;
import org.retailpos.controller.dto.ScreenRequest;
import org.retailpos.scanner.KeyStroke;
import org.retailpos.scanner.ScreenId;
import org.retailpos.terminal.Terminal;
import org.retailpos.terminal.TerminalRegistry;
import org.retailpos.util.TraceIdUtil;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Locale;
import java.util.Map;

/**
 * 收银终端控制器
 * - 按键、手动扫码、页面切换、扫描挂起/恢复
 * - 购物车增删改
 * - 结账
 * <p>
 * 所有操作都在对应终端的事件循环上执行，返回终端快照
 */
@Slf4j
@RestController
@RequestMapping("/api/terminals/{terminalId}")
public class TerminalController {

    private final TerminalRegistry terminalRegistry;

    public TerminalController(TerminalRegistry terminalRegistry) {
        this.terminalRegistry = terminalRegistry;
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> snapshot(@PathVariable String terminalId) {
        return ApiResponses.execute("snapshot",
                () -> terminalRegistry.call(terminalId, Terminal::snapshot));
    }

    @GetMapping("/notifications")
    public ResponseEntity<Map<String, Object>> notifications(@PathVariable String terminalId) {
        return ApiResponses.execute("notifications",
                () -> terminalRegistry.call(terminalId, Terminal::drainNotifications));
    }

    // ==================== 扫码输入 ====================

    @PostMapping("/keys")
    public ResponseEntity<Map<String, Object>> key(@PathVariable String terminalId,
                                                   @RequestBody KeyStroke keyStroke) {
        return ApiResponses.execute("key", () -> terminalRegistry.call(terminalId, terminal -> {
            terminal.onKey(keyStroke);
            return terminal.snapshot();
        }));
    }

    @PostMapping("/keys/batch")
    public ResponseEntity<Map<String, Object>> keys(@PathVariable String terminalId,
                                                    @RequestBody KeyBatchRequest request) {
        return ApiResponses.execute("keys", () -> terminalRegistry.call(terminalId, terminal -> {
            for (KeyStroke keyStroke : request.getKeys()) {
                terminal.onKey(keyStroke);
            }
            return terminal.snapshot();
        }));
    }

    @PostMapping("/scan")
    public ResponseEntity<Map<String, Object>> scan(@PathVariable String terminalId,
                                                    @RequestBody ScanRequest request) {
        log.info("[手动扫码] terminalId={}, barcode={}, traceId={}",
                terminalId, request.getBarcode(), TraceIdUtil.getTraceId());
        return ApiResponses.execute("scan", () -> terminalRegistry.call(terminalId, terminal -> {
            terminal.manualScan(request.getBarcode());
            return terminal.snapshot();
        }));
    }

    @PutMapping("/screen")
    public ResponseEntity<Map<String, Object>> navigate(@PathVariable String terminalId,
                                                        @RequestBody ScreenRequest request) {
        return ApiResponses.execute("navigate", () -> {
            if (request.getScreen() == null) {
                throw new IllegalArgumentException("screen is required");
            }
            ScreenId target = ScreenId.valueOf(request.getScreen().trim().toUpperCase(Locale.ROOT));
            return terminalRegistry.call(terminalId, terminal -> {
                terminal.navigate(target);
                return terminal.snapshot();
            });
        });
    }

    @PostMapping("/suspend")
    public ResponseEntity<Map<String, Object>> suspend(@PathVariable String terminalId) {
        return ApiResponses.execute("suspend", () -> terminalRegistry.call(terminalId, terminal -> {
            terminal.suspend();
            return terminal.snapshot();
        }));
    }

    @PostMapping("/resume")
    public ResponseEntity<Map<String, Object>> resume(@PathVariable String terminalId) {
        return ApiResponses.execute("resume", () -> terminalRegistry.call(terminalId, terminal -> {
            terminal.resume();
            return terminal.snapshot();
        }));
    }

    // ==================== 购物车 ====================

    @PostMapping("/cart/items")
    public ResponseEntity<Map<String, Object>> addToCart(@PathVariable String terminalId,
                                                         @RequestBody CartItemRequest request) {
        return ApiResponses.execute("addToCart", () -> terminalRegistry.call(terminalId, terminal -> {
            terminal.addToCart(request.getProductId());
            return terminal.snapshot();
        }));
    }

    @PutMapping("/cart/items/{productId}")
    public ResponseEntity<Map<String, Object>> updateQuantity(@PathVariable String terminalId,
                                                              @PathVariable String productId,
                                                              @RequestBody CartItemRequest request) {
        return ApiResponses.execute("updateQuantity", () -> {
            if (request.getQuantity() == null) {
                throw new IllegalArgumentException("quantity is required");
            }
            return terminalRegistry.call(terminalId, terminal -> {
                terminal.updateQuantity(productId, request.getQuantity());
                return terminal.snapshot();
            });
        });
    }

    @DeleteMapping("/cart/items/{productId}")
    public ResponseEntity<Map<String, Object>> removeLine(@PathVariable String terminalId,
                                                          @PathVariable String productId) {
        return ApiResponses.execute("removeLine", () -> terminalRegistry.call(terminalId, terminal -> {
            terminal.removeLine(productId);
            return terminal.snapshot();
        }));
    }

    @DeleteMapping("/cart")
    public ResponseEntity<Map<String, Object>> clearCart(@PathVariable String terminalId) {
        return ApiResponses.execute("clearCart", () -> terminalRegistry.call(terminalId, terminal -> {
            terminal.clearCart();
            return terminal.snapshot();
        }));
    }

    // ==================== 结账 ====================

    /**
     * 结账
     * 成功返回交易；库存扣减未完全生效时返回 SETTLED_WITH_INVENTORY_FAILURE 及失败行
     */
    @PostMapping("/checkout")
    public ResponseEntity<Map<String, Object>> checkout(@PathVariable String terminalId,
                                                        @RequestBody PaymentDetails payment) {
        log.info("[结账请求] terminalId={}, paymentMethod={}, traceId={}",
                terminalId, payment.getPaymentMethod(), TraceIdUtil.getTraceId());
        return ApiResponses.execute("checkout",
                () -> terminalRegistry.call(terminalId, terminal -> terminal.checkout(payment)));
    }
}
