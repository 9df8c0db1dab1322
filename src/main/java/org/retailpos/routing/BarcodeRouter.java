package org.retailpos.routing;

import lombok.extern.slf4j.Slf4j;
import org.retailpos.cache.CatalogCache;
import org.retailpos.domain.Product;
import org.retailpos.scanner.ScreenId;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * 条码路由器
 * <p>
 * 执行流程：
 * 1. 重复投递抑制：窗口内的相同条码、或已有条码正在处理时，静默丢弃
 * 2. 在目录缓存快照中解析条码
 * 3. 按当前页面选择路由规则，得到路由结果
 * 4. 在"处理中"标记仍然有效时执行路由结果的副作用，结束后清除标记
 * <p>
 * 本身无状态，所有可变状态都在调用方传入的 RoutingContext 中
 */
@Slf4j
@Component
public class BarcodeRouter {

    private final CatalogCache catalogCache;
    private final BarcodeResolver resolver;
    private final DedupPolicy dedupPolicy;
    private final List<ScreenRoute> routes;

    public BarcodeRouter(CatalogCache catalogCache,
                         BarcodeResolver resolver,
                         DedupPolicy dedupPolicy,
                         List<ScreenRoute> routes) {
        this.catalogCache = catalogCache;
        this.resolver = resolver;
        this.dedupPolicy = dedupPolicy;
        this.routes = List.copyOf(routes);
    }

    /**
     * 路由一个条码
     *
     * @param token 条码
     * @param screen 当前页面
     * @param context 终端路由上下文
     * @param now 当前时间（毫秒）
     * @param effect 路由结果的执行者，抛出的异常原样向上传播
     * @return 路由结果；被去重丢弃时为空
     */
    public Optional<RoutedAction> route(String token,
                                        ScreenId screen,
                                        RoutingContext context,
                                        long now,
                                        Consumer<RoutedAction> effect) {
        // ==================== 1. 重复投递抑制 ====================
        long windowMillis = dedupPolicy.windowMillis(screen);
        if (!context.tryBegin(token, now, windowMillis)) {
            log.debug("[条码丢弃] 重复投递或处理中, token={}, screen={}, windowMillis={}",
                    token, screen, windowMillis);
            return Optional.empty();
        }

        try {
            // ==================== 2. 解析条码 ====================
            if (!catalogCache.isLoaded()) {
                catalogCache.refresh();
            }
            Optional<Product> match = resolver.resolve(token, catalogCache.snapshot());

            // ==================== 3. 按页面路由 ====================
            RoutedAction action = routeFor(screen).decide(token, screen, match);
            log.info("[条码路由] token={}, screen={}, action={}, productId={}",
                    token, screen, action.getType(), match.map(Product::getId).orElse(null));

            // ==================== 4. 执行 ====================
            effect.accept(action);
            return Optional.of(action);
        } finally {
            context.complete();
        }
    }

    private ScreenRoute routeFor(ScreenId screen) {
        for (ScreenRoute route : routes) {
            if (route.supports(screen)) {
                return route;
            }
        }
        throw new IllegalStateException("No route registered for screen " + screen);
    }
}
