package org.retailpos.routing;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;
import org.retailpos.domain.Product;
import org.retailpos.scanner.ScreenId;

/**
 * 路由结果
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RoutedAction {
    ActionType type;
    String token;
    ScreenId screen;
    /**
     * 匹配到的商品（缓存快照，可能已过期）
     */
    Product product;

    public static RoutedAction of(ActionType type, String token, ScreenId screen, Product product) {
        return new RoutedAction(type, token, screen, product);
    }

    public static RoutedAction of(ActionType type, String token, ScreenId screen) {
        return new RoutedAction(type, token, screen, null);
    }
}
