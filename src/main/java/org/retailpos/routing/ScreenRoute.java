package org.retailpos.routing;

import org.retailpos.domain.Product;
import org.retailpos.scanner.ScreenId;

import java.util.Optional;

/**
 * 按当前页面决定条码的去向
 */
public interface ScreenRoute {

    boolean supports(ScreenId screen);

    /**
     * @param token 条码
     * @param screen 当前页面
     * @param match 目录缓存中的匹配结果
     * @return 路由结果
     */
    RoutedAction decide(String token, ScreenId screen, Optional<Product> match);
}
