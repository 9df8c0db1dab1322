package org.retailpos.routing;

import org.retailpos.domain.Product;
import org.retailpos.scanner.ScreenId;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 目录管理页：已登记的条码给出重复提示，未登记的条码进入新建商品表单
 */
@Component
public class CatalogScreenRoute implements ScreenRoute {

    @Override
    public boolean supports(ScreenId screen) {
        return screen == ScreenId.CATALOG;
    }

    @Override
    public RoutedAction decide(String token, ScreenId screen, Optional<Product> match) {
        return match
                .map(product -> RoutedAction.of(ActionType.DUPLICATE_BARCODE, token, screen, product))
                .orElseGet(() -> RoutedAction.of(ActionType.OPEN_PRODUCT_FORM, token, screen));
    }
}
