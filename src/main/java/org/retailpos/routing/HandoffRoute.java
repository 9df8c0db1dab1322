package org.retailpos.routing;

import org.retailpos.domain.Product;
import org.retailpos.scanner.ScreenId;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 其余页面：找到有货商品后一次性转交给收银页
 */
@Component
public class HandoffRoute implements ScreenRoute {

    @Override
    public boolean supports(ScreenId screen) {
        return screen != ScreenId.SALE && screen != ScreenId.CATALOG && screen != ScreenId.PRODUCT_FORM;
    }

    @Override
    public RoutedAction decide(String token, ScreenId screen, Optional<Product> match) {
        if (match.isEmpty()) {
            return RoutedAction.of(ActionType.UNKNOWN_BARCODE, token, screen);
        }
        Product product = match.get();
        if (product.availableQuantity() <= 0) {
            return RoutedAction.of(ActionType.OUT_OF_STOCK, token, screen, product);
        }
        return RoutedAction.of(ActionType.HANDOFF_TO_SALE, token, screen, product);
    }
}
