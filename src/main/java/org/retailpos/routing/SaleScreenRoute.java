package org.retailpos.routing;

import org.retailpos.domain.Product;
import org.retailpos.scanner.ScreenId;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class SaleScreenRoute implements ScreenRoute {

    @Override
    public boolean supports(ScreenId screen) {
        return screen == ScreenId.SALE;
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
        return RoutedAction.of(ActionType.ADD_TO_CART, token, screen, product);
    }
}
