package org.retailpos.routing;

import org.retailpos.domain.Product;
import org.retailpos.scanner.ScreenId;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class ProductFormRoute implements ScreenRoute {

    @Override
    public boolean supports(ScreenId screen) {
        return screen == ScreenId.PRODUCT_FORM;
    }

    @Override
    public RoutedAction decide(String token, ScreenId screen, Optional<Product> match) {
        return RoutedAction.of(ActionType.PREFILL_BARCODE, token, screen);
    }
}
