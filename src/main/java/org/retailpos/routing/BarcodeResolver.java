package org.retailpos.routing;

import org.retailpos.domain.Product;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * 条码解析：条码相等优先，其次按商品ID相等
 * <p>
 * 快照按商品ID升序排列，多个商品登记了同一条码时取ID最小者
 */
@Component
public class BarcodeResolver {

    public Optional<Product> resolve(String token, List<Product> snapshot) {
        if (token == null || token.isEmpty()) {
            return Optional.empty();
        }
        for (Product product : snapshot) {
            if (token.equals(product.getBarcode())) {
                return Optional.of(product);
            }
        }
        for (Product product : snapshot) {
            if (token.equals(product.getId())) {
                return Optional.of(product);
            }
        }
        return Optional.empty();
    }
}
