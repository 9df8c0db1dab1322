package org.retailpos.cart;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.retailpos.exception.InsufficientStockException;
import org.retailpos.exception.ProductNotFoundException;
import org.retailpos.support.FakeCatalog;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CartTest {

    private FakeCatalog catalog;
    private Cart cart;

    @BeforeEach
    void setUp() {
        catalog = new FakeCatalog()
                .with("P-001", "Instant Noodles", "15.00", 50, "8991234567890")
                .with("P-002", "Bottled Water", "100.00", 3, "4800016644290")
                .with("P-003", "Last Battery", "50.00", 1, "0000000000017");
        cart = new Cart(catalog.store(), new BigDecimal("0.12"));
    }

    @Test
    void secondAddOfLastUnitIsRejected() {
        cart.addToCart("P-003");

        assertThatThrownBy(() -> cart.addToCart("P-003"))
                .isInstanceOf(InsufficientStockException.class)
                .hasMessage("Insufficient stock. Only 1 available.");
        assertThat(cart.quantityOf("P-003")).isEqualTo(1);
    }

    @Test
    void addUsesAuthoritativeStockNotCachedCopy() {
        cart.addToCart("P-002");
        // 其他终端在此期间卖掉了库存
        catalog.setQuantity("P-002", 1);

        assertThatThrownBy(() -> cart.addToCart("P-002")).isInstanceOf(InsufficientStockException.class);
    }

    @Test
    void lineQuantityNeverExceedsObservedStock() {
        for (int i = 0; i < 10; i++) {
            try {
                cart.addToCart("P-002");
            } catch (InsufficientStockException e) {
                assertThat(e.getAvailable()).isEqualTo(3);
            }
        }
        assertThat(cart.quantityOf("P-002")).isEqualTo(3);
    }

    @Test
    void linesKeepInsertionOrder() {
        cart.addToCart("P-002");
        cart.addToCart("P-001");
        cart.addToCart("P-002");

        assertThat(cart.lines()).extracting(CartLine::getProductId).containsExactly("P-002", "P-001");
    }

    @Test
    void updateQuantityBelowOneRemovesLine() {
        cart.addToCart("P-001");
        cart.updateQuantity("P-001", 0);

        assertThat(cart.isEmpty()).isTrue();
    }

    @Test
    void updateQuantityAboveStockIsRejected() {
        cart.addToCart("P-002");

        assertThatThrownBy(() -> cart.updateQuantity("P-002", 4)).isInstanceOf(InsufficientStockException.class);
        cart.updateQuantity("P-002", 3);
        assertThat(cart.quantityOf("P-002")).isEqualTo(3);
    }

    @Test
    void updateQuantityForMissingLineDoesNothing() {
        cart.updateQuantity("P-001", 5);

        assertThat(cart.isEmpty()).isTrue();
    }

    @Test
    void unknownProductCannotBeAdded() {
        assertThatThrownBy(() -> cart.addToCart("NOPE")).isInstanceOf(ProductNotFoundException.class);
    }

    @Test
    void totalsAreDerivedAndExact() {
        catalog.with("P-010", "Cheap Candy", "0.33", 100, null);
        for (int i = 0; i < 7; i++) {
            cart.addToCart("P-010");
        }
        cart.addToCart("P-001");

        CartTotals totals = cart.totals();
        assertThat(totals.getSubtotal()).isEqualByComparingTo("17.31");
        assertThat(totals.getTax()).isEqualByComparingTo("2.08");
        assertThat(totals.getSubtotal().add(totals.getTax())).isEqualTo(totals.getTotal());
    }

    @Test
    void frozenCartRejectsMutation() {
        cart.addToCart("P-001");
        cart.freeze();

        assertThatThrownBy(() -> cart.addToCart("P-001")).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> cart.removeLine("P-001")).isInstanceOf(IllegalStateException.class);

        cart.unfreeze();
        cart.removeLine("P-001");
        assertThat(cart.isEmpty()).isTrue();
    }
}
