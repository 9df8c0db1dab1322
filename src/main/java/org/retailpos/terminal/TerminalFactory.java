package org.retailpos.terminal;

import org.retailpos.business.SaleCheckoutService;
import org.retailpos.config.PosProperties;
import org.retailpos.routing.BarcodeRouter;
import org.retailpos.scanner.ScanScheduler;
import org.retailpos.service.ICatalogStore;
import org.springframework.stereotype.Component;

/**
 * 终端会话工厂：把单例协作者装配进每个终端
 */
@Component
public class TerminalFactory {

    private final BarcodeRouter router;
    private final ICatalogStore catalogStore;
    private final SaleCheckoutService checkoutService;
    private final PosProperties properties;

    public TerminalFactory(BarcodeRouter router,
                           ICatalogStore catalogStore,
                           SaleCheckoutService checkoutService,
                           PosProperties properties) {
        this.router = router;
        this.catalogStore = catalogStore;
        this.checkoutService = checkoutService;
        this.properties = properties;
    }

    public Terminal create(String terminalId, ScanScheduler scheduler) {
        return new Terminal(terminalId, scheduler, router, catalogStore, checkoutService, properties);
    }
}
