package org.retailpos.scanner;

/**
 * 终端页面标识，决定扫描结果的路由方式
 */
public enum ScreenId {
    /**
     * 收银页
     */
    SALE,
    /**
     * 商品目录管理页
     */
    CATALOG,
    /**
     * 新建商品表单（使用独立的条码解码器）
     */
    PRODUCT_FORM,
    DASHBOARD,
    SALES_HISTORY,
    REPORTS,
    ANALYTICS,
    SETTINGS
}
