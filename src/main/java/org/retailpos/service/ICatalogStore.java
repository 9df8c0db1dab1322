package org.retailpos.service;

import com.baomidou.mybatisplus.extension.service.IService;
import org.retailpos.domain.Product;

import java.util.List;

/**
 * 商品库（权威库存的所有者）
 * <p>
 * 保证调用方对自己写入的数据可读到，但不提供跨调用方的隔离
 */
public interface ICatalogStore extends IService<Product> {

    /**
     * 全量商品，按商品ID升序
     */
    List<Product> listProducts();

    /**
     * 读取权威商品记录
     *
     * @param id 商品ID
     * @return 商品
     * @throws org.retailpos.exception.ProductNotFoundException 商品不存在
     */
    Product getProduct(String id);

    /**
     * 按补丁更新商品，补丁中为 null 的字段不更新
     *
     * @param id 商品ID
     * @param patch 补丁
     * @return 更新后重新读取的商品
     */
    Product updateProduct(String id, Product patch);
}
