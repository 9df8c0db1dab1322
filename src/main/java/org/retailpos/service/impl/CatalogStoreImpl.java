package org.retailpos.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import lombok.extern.slf4j.Slf4j;
import org.retailpos.domain.Product;
import org.retailpos.exception.ProductNotFoundException;
import org.retailpos.mapper.ProductMapper;
import org.retailpos.service.ICatalogStore;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 商品库实现
 * <p>
 * 注意：updateProduct 是普通的按主键更新，不带版本校验。
 * 多个终端对同一商品的"读-改-写"之间没有任何隔离。
 */
@Slf4j
@Service
public class CatalogStoreImpl extends ServiceImpl<ProductMapper, Product> implements ICatalogStore {

    @Override
    public List<Product> listProducts() {
        LambdaQueryWrapper<Product> queryWrapper = new LambdaQueryWrapper<>();
        queryWrapper.orderByAsc(Product::getId);
        return baseMapper.selectList(queryWrapper);
    }

    @Override
    public Product getProduct(String id) {
        Product product = baseMapper.selectById(id);
        if (product == null) {
            log.warn("[商品不存在] productId={}", id);
            throw new ProductNotFoundException(id);
        }
        return product;
    }

    @Override
    public Product updateProduct(String id, Product patch) {
        Product toWrite = patch.toBuilder().id(id).build();
        int updatedRows = baseMapper.updateById(toWrite);
        if (updatedRows == 0) {
            log.warn("[商品更新失败] 商品不存在, productId={}", id);
            throw new ProductNotFoundException(id);
        }
        log.debug("[商品已更新] productId={}, quantity={}", id, toWrite.getQuantity());
        return getProduct(id);
    }
}
