package org.retailpos.domain;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * 商品实体
 * <p>
 * quantity 为权威库存，归商品库所有；购物车与目录缓存持有的都是副本。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@TableName("products")
public class Product {
    /**
     * 商品ID
     */
    @TableId(type = IdType.INPUT)
    private String id;
    /**
     * 商品名称
     */
    private String name;
    /**
     * 描述
     */
    private String description;
    /**
     * 分类
     */
    @TableField("category_name")
    private String category;
    /**
     * 售价
     */
    private BigDecimal price;
    /**
     * 成本价
     */
    private BigDecimal costPrice;
    /**
     * 权威库存数量
     */
    private Integer quantity;
    /**
     * 低库存预警阈值
     */
    private Integer lowStockThreshold;
    /**
     * 条码（可选，解析时视为唯一）
     */
    private String barcode;
    /**
     * 图片地址
     */
    private String imageUrl;

    public int availableQuantity() {
        return quantity == null ? 0 : quantity;
    }
}
