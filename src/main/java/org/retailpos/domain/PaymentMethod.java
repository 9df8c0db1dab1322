package org.retailpos.domain;

import com.baomidou.mybatisplus.annotation.EnumValue;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 支付方式（封闭枚举）
 * - cash: 现金，需要找零
 * - card / gcash: 需要流水号，实收金额等于应付金额
 */
public enum PaymentMethod {

    CASH("cash", false),
    CARD("card", true),
    GCASH("gcash", true);

    @EnumValue
    @JsonValue
    private final String code;
    private final boolean referenceRequired;

    PaymentMethod(String code, boolean referenceRequired) {
        this.code = code;
        this.referenceRequired = referenceRequired;
    }

    public String getCode() {
        return code;
    }

    public boolean isReferenceRequired() {
        return referenceRequired;
    }

    /**
     * 按编码解析，大小写不敏感；未知编码返回 null，由调用方决定如何拒绝
     */
    @JsonCreator
    public static PaymentMethod fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (PaymentMethod method : values()) {
            if (method.code.equalsIgnoreCase(code.trim())) {
                return method;
            }
        }
        return null;
    }
}
