package org.retailpos.domain;

/**
 * 操作员角色，由外部认证模块提供
 */
public enum OperatorRole {
    ADMIN,
    STAFF;

    public static OperatorRole fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (OperatorRole role : values()) {
            if (role.name().equalsIgnoreCase(code.trim())) {
                return role;
            }
        }
        return null;
    }
}
