package org.retailpos.controller.dto;

import lombok.Data;

@Data
public class DeleteTransactionRequest {
    /**
     * 当前操作员角色：admin / staff
     */
    private String userRole;
}
