package org.retailpos.business;

import lombok.extern.slf4j.Slf4j;
import org.retailpos.domain.OperatorRole;
import org.retailpos.exception.AccessDeniedException;
import org.retailpos.exception.TransactionNotFoundException;
import org.retailpos.service.ITransactionStore;
import org.springframework.stereotype.Service;

/**
 * 交易管理（仅管理员可删除）
 */
@Slf4j
@Service
public class TransactionAdminService {

    private final ITransactionStore transactionStore;

    public TransactionAdminService(ITransactionStore transactionStore) {
        this.transactionStore = transactionStore;
    }

    /**
     * 删除交易
     *
     * @param transactionId 交易ID
     * @param userRole 当前操作员角色（由认证模块提供）
     * @throws AccessDeniedException 非管理员
     * @throws TransactionNotFoundException 交易不存在
     */
    public void deleteTransaction(String transactionId, String userRole) {
        if (OperatorRole.fromCode(userRole) != OperatorRole.ADMIN) {
            log.warn("[删除交易被拒] 权限不足, transactionId={}, userRole={}", transactionId, userRole);
            throw new AccessDeniedException("Only administrators can delete transactions");
        }
        if (!transactionStore.deleteTransaction(transactionId)) {
            throw new TransactionNotFoundException(transactionId);
        }
        log.info("[交易已删除] transactionId={}, userRole={}", transactionId, userRole);
    }
}
