package org.retailpos.service;

import com.baomidou.mybatisplus.extension.service.IService;
import org.retailpos.domain.SaleTransaction;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 交易存储
 * <p>
 * 不保证幂等：重复调用 createTransaction 会产生重复记录
 */
public interface ITransactionStore extends IService<SaleTransaction> {

    /**
     * 单次写入一条交易
     */
    SaleTransaction createTransaction(SaleTransaction transaction);

    /**
     * @throws org.retailpos.exception.TransactionNotFoundException 交易不存在
     */
    SaleTransaction getTransaction(String id);

    /**
     * 按时间区间查询，时间倒序；区间端点为空表示不限
     */
    List<SaleTransaction> listTransactions(LocalDateTime from, LocalDateTime to);

    /**
     * @return true: 已删除；false: 交易不存在
     */
    boolean deleteTransaction(String id);
}
