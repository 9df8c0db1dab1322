package org.retailpos.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import lombok.extern.slf4j.Slf4j;
import org.retailpos.domain.SaleTransaction;
import org.retailpos.exception.TransactionNotFoundException;
import org.retailpos.mapper.SaleTransactionMapper;
import org.retailpos.service.ITransactionStore;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;

@Slf4j
@Service
public class TransactionStoreImpl extends ServiceImpl<SaleTransactionMapper, SaleTransaction>
        implements ITransactionStore {

    @Override
    public SaleTransaction createTransaction(SaleTransaction transaction) {
        baseMapper.insert(transaction);
        log.info("[交易已写入] transactionId={}, total={}, paymentMethod={}",
                transaction.getId(), transaction.getTotal(), transaction.getPaymentMethod());
        return transaction;
    }

    @Override
    public SaleTransaction getTransaction(String id) {
        SaleTransaction transaction = baseMapper.selectById(id);
        if (transaction == null) {
            throw new TransactionNotFoundException(id);
        }
        return transaction;
    }

    @Override
    public List<SaleTransaction> listTransactions(LocalDateTime from, LocalDateTime to) {
        LambdaQueryWrapper<SaleTransaction> queryWrapper = new LambdaQueryWrapper<>();
        queryWrapper.ge(from != null, SaleTransaction::getTimestamp, from)
                .le(to != null, SaleTransaction::getTimestamp, to)
                .orderByDesc(SaleTransaction::getTimestamp);
        return baseMapper.selectList(queryWrapper);
    }

    @Override
    public boolean deleteTransaction(String id) {
        return baseMapper.deleteById(id) > 0;
    }
}
