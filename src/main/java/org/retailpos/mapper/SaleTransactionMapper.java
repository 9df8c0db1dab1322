package org.retailpos.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import org.apache.ibatis.annotations.Mapper;
import org.retailpos.domain.SaleTransaction;

@Mapper
public interface SaleTransactionMapper extends BaseMapper<SaleTransaction> {
}
