package org.retailpos.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Update;
import org.retailpos.domain.InventoryApplyLog;

@Mapper
public interface InventoryApplyLogMapper extends BaseMapper<InventoryApplyLog> {

    /**
     * 更新对账重试结果，尝试次数加一
     *
     * @param id 日志ID
     * @param status 新状态
     * @param stockBefore 扣减前库存
     * @param stockAfter 扣减后库存
     * @param errorMessage 错误信息（成功时为空）
     * @return 更新行数
     */
    @Update("""
            UPDATE inventory_apply_log
            SET status = #{status},
                stock_before = #{stockBefore},
                stock_after = #{stockAfter},
                error_message = #{errorMessage},
                attempt_count = attempt_count + 1,
                update_time = now()
            WHERE id = #{id}
            """)
    int updateAttempt(@Param("id") Long id,
                      @Param("status") String status,
                      @Param("stockBefore") Integer stockBefore,
                      @Param("stockAfter") Integer stockAfter,
                      @Param("errorMessage") String errorMessage);
}
