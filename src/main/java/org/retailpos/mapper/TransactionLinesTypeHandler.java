package org.retailpos.mapper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.ibatis.type.BaseTypeHandler;
import org.apache.ibatis.type.JdbcType;
import org.retailpos.domain.TransactionLine;

import java.sql.CallableStatement;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Collections;
import java.util.List;

/**
 * 交易行 JSON 列映射：List&lt;TransactionLine&gt; &lt;-&gt; VARCHAR/TEXT
 */
public class TransactionLinesTypeHandler extends BaseTypeHandler<List<TransactionLine>> {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<TransactionLine>> LINES_TYPE = new TypeReference<>() {
    };

    @Override
    public void setNonNullParameter(PreparedStatement ps, int i, List<TransactionLine> parameter,
                                    JdbcType jdbcType) throws SQLException {
        try {
            ps.setString(i, MAPPER.writeValueAsString(parameter));
        } catch (JsonProcessingException e) {
            throw new SQLException("交易行序列化失败: " + e.getMessage(), e);
        }
    }

    @Override
    public List<TransactionLine> getNullableResult(ResultSet rs, String columnName) throws SQLException {
        return parse(rs.getString(columnName));
    }

    @Override
    public List<TransactionLine> getNullableResult(ResultSet rs, int columnIndex) throws SQLException {
        return parse(rs.getString(columnIndex));
    }

    @Override
    public List<TransactionLine> getNullableResult(CallableStatement cs, int columnIndex) throws SQLException {
        return parse(cs.getString(columnIndex));
    }

    private List<TransactionLine> parse(String json) throws SQLException {
        if (json == null || json.isBlank()) {
            return Collections.emptyList();
        }
        try {
            return List.copyOf(MAPPER.readValue(json, LINES_TYPE));
        } catch (JsonProcessingException e) {
            throw new SQLException("交易行反序列化失败: " + e.getMessage(), e);
        }
    }
}
