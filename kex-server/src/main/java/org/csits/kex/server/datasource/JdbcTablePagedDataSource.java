package org.csits.kex.server.datasource;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.csits.kex.server.dto.ExportDataQuery;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * 基于数据库表的数据源，使用 LIMIT/OFFSET 分页，行以有序 Map 返回。
 */
@Slf4j
public class JdbcTablePagedDataSource extends AbstractPagedDataSource {

    private static final Pattern IDENTIFIER =
        Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");

    private final JdbcTemplate jdbcTemplate;

    private final String table;

    private final List<String> columns;

    private final String idColumn;

    private final String orderBy;

    public JdbcTablePagedDataSource(ExportDataQuery query, JdbcTemplate jdbcTemplate, String table,
                                    List<String> columns, String idColumn, String orderBy) {
        super(query);
        this.jdbcTemplate = jdbcTemplate;
        this.table = requireIdentifier(table);
        this.columns = new ArrayList<>();
        if (columns != null) {
            for (String column : columns) {
                this.columns.add(requireIdentifier(column));
            }
        }
        this.idColumn = idColumn != null ? requireIdentifier(idColumn) : null;
        this.orderBy = orderBy != null ? requireIdentifier(orderBy) : this.idColumn;
    }

    public static boolean isIdentifier(String name) {
        return name != null && IDENTIFIER.matcher(name).matches();
    }

    @Override
    protected List<?> fetchPage(int skip, int take) {
        List<Object> args = new ArrayList<>();
        StringBuilder sql = new StringBuilder("SELECT ")
            .append(columns.isEmpty() ? "*" : String.join(", ", columns))
            .append(" FROM ").append(table);
        appendWhere(sql, args);
        if (orderBy != null) {
            sql.append(" ORDER BY ").append(orderBy);
        }
        sql.append(" LIMIT ? OFFSET ?");
        args.add(take);
        args.add(skip);
        log.debug("分页查询 table={}, skip={}, take={}", table, skip, take);
        return jdbcTemplate.queryForList(sql.toString(), args.toArray());
    }

    @Override
    protected long countTotal() {
        List<Object> args = new ArrayList<>();
        StringBuilder sql = new StringBuilder("SELECT COUNT(*) FROM ").append(table);
        appendWhere(sql, args);
        Long count = jdbcTemplate.queryForObject(sql.toString(), Long.class, args.toArray());
        return count != null ? count : 0;
    }

    private void appendWhere(StringBuilder sql, List<Object> args) {
        List<String> objectIds = query.getObjectIds();
        if (idColumn == null || objectIds == null || objectIds.isEmpty()) {
            return;
        }
        sql.append(" WHERE CAST(").append(idColumn).append(" AS VARCHAR) IN (");
        for (int i = 0; i < objectIds.size(); i++) {
            sql.append(i == 0 ? "?" : ", ?");
            args.add(objectIds.get(i));
        }
        sql.append(")");
    }

    private static String requireIdentifier(String name) {
        if (!isIdentifier(name)) {
            throw new IllegalArgumentException("非法的表名或列名: " + name);
        }
        return name;
    }
}
