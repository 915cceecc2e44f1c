package org.finos.legend.dsl.feed;

import org.finos.legend.dsl.execution.ColumnarTable;
import org.finos.legend.dsl.feature.Feature;
import org.finos.legend.dsl.frame.Source;
import org.finos.legend.dsl.parser.Visitor;
import org.finos.legend.dsl.transpiler.AnsiDialect;
import org.finos.legend.dsl.transpiler.SQLDialect;
import org.finos.legend.dsl.transpiler.SQLGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.Date;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reader executing generated SQL over a JDBC connection.
 *
 * The connection is owned by the caller and stays open. Results are fully
 * buffered into a {@link ColumnarTable}.
 */
public class JdbcReader extends Reader<String, String, ColumnarTable> {

    private static final Logger LOGGER = LoggerFactory.getLogger(JdbcReader.class);

    private final Connection connection;
    private final SQLDialect dialect;

    public JdbcReader(Connection connection, Map<? extends Source, String> sources,
                      Map<? extends Feature, String> features) {
        this(connection, sources, features, AnsiDialect.INSTANCE);
    }

    public JdbcReader(Connection connection, Map<? extends Source, String> sources,
                      Map<? extends Feature, String> features, SQLDialect dialect) {
        super(sources, features);
        this.connection = Objects.requireNonNull(connection, "Connection cannot be null");
        this.dialect = Objects.requireNonNull(dialect, "Dialect cannot be null");
    }

    @Override
    protected Visitor<String, String> parser(Map<Source, String> sources, Map<Feature, String> features) {
        return new SQLGenerator(sources, features, dialect);
    }

    @Override
    protected ColumnarTable read(String statement) {
        LOGGER.debug("Executing SQL query");
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery(statement)) {
            return buffer(rs);
        } catch (SQLException e) {
            throw new RuntimeException("Error executing query: " + statement, e);
        }
    }

    @Override
    protected List<List<Object>> format(ColumnarTable data) {
        return data.columns();
    }

    private static ColumnarTable buffer(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int columnCount = meta.getColumnCount();
        List<String> names = new ArrayList<>(columnCount);
        List<List<Object>> columns = new ArrayList<>(columnCount);
        for (int i = 1; i <= columnCount; i++) {
            names.add(meta.getColumnLabel(i));
            columns.add(new ArrayList<>());
        }
        while (rs.next()) {
            for (int i = 1; i <= columnCount; i++) {
                columns.get(i - 1).add(normalize(rs.getObject(i)));
            }
        }
        return ColumnarTable.ofColumns(names, columns);
    }

    /**
     * Converts JDBC values into the DSL native types.
     */
    private static Object normalize(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float f) {
            return f.doubleValue();
        }
        if (value instanceof Date date) {
            return date.toLocalDate();
        }
        if (value instanceof Timestamp timestamp) {
            return timestamp.toLocalDateTime();
        }
        return value;
    }
}
