package com.eidos.core.persistence;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.HashMap;
import java.util.Map;

/**
 * Per-connection cache of {@link TableSchema}s. Each table is introspected once
 * per connection; create a new registry when opening a new connection.
 */
public class SchemaRegistry {

    private final Connection connection;
    private final Map<String, TableSchema> schemas = new HashMap<>();

    public SchemaRegistry(Connection connection) {
        this.connection = connection;
    }

    public TableSchema schema(String table) throws SQLException {
        TableSchema cached = schemas.get(table);
        if (cached != null) return cached;
        TableSchema schema = TableSchema.introspect(connection, table);
        schemas.put(table, schema);
        return schema;
    }

    public TableSchema schema(DistillationTable table) throws SQLException {
        return schema(table.tableName());
    }
}
