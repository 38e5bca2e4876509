package chunkstore.server.sql;

import java.sql.*;

public interface SqlSupplier {

    String getByteArrayType();

    /** Insert a key value pair, replacing any existing value for the key. */
    String putCommand(String table);

    default String createOrderedStoreTableCommand(String table) {
        return "CREATE TABLE IF NOT EXISTS " + table + " (k " + getByteArrayType() + " primary key not null, " +
                "v " + getByteArrayType() + " not null);";
    }

    default String getCommand(String table) {
        return "SELECT v FROM " + table + " WHERE k = ?;";
    }

    default String deleteCommand(String table) {
        return "DELETE FROM " + table + " WHERE k = ?;";
    }

    default String rangeCommand(String table, boolean bounded) {
        return "SELECT k, v FROM " + table + " WHERE k >= ?" + (bounded ? " AND k < ?" : "") + " ORDER BY k ASC;";
    }

    default String lastInRangeCommand(String table, boolean bounded) {
        return "SELECT k, v FROM " + table + " WHERE k >= ?" + (bounded ? " AND k < ?" : "") + " ORDER BY k DESC LIMIT 1;";
    }

    default String countInRangeCommand(String table, boolean bounded) {
        return "SELECT COUNT(*) FROM " + table + " WHERE k >= ?" + (bounded ? " AND k < ?" : "") + ";";
    }

    default void createTable(String sqlTableCreate, Connection conn) throws SQLException {
        Statement createStmt = conn.createStatement();
        createStmt.executeUpdate(sqlTableCreate);
        createStmt.close();
    }
}
