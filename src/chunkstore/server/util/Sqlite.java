package chunkstore.server.util;

import org.sqlite.*;

import java.sql.*;
import java.util.*;
import java.util.concurrent.*;

public class Sqlite {

    public static Connection build(String dbPath) throws SQLException {
        String url = "jdbc:sqlite:"+dbPath;
        SQLiteConfig config = new SQLiteConfig();
        if (! dbPath.equals(":memory:"))
            config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        config.setSynchronous(SQLiteConfig.SynchronousMode.FULL);
        SQLiteDataSource dc = new SQLiteDataSource(config);
        dc.setUrl(url);

        Connection conn = dc.getConnection();
        conn.setAutoCommit(true);
        return conn;
    }

    public static String getDbPath(Args a, String type) {
        String sqlFile = a.getArg(type);
        return sqlFile.equals(":memory:") ? sqlFile : a.fromStoreDir(type).toString();
    }

    /** A view of a shared connection that ignores close, so callers can use try-with-resources on it.
     */
    public static class UncloseableConnection implements Connection {

        private final Connection target;

        public UncloseableConnection(Connection target) {
            this.target = target;
        }

        @Override
        public Statement createStatement() throws SQLException {
            return target.createStatement();
        }

        @Override
        public PreparedStatement prepareStatement(String sql) throws SQLException {
            return target.prepareStatement(sql);
        }

        @Override
        public CallableStatement prepareCall(String sql) throws SQLException {
            return target.prepareCall(sql);
        }

        @Override
        public String nativeSQL(String sql) throws SQLException {
            return target.nativeSQL(sql);
        }

        @Override
        public void setAutoCommit(boolean autoCommit) throws SQLException {
            target.setAutoCommit(autoCommit);
        }

        @Override
        public boolean getAutoCommit() throws SQLException {
            return target.getAutoCommit();
        }

        @Override
        public void commit() throws SQLException {
            target.commit();
        }

        @Override
        public void rollback() throws SQLException {
            target.rollback();
        }

        @Override
        public void close() {
            // the shared connection is closed by its owner
        }

        @Override
        public boolean isClosed() throws SQLException {
            return target.isClosed();
        }

        @Override
        public DatabaseMetaData getMetaData() throws SQLException {
            return target.getMetaData();
        }

        @Override
        public void setReadOnly(boolean readOnly) throws SQLException {
            target.setReadOnly(readOnly);
        }

        @Override
        public boolean isReadOnly() throws SQLException {
            return target.isReadOnly();
        }

        @Override
        public void setCatalog(String catalog) throws SQLException {
            target.setCatalog(catalog);
        }

        @Override
        public String getCatalog() throws SQLException {
            return target.getCatalog();
        }

        @Override
        public void setTransactionIsolation(int level) throws SQLException {
            target.setTransactionIsolation(level);
        }

        @Override
        public int getTransactionIsolation() throws SQLException {
            return target.getTransactionIsolation();
        }

        @Override
        public SQLWarning getWarnings() throws SQLException {
            return target.getWarnings();
        }

        @Override
        public void clearWarnings() throws SQLException {
            target.clearWarnings();
        }

        @Override
        public Statement createStatement(int resultSetType, int concurrency) throws SQLException {
            return target.createStatement(resultSetType, concurrency);
        }

        @Override
        public PreparedStatement prepareStatement(String sql, int resultSetType, int concurrency) throws SQLException {
            return target.prepareStatement(sql, resultSetType, concurrency);
        }

        @Override
        public CallableStatement prepareCall(String sql, int resultSetType, int concurrency) throws SQLException {
            return target.prepareCall(sql, resultSetType, concurrency);
        }

        @Override
        public Map<String, Class<?>> getTypeMap() throws SQLException {
            return target.getTypeMap();
        }

        @Override
        public void setTypeMap(Map<String, Class<?>> map) throws SQLException {
            target.setTypeMap(map);
        }

        @Override
        public void setHoldability(int holdability) throws SQLException {
            target.setHoldability(holdability);
        }

        @Override
        public int getHoldability() throws SQLException {
            return target.getHoldability();
        }

        @Override
        public Savepoint setSavepoint() throws SQLException {
            return target.setSavepoint();
        }

        @Override
        public Savepoint setSavepoint(String name) throws SQLException {
            return target.setSavepoint(name);
        }

        @Override
        public void rollback(Savepoint savepoint) throws SQLException {
            target.rollback(savepoint);
        }

        @Override
        public void releaseSavepoint(Savepoint savepoint) throws SQLException {
            target.releaseSavepoint(savepoint);
        }

        @Override
        public Statement createStatement(int resultSetType, int concurrency, int holdability) throws SQLException {
            return target.createStatement(resultSetType, concurrency, holdability);
        }

        @Override
        public PreparedStatement prepareStatement(String sql, int resultSetType, int concurrency, int holdability) throws SQLException {
            return target.prepareStatement(sql, resultSetType, concurrency, holdability);
        }

        @Override
        public CallableStatement prepareCall(String sql, int resultSetType, int concurrency, int holdability) throws SQLException {
            return target.prepareCall(sql, resultSetType, concurrency, holdability);
        }

        @Override
        public PreparedStatement prepareStatement(String sql, int autoGeneratedKeys) throws SQLException {
            return target.prepareStatement(sql, autoGeneratedKeys);
        }

        @Override
        public PreparedStatement prepareStatement(String sql, int[] columnIndexes) throws SQLException {
            return target.prepareStatement(sql, columnIndexes);
        }

        @Override
        public PreparedStatement prepareStatement(String sql, String[] columnNames) throws SQLException {
            return target.prepareStatement(sql, columnNames);
        }

        @Override
        public Clob createClob() throws SQLException {
            return target.createClob();
        }

        @Override
        public Blob createBlob() throws SQLException {
            return target.createBlob();
        }

        @Override
        public NClob createNClob() throws SQLException {
            return target.createNClob();
        }

        @Override
        public SQLXML createSQLXML() throws SQLException {
            return target.createSQLXML();
        }

        @Override
        public boolean isValid(int timeout) throws SQLException {
            return target.isValid(timeout);
        }

        @Override
        public void setClientInfo(String name, String value) throws SQLClientInfoException {
            target.setClientInfo(name, value);
        }

        @Override
        public void setClientInfo(Properties properties) throws SQLClientInfoException {
            target.setClientInfo(properties);
        }

        @Override
        public String getClientInfo(String name) throws SQLException {
            return target.getClientInfo(name);
        }

        @Override
        public Properties getClientInfo() throws SQLException {
            return target.getClientInfo();
        }

        @Override
        public Array createArrayOf(String typeName, Object[] elements) throws SQLException {
            return target.createArrayOf(typeName, elements);
        }

        @Override
        public Struct createStruct(String typeName, Object[] attributes) throws SQLException {
            return target.createStruct(typeName, attributes);
        }

        @Override
        public void setSchema(String schema) throws SQLException {
            target.setSchema(schema);
        }

        @Override
        public String getSchema() throws SQLException {
            return target.getSchema();
        }

        @Override
        public void abort(Executor executor) throws SQLException {
            target.abort(executor);
        }

        @Override
        public void setNetworkTimeout(Executor executor, int millis) throws SQLException {
            target.setNetworkTimeout(executor, millis);
        }

        @Override
        public int getNetworkTimeout() throws SQLException {
            return target.getNetworkTimeout();
        }

        @Override
        public <T> T unwrap(Class<T> type) throws SQLException {
            return target.unwrap(type);
        }

        @Override
        public boolean isWrapperFor(Class<?> type) throws SQLException {
            return target.isWrapperFor(type);
        }
    }
}
