package chunkstore.server.shed;

import chunkstore.server.sql.*;
import chunkstore.server.util.*;
import chunkstore.shared.storage.*;
import chunkstore.shared.util.*;

import java.sql.*;
import java.util.*;
import java.util.function.*;
import java.util.logging.*;

/** An {@link OrderedStore} in a single sql table. SQLite compares blobs with memcmp, which gives the key order.
 */
public class JdbcOrderedStore implements OrderedStore {

    private static final Logger LOG = Logging.LOG();
    private static final String TABLE = "chunkindex";

    private final Supplier<Connection> conn;
    private final SqlSupplier commands;
    private final Optional<Connection> owned;

    public JdbcOrderedStore(Supplier<Connection> conn, SqlSupplier commands) {
        this(conn, commands, Optional.empty());
    }

    private JdbcOrderedStore(Supplier<Connection> conn, SqlSupplier commands, Optional<Connection> owned) {
        this.conn = conn;
        this.commands = commands;
        this.owned = owned;
        init(commands);
    }

    /** Open a sqlite file (or :memory:) which is closed with this store.
     */
    public static JdbcOrderedStore build(String sqlFile) {
        try {
            Connection raw = Sqlite.build(sqlFile);
            Connection db = new Sqlite.UncloseableConnection(raw);
            return new JdbcOrderedStore(() -> db, new SqliteCommands(), Optional.of(raw));
        } catch (SQLException sqe) {
            throw new StorageEngineException("Couldn't open " + sqlFile, sqe);
        }
    }

    private Connection getConnection() {
        return getConnection(true);
    }

    private Connection getConnection(boolean autocommit) {
        Connection connection = conn.get();
        try {
            connection.setAutoCommit(autocommit);
            return connection;
        } catch (SQLException e) {
            throw new StorageEngineException(e.getMessage(), e);
        }
    }

    private synchronized void init(SqlSupplier commands) {
        try (Connection conn = getConnection()) {
            commands.createTable(commands.createOrderedStoreTableCommand(TABLE), conn);
        } catch (SQLException sqe) {
            throw new StorageEngineException("Couldn't create " + TABLE, sqe);
        }
    }

    private static StorageEngineException fail(SQLException sqe) {
        LOG.log(Level.WARNING, sqe.getMessage(), sqe);
        return new StorageEngineException(sqe.getMessage(), sqe);
    }

    @Override
    public synchronized Optional<byte[]> get(byte[] key) {
        try (Connection conn = getConnection();
             PreparedStatement stmt = conn.prepareStatement(commands.getCommand(TABLE))) {
            stmt.setBytes(1, key);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next())
                    return Optional.of(rs.getBytes(1));
                return Optional.empty();
            }
        } catch (SQLException sqe) {
            throw fail(sqe);
        }
    }

    @Override
    public synchronized void write(Batch batch) {
        if (batch.isEmpty())
            return;
        try (Connection conn = getConnection(false);
             PreparedStatement put = conn.prepareStatement(commands.putCommand(TABLE));
             PreparedStatement delete = conn.prepareStatement(commands.deleteCommand(TABLE))) {
            try {
                for (Batch.Op op : batch.ops()) {
                    if (op.isDelete()) {
                        delete.setBytes(1, op.key);
                        delete.executeUpdate();
                    } else {
                        put.setBytes(1, op.key);
                        put.setBytes(2, op.value());
                        put.executeUpdate();
                    }
                }
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (SQLException sqe) {
            throw fail(sqe);
        }
    }

    private static byte[] lowerBound(Optional<byte[]> startFrom, byte[] prefix) {
        return startFrom.filter(s -> ArrayOps.compareUnsigned(s, prefix) > 0).orElse(prefix);
    }

    private static void setRange(PreparedStatement stmt, byte[] lower, Optional<byte[]> upper) throws SQLException {
        stmt.setBytes(1, lower);
        if (upper.isPresent())
            stmt.setBytes(2, upper.get());
    }

    @Override
    public synchronized void iterate(Optional<byte[]> startFrom, byte[] prefix, Function<Pair<byte[], byte[]>, Boolean> visitor) {
        Optional<byte[]> upper = ArrayOps.prefixUpperBound(prefix);
        try (Connection conn = getConnection();
             PreparedStatement stmt = conn.prepareStatement(commands.rangeCommand(TABLE, upper.isPresent()))) {
            setRange(stmt, lowerBound(startFrom, prefix), upper);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    if (visitor.apply(new Pair<>(rs.getBytes(1), rs.getBytes(2))))
                        return;
                }
            }
        } catch (SQLException sqe) {
            throw fail(sqe);
        }
    }

    @Override
    public synchronized Optional<Pair<byte[], byte[]>> last(byte[] prefix) {
        Optional<byte[]> upper = ArrayOps.prefixUpperBound(prefix);
        try (Connection conn = getConnection();
             PreparedStatement stmt = conn.prepareStatement(commands.lastInRangeCommand(TABLE, upper.isPresent()))) {
            setRange(stmt, prefix, upper);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next())
                    return Optional.of(new Pair<>(rs.getBytes(1), rs.getBytes(2)));
                return Optional.empty();
            }
        } catch (SQLException sqe) {
            throw fail(sqe);
        }
    }

    @Override
    public synchronized long count(byte[] prefix) {
        Optional<byte[]> upper = ArrayOps.prefixUpperBound(prefix);
        try (Connection conn = getConnection();
             PreparedStatement stmt = conn.prepareStatement(commands.countInRangeCommand(TABLE, upper.isPresent()))) {
            setRange(stmt, prefix, upper);
            try (ResultSet rs = stmt.executeQuery()) {
                rs.next();
                return rs.getLong(1);
            }
        } catch (SQLException sqe) {
            throw fail(sqe);
        }
    }

    @Override
    public synchronized void close() {
        if (owned.isEmpty())
            return;
        try {
            owned.get().close();
        } catch (SQLException sqe) {
            throw fail(sqe);
        }
    }
}
