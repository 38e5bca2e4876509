package chunkstore.server.tests;

import chunkstore.server.util.*;
import org.junit.*;

import java.sql.*;

public class SqliteTests {

    @Test
    public void closingSharedConnectionKeepsItOpen() throws SQLException {
        Connection raw = Sqlite.build(":memory:");
        try {
            Connection shared = new Sqlite.UncloseableConnection(raw);
            try (Connection conn = shared;
                 Statement stmt = conn.createStatement()) {
                stmt.executeUpdate("CREATE TABLE t (k INTEGER PRIMARY KEY)");
            }
            Assert.assertFalse(shared.isClosed());
            try (PreparedStatement insert = shared.prepareStatement("INSERT INTO t (k) VALUES (?)")) {
                insert.setInt(1, 7);
                insert.executeUpdate();
            }
            try (Statement stmt = raw.createStatement();
                 ResultSet rs = stmt.executeQuery("SELECT k FROM t")) {
                Assert.assertTrue(rs.next());
                Assert.assertEquals(7, rs.getInt(1));
            }
        } finally {
            raw.close();
        }
        Assert.assertTrue(new Sqlite.UncloseableConnection(raw).isClosed());
    }
}
