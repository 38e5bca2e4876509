package chunkstore.server.sql;

public class SqliteCommands implements SqlSupplier {

    @Override
    public String putCommand(String table) {
        return "INSERT OR REPLACE INTO " + table + " (k, v) VALUES(?, ?);";
    }

    @Override
    public String getByteArrayType() {
        return "blob";
    }
}
