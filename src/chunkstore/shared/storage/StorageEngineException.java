package chunkstore.shared.storage;

public class StorageEngineException extends RuntimeException {

    public StorageEngineException(String msg) {
        super(msg);
    }

    public StorageEngineException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
