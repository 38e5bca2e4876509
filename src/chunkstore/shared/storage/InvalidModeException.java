package chunkstore.shared.storage;

public class InvalidModeException extends IllegalArgumentException {

    public InvalidModeException(String msg) {
        super(msg);
    }
}
