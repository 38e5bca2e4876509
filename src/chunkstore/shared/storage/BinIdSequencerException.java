package chunkstore.shared.storage;

public class BinIdSequencerException extends RuntimeException {

    public BinIdSequencerException(int bin, Throwable cause) {
        super("Couldn't allocate a bin id in bin " + bin + ": " + cause.getMessage(), cause);
    }
}
