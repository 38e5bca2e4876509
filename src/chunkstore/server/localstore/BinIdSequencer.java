package chunkstore.server.localstore;

/** Issues the per bin sequence numbers that order the pull index.
 */
public interface BinIdSequencer {

    /**
     * @param bin
     * @return a bin id greater than every id previously issued for bin, durably recorded before returning
     * @throws chunkstore.shared.storage.BinIdSequencerException if the new id couldn't be persisted
     */
    long nextBinId(int bin);

    long currentBinId(int bin);
}
