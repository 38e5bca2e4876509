package chunkstore.server.localstore;

import chunkstore.server.shed.*;
import chunkstore.shared.storage.*;

public class ShedBinIdSequencer implements BinIdSequencer {

    private final Uint64Vector binIds;

    public ShedBinIdSequencer(Uint64Vector binIds) {
        this.binIds = binIds;
    }

    @Override
    public synchronized long nextBinId(int bin) {
        try {
            return binIds.inc(bin);
        } catch (StorageEngineException e) {
            throw new BinIdSequencerException(bin, e);
        }
    }

    @Override
    public long currentBinId(int bin) {
        return binIds.get(bin);
    }
}
