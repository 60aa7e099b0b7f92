package com.farmerworking.filters.in.java.api;

import com.farmerworking.filters.in.java.api.impl.LogImpl;
import com.farmerworking.filters.in.java.common.DoubleHashing;
import com.farmerworking.filters.in.java.common.IDoubleHashing;
import com.farmerworking.filters.in.java.common.IHash;
import lombok.Data;

@Data
public class Options {
    public static final long DEFAULT_SEED = 0x1234567890L;

    // Seed of every hash computed by the structure. Two structures must share
    // the same seed (and hash library) to be compared or subtracted.
    //
    // Default: 0x1234567890
    private long seed = DEFAULT_SEED;

    // Hash library the structure hashes elements with. Tests swap in stubs
    // here to make hashing fully predictable.
    //
    // Default: murmur3
    private IHash hash = IHash.getDefaultImpl();

    // Number of recurrence steps the distinct index generator may take with
    // one seed before it gives up on the cycle and reseeds. Zero or negative
    // means "the size of the index range".
    //
    // Default: 0
    private int distinctIndexAttempts = 0;

    // Number of reseeds the distinct index generator may go through before it
    // fails with an IllegalStateException.
    //
    // Default: 100
    private int distinctIndexReseeds = DoubleHashing.DEFAULT_MAX_RESEEDS;

    // Any noteworthy event (full filter, failed decode, rejected snapshot) is
    // written here. Set to null to disable.
    private Logger infoLog = new LogImpl("com.farmerworking.filters");

    public Options() {}

    public Options(Options options) {
        this.seed = options.seed;
        this.hash = options.hash;
        this.distinctIndexAttempts = options.distinctIndexAttempts;
        this.distinctIndexReseeds = options.distinctIndexReseeds;
        this.infoLog = options.infoLog;
    }

    public IDoubleHashing newDoubleHashing() {
        return new DoubleHashing(hash, distinctIndexAttempts, distinctIndexReseeds);
    }

    public interface Logger {
        void log(String msg, String... args);

        static void log(Logger logger, String msg, String... args) {
            if (logger != null) {
                logger.log(msg, args);
            }
        }
    }
}
