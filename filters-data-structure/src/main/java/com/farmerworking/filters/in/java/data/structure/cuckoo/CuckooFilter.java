package com.farmerworking.filters.in.java.data.structure.cuckoo;

import com.farmerworking.filters.in.java.api.Exportable;
import com.farmerworking.filters.in.java.api.Options;
import com.farmerworking.filters.in.java.api.WritableFilter;
import com.farmerworking.filters.in.java.common.ByteUtils;
import com.farmerworking.filters.in.java.common.IHash;
import com.farmerworking.filters.in.java.common.Status;
import com.google.common.collect.Lists;
import com.google.common.math.IntMath;
import com.google.common.primitives.Longs;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import lombok.Data;
import org.apache.commons.lang3.tuple.Pair;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Cuckoo filter: every element is reduced to a short fingerprint stored in one
 * of two candidate buckets. When both are full, resident fingerprints are
 * evicted to their alternate bucket, up to maxKicks times.
 *
 * <p>The bucket count is always a power of two, so the alternate bucket of the
 * alternate bucket is the original one and a relocated fingerprint can always
 * be found again.
 *
 * <p>Not thread safe.
 */
public class CuckooFilter implements WritableFilter<String>, Exportable {
    public static final String TYPE = "CuckooFilter";
    public static final int DEFAULT_BUCKET_SIZE = 4;
    public static final int DEFAULT_MAX_KICKS = 500;
    // Load factor a filter with 4-slot buckets reaches before insertions start failing.
    static final double LOAD_FACTOR = 0.955;

    private final Bucket[] filter;
    private final int size;
    private final int bucketSize;
    private final int fingerprintLength;
    private final int maxKicks;
    private final Options options;
    private final IHash hash;
    private int length;
    private Random random;

    public CuckooFilter(int size, int fingerprintLength, int bucketSize) {
        this(size, fingerprintLength, bucketSize, DEFAULT_MAX_KICKS);
    }

    public CuckooFilter(int size, int fingerprintLength, int bucketSize, int maxKicks) {
        this(size, fingerprintLength, bucketSize, maxKicks, new Options());
    }

    /**
     * @param size              requested number of buckets, rounded up to the next power of two
     * @param fingerprintLength fingerprint length in bits, in [1, 64]
     * @param bucketSize        number of fingerprints per bucket
     * @param maxKicks          maximum number of relocations tried by one insertion
     */
    public CuckooFilter(int size, int fingerprintLength, int bucketSize, int maxKicks, Options options) {
        checkArgument(size > 0, "size should be positive: %s", size);
        checkArgument(size <= (1 << 30), "size too large: %s", size);
        checkArgument(fingerprintLength > 0 && fingerprintLength <= 64,
                "fingerprint length should be in [1, 64]: %s", fingerprintLength);
        checkArgument(bucketSize > 0, "bucket size should be positive: %s", bucketSize);
        checkArgument(maxKicks >= 0, "max kicks should not be negative: %s", maxKicks);

        this.size = IntMath.ceilingPowerOfTwo(size);
        this.fingerprintLength = fingerprintLength;
        this.bucketSize = bucketSize;
        this.maxKicks = maxKicks;
        this.options = new Options(options);
        this.hash = this.options.getHash();
        this.random = new Random(this.options.getSeed());
        this.length = 0;

        this.filter = new Bucket[this.size];
        for (int i = 0; i < this.size; i++) {
            this.filter[i] = new Bucket(bucketSize);
        }
    }

    public static CuckooFilter create(int expectedItems, double errorRate) {
        return create(expectedItems, errorRate, DEFAULT_BUCKET_SIZE, DEFAULT_MAX_KICKS, new Options());
    }

    public static CuckooFilter create(int expectedItems, double errorRate, Options options) {
        return create(expectedItems, errorRate, DEFAULT_BUCKET_SIZE, DEFAULT_MAX_KICKS, options);
    }

    // Sizes a filter so that expectedItems elements fit with a false positive
    // rate close to errorRate.
    public static CuckooFilter create(int expectedItems, double errorRate, int bucketSize, int maxKicks, Options options) {
        checkArgument(expectedItems > 0, "expected items should be positive: %s", expectedItems);
        checkArgument(errorRate > 0 && errorRate < 1, "error rate should be in (0, 1): %s", errorRate);
        checkArgument(bucketSize > 0, "bucket size should be positive: %s", bucketSize);

        int fingerprintLength = (int) Math.ceil(log2(1 / errorRate) + log2(2 * bucketSize));
        int buckets = (int) Math.ceil(expectedItems / (double) bucketSize / LOAD_FACTOR);
        return new CuckooFilter(buckets, fingerprintLength, bucketSize, maxKicks, options);
    }

    public static CuckooFilter from(Iterable<String> items, double errorRate) {
        return from(items, errorRate, new Options());
    }

    // Builds a filter sized for items and inserts all of them. Throws
    // IllegalStateException if one of them cannot be stored.
    public static CuckooFilter from(Iterable<String> items, double errorRate, Options options) {
        List<String> list = Lists.newArrayList(items);
        CuckooFilter filter = create(Math.max(1, list.size()), errorRate, options);
        for (String item : list) {
            filter.add(item, true, false);
        }
        return filter;
    }

    @Override
    public boolean add(String element) {
        return add(ByteUtils.toBytes(element), false, false);
    }

    public boolean add(String element, boolean throwOnFull, boolean destructive) {
        return add(ByteUtils.toBytes(element), throwOnFull, destructive);
    }

    /**
     * Inserts an element, relocating resident fingerprints when both candidate
     * buckets are full.
     *
     * @param throwOnFull throw IllegalStateException instead of returning false
     *                    when the element cannot be stored
     * @param destructive keep the relocations of a failed insertion instead of
     *                    rolling them back. The filter may then lose one of the
     *                    elements it already held.
     * @return false if the filter is full
     */
    public boolean add(byte[] element, boolean throwOnFull, boolean destructive) {
        Locations locations = locations(element);
        long fingerprint = locations.getFingerprint();

        if (filter[locations.getFirstIndex()].add(fingerprint) || filter[locations.getSecondIndex()].add(fingerprint)) {
            length++;
            return true;
        }

        List<Kick> kicks = new ArrayList<>();
        int index = random.nextBoolean() ? locations.getFirstIndex() : locations.getSecondIndex();
        long moving = fingerprint;
        for (int i = 0; i < maxKicks; i++) {
            int slot = random.nextInt(bucketSize);
            Long evicted = filter[index].swap(slot, moving);
            kicks.add(new Kick(index, slot, evicted));

            moving = evicted;
            index = alternateIndex(index, moving);
            if (filter[index].add(moving)) {
                length++;
                return true;
            }
        }

        if (!destructive) {
            for (Kick kick : Lists.reverse(kicks)) {
                filter[kick.getBucket()].swap(kick.getSlot(), kick.getPrevious());
            }
        }

        String message = String.format("cuckoo filter is full after %d kicks", maxKicks);
        Options.Logger.log(options.getInfoLog(), message,
                String.valueOf(length), destructive ? "destructive" : "rolled back");
        if (throwOnFull) {
            throw new IllegalStateException(message);
        }
        return false;
    }

    @Override
    public boolean remove(String element) {
        return remove(ByteUtils.toBytes(element));
    }

    public boolean remove(byte[] element) {
        Locations locations = locations(element);
        long fingerprint = locations.getFingerprint();
        if (filter[locations.getFirstIndex()].remove(fingerprint) || filter[locations.getSecondIndex()].remove(fingerprint)) {
            length--;
            return true;
        }
        return false;
    }

    @Override
    public boolean has(String element) {
        return has(ByteUtils.toBytes(element));
    }

    public boolean has(byte[] element) {
        Locations locations = locations(element);
        long fingerprint = locations.getFingerprint();
        return filter[locations.getFirstIndex()].has(fingerprint) || filter[locations.getSecondIndex()].has(fingerprint);
    }

    // Expected false positive rate given the current load.
    public double rate() {
        double load = length / (double) fullSize();
        // 1 - (1 - 2^-f)^(2 * b * load), kept accurate for long fingerprints
        return -Math.expm1(2 * bucketSize * load * Math.log1p(-Math.pow(2, -fingerprintLength)));
    }

    public Locations locations(String element) {
        return locations(ByteUtils.toBytes(element));
    }

    // The fingerprint is the top fingerprintLength bits of the element hash,
    // the first bucket comes from its low bits.
    public Locations locations(byte[] element) {
        long h = hash.hash64(element, getSeed());
        long fingerprint = h >>> (64 - fingerprintLength);
        int firstIndex = (int) Long.remainderUnsigned(h, size);
        return new Locations(fingerprint, firstIndex, alternateIndex(firstIndex, fingerprint));
    }

    // alternateIndex(alternateIndex(i, f), f) == i
    public int alternateIndex(int index, long fingerprint) {
        long fingerprintHash = hash.hash32(Longs.toByteArray(fingerprint), getSeed()) & 0xFFFFFFFFL;
        return (int) Long.remainderUnsigned(index ^ fingerprintHash, size);
    }

    public void setSeed(long seed) {
        options.setSeed(seed);
        random = new Random(seed);
    }

    public long getSeed() {
        return options.getSeed();
    }

    // number of buckets
    public int getSize() {
        return size;
    }

    // number of fingerprint slots
    public int fullSize() {
        return size * bucketSize;
    }

    // number of stored fingerprints
    public int getLength() {
        return length;
    }

    public boolean isEmpty() {
        return length == 0;
    }

    public int getFingerprintLength() {
        return fingerprintLength;
    }

    public int getBucketSize() {
        return bucketSize;
    }

    public int getMaxKicks() {
        return maxKicks;
    }

    Bucket bucket(int index) {
        return filter[index];
    }

    @Override
    public JsonObject saveAsJSON() {
        JsonObject json = new JsonObject();
        json.addProperty("type", TYPE);
        json.addProperty("size", size);
        json.addProperty("bucketSize", bucketSize);
        json.addProperty("fingerprintLength", fingerprintLength);
        json.addProperty("length", length);
        json.addProperty("maxKicks", maxKicks);
        json.addProperty("seed", getSeed());

        JsonArray buckets = new JsonArray();
        for (Bucket bucket : filter) {
            JsonObject item = new JsonObject();
            item.addProperty("size", bucket.size());
            item.addProperty("length", bucket.length());
            JsonArray elements = new JsonArray();
            for (int i = 0; i < bucket.size(); i++) {
                Long fingerprint = bucket.at(i);
                if (fingerprint == null) {
                    elements.add(JsonNull.INSTANCE);
                } else {
                    elements.add(fingerprint);
                }
            }
            item.add("elements", elements);
            buckets.add(item);
        }
        json.add("filter", buckets);
        return json;
    }

    public static Pair<Status, CuckooFilter> fromJson(String json, Options options) {
        try {
            JsonElement element = JsonParser.parseString(json);
            if (!element.isJsonObject()) {
                return Pair.of(Status.Corruption("cuckoo filter snapshot is not a json object"), null);
            }
            return fromJSON(element.getAsJsonObject(), options);
        } catch (JsonParseException e) {
            return Pair.of(Status.Corruption("malformed cuckoo filter snapshot", e.getMessage()), null);
        }
    }

    public static Pair<Status, CuckooFilter> fromJSON(JsonObject json) {
        return fromJSON(json, new Options());
    }

    /**
     * Rebuilds a filter from {@link #saveAsJSON()}. The snapshot seed overrides
     * the seed of options, the hash library and logger of options are kept.
     *
     * <p>Only the table contents are restored. The kick generator is not part of
     * the snapshot: the imported filter restarts it from the seed, as a newly
     * built filter does. It picks the same kick victims as the exported filter
     * only if that one had never kicked.
     */
    public static Pair<Status, CuckooFilter> fromJSON(JsonObject json, Options options) {
        for (String field : Arrays.asList("type", "size", "bucketSize", "fingerprintLength", "length", "maxKicks", "seed", "filter")) {
            if (!json.has(field) || json.get(field).isJsonNull()) {
                return corruption(options, "cuckoo filter snapshot misses field", field);
            }
        }

        try {
            if (!TYPE.equals(json.get("type").getAsString())) {
                return corruption(options, "not a cuckoo filter snapshot", json.get("type").getAsString());
            }

            int size = json.get("size").getAsInt();
            int bucketSize = json.get("bucketSize").getAsInt();
            JsonArray buckets = json.getAsJsonArray("filter");
            if (Integer.bitCount(size) != 1 || buckets.size() != size) {
                return corruption(options, "bad cuckoo filter bucket count", String.valueOf(buckets.size()));
            }

            Options snapshotOptions = new Options(options);
            snapshotOptions.setSeed(json.get("seed").getAsLong());
            CuckooFilter result = new CuckooFilter(size, json.get("fingerprintLength").getAsInt(), bucketSize,
                    json.get("maxKicks").getAsInt(), snapshotOptions);

            int length = 0;
            for (int i = 0; i < size; i++) {
                JsonArray elements = buckets.get(i).getAsJsonObject().getAsJsonArray("elements");
                if (elements == null || elements.size() != bucketSize) {
                    return corruption(options, "bad cuckoo filter bucket", String.valueOf(i));
                }
                for (int j = 0; j < bucketSize; j++) {
                    JsonElement fingerprint = elements.get(j);
                    result.filter[i].load(j, fingerprint.isJsonNull() ? null : fingerprint.getAsLong());
                }
                length += result.filter[i].length();
            }

            if (length != json.get("length").getAsInt()) {
                return corruption(options, "cuckoo filter length mismatch", String.valueOf(length));
            }
            result.length = length;
            return Pair.of(Status.OK(), result);
        } catch (IllegalStateException | IllegalArgumentException | ClassCastException | UnsupportedOperationException e) {
            return corruption(options, "bad cuckoo filter snapshot", e.getMessage());
        }
    }

    private static Pair<Status, CuckooFilter> corruption(Options options, String msg, String detail) {
        Options.Logger.log(options.getInfoLog(), msg, detail);
        return Pair.of(Status.Corruption(msg, detail), null);
    }

    private static double log2(double x) {
        return Math.log(x) / Math.log(2);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CuckooFilter that = (CuckooFilter) o;
        return size == that.size &&
                bucketSize == that.bucketSize &&
                fingerprintLength == that.fingerprintLength &&
                length == that.length &&
                getSeed() == that.getSeed() &&
                Arrays.equals(filter, that.filter);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(filter);
        result = 31 * result + fingerprintLength;
        result = 31 * result + length;
        return result;
    }

    // one relocation, kept so a failed insertion can be undone
    @Data
    private static class Kick {
        private final int bucket;
        private final int slot;
        private final Long previous;
    }
}
