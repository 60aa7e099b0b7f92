package com.farmerworking.filters.in.java.data.structure.iblt;

import com.farmerworking.filters.in.java.api.Exportable;
import com.farmerworking.filters.in.java.api.Options;
import com.farmerworking.filters.in.java.api.WritableFilter;
import com.farmerworking.filters.in.java.common.ByteUtils;
import com.farmerworking.filters.in.java.common.IDoubleHashing;
import com.farmerworking.filters.in.java.common.Status;
import com.google.common.collect.Lists;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.apache.commons.lang3.tuple.Pair;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Invertible bloom lookup table. Every element is folded into hashCount
 * distinct cells. Subtracting the table of one set from the table of another
 * set and decoding the result lists the elements of their symmetric
 * difference, provided the difference is small compared to the table size.
 *
 * <p>Elements are UTF-8 strings which must not start with a NUL character:
 * leading zero bytes do not survive the xor sums.
 *
 * <p>Not thread safe.
 */
public class InvertibleBloomFilter implements WritableFilter<String>, Exportable {
    public static final String TYPE = "InvertibleBloomFilter";
    public static final int DEFAULT_HASH_COUNT = 3;
    public static final double DEFAULT_ALPHA = 2;

    private final int size;
    private final int hashCount;
    private final Cell[] elements;
    private final Options options;
    private final IDoubleHashing hashing;

    public InvertibleBloomFilter(int size) {
        this(size, DEFAULT_HASH_COUNT);
    }

    public InvertibleBloomFilter(int size, int hashCount) {
        this(size, hashCount, new Options());
    }

    public InvertibleBloomFilter(int size, int hashCount, Options options) {
        checkArgument(hashCount > 0, "hash count should be positive: %s", hashCount);
        checkArgument(size >= hashCount, "size %s should not be less than hash count %s", size, hashCount);

        this.size = size;
        this.hashCount = hashCount;
        this.options = new Options(options);
        this.hashing = this.options.newDoubleHashing();
        this.elements = new Cell[size];
        for (int i = 0; i < size; i++) {
            this.elements[i] = Cell.empty();
        }
    }

    public static InvertibleBloomFilter create(int differences) {
        return create(differences, DEFAULT_ALPHA, DEFAULT_HASH_COUNT, new Options());
    }

    /**
     * Sizes a table able to decode about differences elements.
     *
     * @param alpha     number of cells per expected difference
     * @param hashCount number of cells each element is mapped to. The size is
     *                  rounded up to a multiple of it.
     */
    public static InvertibleBloomFilter create(int differences, double alpha, int hashCount, Options options) {
        checkArgument(differences > 0, "differences should be positive: %s", differences);
        checkArgument(alpha > 0, "alpha should be positive: %s", alpha);
        checkArgument(hashCount > 0, "hash count should be positive: %s", hashCount);

        int size = Math.max(hashCount, (int) Math.ceil(differences * alpha));
        if (size % hashCount != 0) {
            size += hashCount - size % hashCount;
        }
        return new InvertibleBloomFilter(size, hashCount, options);
    }

    public static InvertibleBloomFilter from(Iterable<String> items, int size, int hashCount) {
        return from(items, size, hashCount, new Options());
    }

    public static InvertibleBloomFilter from(Iterable<String> items, int size, int hashCount, Options options) {
        InvertibleBloomFilter filter = new InvertibleBloomFilter(size, hashCount, options);
        for (String item : items) {
            filter.add(item);
        }
        return filter;
    }

    @Override
    public boolean add(String element) {
        byte[] id = toId(element);
        long hash = hashId(id);
        for (int index : indexes(id)) {
            elements[index].add(id, hash);
        }
        return true;
    }

    // Always succeeds: removing an element that was never added leaves
    // negative counts which decode lists as missing.
    @Override
    public boolean remove(String element) {
        byte[] id = toId(element);
        Cell cell = new Cell(id, hashId(id), 1);
        for (int index : indexes(id)) {
            elements[index] = elements[index].xorm(cell);
        }
        return true;
    }

    // false when one of the element cells is empty, or is pure with
    // another element in it.
    @Override
    public boolean has(String element) {
        byte[] id = toId(element);
        for (int index : indexes(id)) {
            Cell cell = elements[index];
            if (cell.getCount() == 0) {
                return false;
            }
            if (cell.getCount() == 1 && isCellPure(cell) && !Arrays.equals(cell.getIdSum(), id)) {
                return false;
            }
        }
        return true;
    }

    // A pure cell holds exactly one element, either added (count 1) or
    // removed (count -1).
    public boolean isCellPure(Cell cell) {
        return (cell.getCount() == 1 || cell.getCount() == -1) && hashId(cell.getIdSum()) == cell.getHashSum();
    }

    /**
     * this - other, cell by cell. Decoding the result yields the elements of
     * this only as additional and the elements of other only as missing.
     */
    public InvertibleBloomFilter substract(InvertibleBloomFilter other) {
        checkArgument(size == other.size, "size mismatch: %s vs %s", size, other.size);
        checkArgument(hashCount == other.hashCount, "hash count mismatch: %s vs %s", hashCount, other.hashCount);
        checkArgument(getSeed() == other.getSeed(), "seed mismatch: %s vs %s", getSeed(), other.getSeed());

        InvertibleBloomFilter result = new InvertibleBloomFilter(size, hashCount, options);
        for (int i = 0; i < size; i++) {
            result.elements[i] = elements[i].xorm(other.elements[i]);
        }
        return result;
    }

    public DecodeResult decode() {
        return decode(new ArrayList<>(), new ArrayList<>());
    }

    /**
     * Peels pure cells off the table until none is left. Decoded elements are
     * appended to additional or missing according to the sign of their count.
     *
     * <p>Destructive: the decoded elements are removed from this table. On
     * success the table is left empty, decoding it again yields nothing.
     */
    public DecodeResult decode(List<String> additional, List<String> missing) {
        Deque<Integer> pureCells = new ArrayDeque<>();
        for (int i = 0; i < size; i++) {
            if (isCellPure(elements[i])) {
                pureCells.add(i);
            }
        }

        int decoded = 0;
        while (!pureCells.isEmpty()) {
            int index = pureCells.poll();
            Cell cell = elements[index];
            // peeling an earlier cell may have changed this one
            if (!isCellPure(cell)) {
                continue;
            }

            byte[] id = cell.getIdSum();
            if (cell.getCount() > 0) {
                additional.add(ByteUtils.toString(id));
            } else {
                missing.add(ByteUtils.toString(id));
            }
            decoded++;

            Cell peeled = new Cell(id, cell.getHashSum(), cell.getCount());
            for (int i : indexes(id)) {
                elements[i] = elements[i].xorm(peeled);
                if (isCellPure(elements[i])) {
                    pureCells.add(i);
                }
            }
        }

        List<Cell> reason = new ArrayList<>();
        for (Cell cell : elements) {
            if (!cell.isEmpty()) {
                reason.add(cell.copy());
            }
        }

        if (!reason.isEmpty()) {
            Options.Logger.log(options.getInfoLog(), "invertible bloom filter decoding failed",
                    String.valueOf(decoded), String.valueOf(reason.size()));
        }
        return new DecodeResult(reason.isEmpty(), additional, missing, reason, decoded);
    }

    // Elements stored in the table, which is left untouched. Elements of a
    // table too loaded to decode entirely are skipped.
    public List<String> listEntries() {
        DecodeResult result = copy().decode();
        List<String> entries = Lists.newArrayList(result.getAdditional());
        entries.addAll(result.getMissing());
        return entries;
    }

    // Number of elements in the table. Only exact when every removed
    // element had been added before.
    public int length() {
        int total = 0;
        for (Cell cell : elements) {
            total += cell.getCount();
        }
        return total / hashCount;
    }

    public boolean isEmpty() {
        for (Cell cell : elements) {
            if (!cell.isEmpty()) {
                return false;
            }
        }
        return true;
    }

    public InvertibleBloomFilter copy() {
        InvertibleBloomFilter result = new InvertibleBloomFilter(size, hashCount, options);
        for (int i = 0; i < size; i++) {
            result.elements[i] = elements[i].copy();
        }
        return result;
    }

    public int getSize() {
        return size;
    }

    public int getHashCount() {
        return hashCount;
    }

    public long getSeed() {
        return options.getSeed();
    }

    public Cell cell(int index) {
        return elements[index];
    }

    private byte[] toId(String element) {
        byte[] id = ByteUtils.toBytes(element);
        checkArgument(id.length == 0 || id[0] != 0, "element should not start with a NUL character");
        return id;
    }

    private long hashId(byte[] id) {
        return hashing.getHash().hash64(id, getSeed());
    }

    private int[] indexes(byte[] id) {
        return hashing.getDistinctIndexes(id, size, hashCount, getSeed());
    }

    @Override
    public JsonObject saveAsJSON() {
        JsonObject json = new JsonObject();
        json.addProperty("type", TYPE);
        json.addProperty("size", size);
        json.addProperty("hashCount", hashCount);
        json.addProperty("seed", getSeed());
        JsonArray cells = new JsonArray();
        for (Cell cell : elements) {
            cells.add(cell.saveAsJSON());
        }
        json.add("elements", cells);
        return json;
    }

    public static Pair<Status, InvertibleBloomFilter> fromJson(String json, Options options) {
        try {
            JsonElement element = JsonParser.parseString(json);
            if (!element.isJsonObject()) {
                return Pair.of(Status.Corruption("invertible bloom filter snapshot is not a json object"), null);
            }
            return fromJSON(element.getAsJsonObject(), options);
        } catch (JsonParseException e) {
            return Pair.of(Status.Corruption("malformed invertible bloom filter snapshot", e.getMessage()), null);
        }
    }

    public static Pair<Status, InvertibleBloomFilter> fromJSON(JsonObject json) {
        return fromJSON(json, new Options());
    }

    // The snapshot seed overrides the seed of options.
    public static Pair<Status, InvertibleBloomFilter> fromJSON(JsonObject json, Options options) {
        for (String field : Arrays.asList("type", "size", "hashCount", "seed", "elements")) {
            if (!json.has(field) || json.get(field).isJsonNull()) {
                return corruption(options, "invertible bloom filter snapshot misses field", field);
            }
        }

        try {
            if (!TYPE.equals(json.get("type").getAsString())) {
                return corruption(options, "not an invertible bloom filter snapshot", json.get("type").getAsString());
            }

            int size = json.get("size").getAsInt();
            JsonArray cells = json.getAsJsonArray("elements");
            if (cells.size() != size) {
                return corruption(options, "invertible bloom filter cell count mismatch", String.valueOf(cells.size()));
            }

            Options snapshotOptions = new Options(options);
            snapshotOptions.setSeed(json.get("seed").getAsLong());
            InvertibleBloomFilter result = new InvertibleBloomFilter(size, json.get("hashCount").getAsInt(), snapshotOptions);
            for (int i = 0; i < size; i++) {
                JsonObject cell = cells.get(i).getAsJsonObject();
                for (String field : Arrays.asList("idSum", "hashSum", "count")) {
                    if (!cell.has(field)) {
                        return corruption(options, "invertible bloom filter cell misses field", field);
                    }
                }
                result.elements[i] = Cell.fromJSON(cell);
            }
            return Pair.of(Status.OK(), result);
        } catch (IllegalStateException | IllegalArgumentException | ClassCastException | UnsupportedOperationException e) {
            return corruption(options, "bad invertible bloom filter snapshot", e.getMessage());
        }
    }

    private static Pair<Status, InvertibleBloomFilter> corruption(Options options, String msg, String detail) {
        Options.Logger.log(options.getInfoLog(), msg, detail);
        return Pair.of(Status.Corruption(msg, detail), null);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        InvertibleBloomFilter that = (InvertibleBloomFilter) o;
        return size == that.size &&
                hashCount == that.hashCount &&
                getSeed() == that.getSeed() &&
                Arrays.equals(elements, that.elements);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(elements);
        result = 31 * result + hashCount;
        return result;
    }
}
