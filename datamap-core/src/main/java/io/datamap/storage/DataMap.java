package io.datamap.storage;

import io.datamap.core.DataMapConfiguration;
import io.datamap.core.DataMapConfiguration.DuplicateNamePolicy;
import io.datamap.core.DuplicateKeyException;
import io.datamap.core.FieldValue;
import io.datamap.core.KeyNotFoundException;
import io.datamap.core.MissingFieldException;
import io.datamap.index.NameIndex;
import io.datamap.index.NameKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Insertion-ordered store of {@link DataRow}s keyed by integer id, with a
 * reverse index from (language, name) to id.
 * <p>
 * Rows iterate in the order they were added, whatever their id. Ids are either
 * supplied by the caller ({@link #addWithId(int, Map)}) or drawn from a per-map
 * sequence ({@link #insert(Map)}); an explicit id above every id seen so far
 * pushes the sequence past it.
 * <p>
 * Every mutation validates first and commits afterwards, so a failed call
 * leaves rows, name index and id sequence untouched. The one exception is
 * {@link #insert(Map)}, which consumes its id even when the row is rejected.
 * <p>
 * <b>Thread-safety:</b> none. Callers serialize access.
 */
public final class DataMap implements Iterable<DataRow> {

    private static final Logger log = LoggerFactory.getLogger(DataMap.class);

    private final DataMapConfiguration configuration;
    private final LinkedHashMap<Integer, DataRow> rows;
    private final NameIndex nameIndex;
    private final IdSequence idSequence;

    public DataMap() {
        this(DataMapConfiguration.defaults());
    }

    public DataMap(DataMapConfiguration configuration) {
        this(configuration, Map.of());
    }

    public DataMap(Map<Integer, ? extends Map<String, ?>> initial) {
        this(DataMapConfiguration.defaults(), initial);
    }

    /**
     * Create a map and add {@code initial} entries in their iteration order,
     * exactly as {@link #addWithId(int, Map)} would.
     */
    public DataMap(DataMapConfiguration configuration, Map<Integer, ? extends Map<String, ?>> initial) {
        if (configuration == null) {
            throw new IllegalArgumentException("configuration required");
        }
        if (initial == null) {
            throw new IllegalArgumentException("initial entries required");
        }
        this.configuration = configuration;
        this.rows = new LinkedHashMap<>(configuration.initialCapacity());
        this.nameIndex = new NameIndex(configuration.initialCapacity());
        this.idSequence = new IdSequence(configuration.firstGeneratedId());
        for (var entry : initial.entrySet()) {
            if (entry.getKey() == null) {
                throw new IllegalArgumentException("id required");
            }
            addWithId(entry.getKey(), entry.getValue());
        }
    }

    public DataMapConfiguration configuration() {
        return configuration;
    }

    /**
     * Id of the row named {@code name} in {@code language}.
     */
    public OptionalInt idOf(String language, String name) {
        return nameIndex.lookup(NameKey.of(language, name));
    }

    /**
     * Row named {@code name} in {@code language}; use it to reach the other translations.
     */
    public Optional<DataRow> entryOf(String language, String name) {
        var id = idOf(language, name);
        if (id.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(rows.get(id.getAsInt()));
    }

    /**
     * Add a row under an explicit id.
     *
     * @throws DuplicateKeyException if the id is taken, or a name is owned by another row under REJECT
     * @throws MissingFieldException if {@code fields} has no name entry
     */
    public DataRow addWithId(int id, Map<String, ?> fields) {
        if (id < 0) {
            throw new IllegalArgumentException("id must be non-negative: " + id);
        }
        if (fields == null) {
            throw new IllegalArgumentException("fields required");
        }
        if (rows.containsKey(id)) {
            throw new DuplicateKeyException(id, "An entry with id " + id + " already exists");
        }
        if (!fields.containsKey(DataRow.NAME_FIELD)) {
            throw new MissingFieldException(DataRow.NAME_FIELD, "Entry " + id + " is missing a name value");
        }

        var row = DataRow.create(id, fields, this);
        var keys = row.nameKeys();
        checkNamesAvailable(id, keys);

        for (NameKey key : keys) {
            claim(key, id);
        }
        rows.put(id, row);
        idSequence.advancePast(id);
        log.debug("Added row {} with names {}", id, keys);
        return row;
    }

    /**
     * Add a row under the next generated id.
     */
    public DataRow insert(Map<String, ?> fields) {
        return addWithId(idSequence.generate(), fields);
    }

    /**
     * Insert each entry in order. Not atomic: rows inserted before a failure stay.
     */
    public List<DataRow> extend(Iterable<? extends Map<String, ?>> entries) {
        if (entries == null) {
            throw new IllegalArgumentException("entries required");
        }
        var added = new ArrayList<DataRow>();
        for (Map<String, ?> entry : entries) {
            added.add(insert(entry));
        }
        return added;
    }

    /**
     * Remove a row and its name index entries. Ids are never handed out again.
     */
    public DataRow remove(int id) {
        var row = rows.remove(id);
        if (row == null) {
            throw new KeyNotFoundException(id, "No entry with id " + id);
        }
        for (NameKey key : row.nameKeys()) {
            nameIndex.remove(key, id);
        }
        row.detach();
        log.debug("Removed row {}", id);
        return row;
    }

    public void clear() {
        rows.values().forEach(DataRow::detach);
        rows.clear();
        nameIndex.clear();
    }

    /**
     * Live, lazy view of every row's name in {@code language}.
     */
    public NameSet names(String language) {
        if (language == null) {
            throw new IllegalArgumentException("language required");
        }
        return new NameSet(this, language);
    }

    public DataRow get(int id) {
        var row = rows.get(id);
        if (row == null) {
            throw new KeyNotFoundException(id, "No entry with id " + id);
        }
        return row;
    }

    public Optional<DataRow> find(int id) {
        return Optional.ofNullable(rows.get(id));
    }

    public boolean containsId(int id) {
        return rows.containsKey(id);
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /**
     * Ids in insertion order.
     */
    public Set<Integer> ids() {
        return Collections.unmodifiableSet(rows.keySet());
    }

    /**
     * Rows in insertion order.
     */
    public Collection<DataRow> rows() {
        return Collections.unmodifiableCollection(rows.values());
    }

    @Override
    public Iterator<DataRow> iterator() {
        return rows().iterator();
    }

    public Stream<DataRow> stream() {
        return rows.values().stream();
    }

    /**
     * The id the next {@link #insert(Map)} will use.
     */
    public int nextId() {
        return idSequence.peek();
    }

    int indexedNameCount() {
        return nameIndex.size();
    }

    /**
     * Replace a row's name translations and re-index them. Called by {@link DataRow}.
     */
    void rename(DataRow row, FieldValue.Mapping names) {
        int id = row.id();
        if (row.owner() != this || rows.get(id) != row) {
            throw new IllegalStateException("Row " + id + " does not belong to this data map");
        }
        var oldKeys = row.nameKeys();
        var newKeys = DataRow.nameKeys(names);
        checkNamesAvailable(id, newKeys);

        var kept = new HashSet<>(newKeys);
        for (NameKey key : oldKeys) {
            if (!kept.contains(key)) {
                nameIndex.remove(key, id);
            }
        }
        for (NameKey key : newKeys) {
            claim(key, id);
        }
        row.replaceNames(names);
        log.debug("Renamed row {} to {}", id, newKeys);
    }

    private void checkNamesAvailable(int id, List<NameKey> keys) {
        if (configuration.duplicateNamePolicy() != DuplicateNamePolicy.REJECT) {
            return;
        }
        for (NameKey key : keys) {
            if (nameIndex.claimedByOther(key, id)) {
                throw new DuplicateKeyException(key,
                        "Name '" + key.name() + "' in language '" + key.language() + "' already belongs to entry "
                                + nameIndex.lookup(key).getAsInt());
            }
        }
    }

    private void claim(NameKey key, int id) {
        int previous = nameIndex.put(key, id);
        if (previous >= 0 && previous != id) {
            log.warn("Name {} moved from entry {} to entry {}", key, previous, id);
        }
    }
}
