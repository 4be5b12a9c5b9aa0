package io.datamap.storage;

import io.datamap.core.FieldValue;
import io.datamap.core.KeyNotFoundException;
import io.datamap.index.NameKey;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A single row of a {@link DataMap}: an immutable id plus insertion-ordered fields.
 * <p>
 * Every row carries a {@value #NAME_FIELD} field, a mapping from language code
 * to display name. Rows are created by their owning map only. Changes to the
 * name field are routed through that map so its name index follows them;
 * all other fields are plain payload.
 */
public final class DataRow {

    public static final String NAME_FIELD = "name";

    private final int id;
    private final LinkedHashMap<String, FieldValue> fields;
    private DataMap owner;

    private DataRow(int id, LinkedHashMap<String, FieldValue> fields, DataMap owner) {
        this.id = id;
        this.fields = fields;
        this.owner = owner;
    }

    /**
     * Copy {@code raw} into a new row. The caller has already checked that a
     * name entry is present.
     */
    static DataRow create(int id, Map<String, ?> raw, DataMap owner) {
        var fields = new LinkedHashMap<String, FieldValue>(Math.max(8, raw.size() * 2));
        for (var entry : raw.entrySet()) {
            String field = requireField(entry.getKey());
            FieldValue value = FieldValue.of(entry.getValue());
            fields.put(field, NAME_FIELD.equals(field) ? requireNames(value) : value);
        }
        return new DataRow(id, fields, owner);
    }

    /**
     * Check that {@code value} is a mapping of language code to text.
     */
    static FieldValue.Mapping requireNames(FieldValue value) {
        if (!(value instanceof FieldValue.Mapping mapping)) {
            throw new IllegalArgumentException("name field must be a mapping of language to text, got " + value);
        }
        for (var entry : mapping.entries().entrySet()) {
            if (!(entry.getValue() instanceof FieldValue.Text)) {
                throw new IllegalArgumentException(
                        "name for language '" + entry.getKey() + "' must be text, got " + entry.getValue());
            }
        }
        return mapping;
    }

    private static String requireField(String field) {
        if (field == null) {
            throw new IllegalArgumentException("field required");
        }
        return field;
    }

    public int id() {
        return id;
    }

    public FieldValue get(String field) {
        var value = fields.get(field);
        if (value == null) {
            throw new KeyNotFoundException(field, "Row " + id + " has no field '" + field + "'");
        }
        return value;
    }

    public Optional<FieldValue> find(String field) {
        return Optional.ofNullable(fields.get(field));
    }

    public boolean contains(String field) {
        return fields.containsKey(field);
    }

    /**
     * Insert or overwrite a field. New fields go to the end.
     *
     * @param value a {@link FieldValue} or a raw value accepted by {@link FieldValue#of(Object)}
     */
    public void set(String field, Object value) {
        requireField(field);
        FieldValue converted = FieldValue.of(value);
        if (NAME_FIELD.equals(field)) {
            attachedOwner().rename(this, requireNames(converted));
            return;
        }
        fields.put(field, converted);
    }

    /**
     * Set a field and place it directly after {@code afterField}.
     * <p>
     * The fields that followed {@code afterField} keep their relative order
     * and end up after {@code field}. If {@code afterField} is not present
     * this is a plain {@link #set(String, Object)}.
     */
    public void setAfter(String field, Object value, String afterField) {
        requireField(field);
        if (afterField == null || afterField.isEmpty() || afterField.equals(field)
                || !fields.containsKey(afterField)) {
            set(field, value);
            return;
        }

        // snapshot before the update so the target is never its own follower
        var followers = new ArrayList<String>();
        var found = false;
        for (String key : fields.keySet()) {
            if (found) {
                if (!key.equals(field)) {
                    followers.add(key);
                }
            } else if (key.equals(afterField)) {
                found = true;
            }
        }

        set(field, value);

        moveToEnd(field);
        for (String key : followers) {
            moveToEnd(key);
        }
    }

    private void moveToEnd(String field) {
        var value = fields.remove(field);
        fields.put(field, value);
    }

    public void delete(String field) {
        if (NAME_FIELD.equals(field)) {
            throw new IllegalArgumentException("the name field cannot be deleted");
        }
        if (fields.remove(field) == null) {
            throw new KeyNotFoundException(field, "Row " + id + " has no field '" + field + "'");
        }
    }

    /**
     * Field names in insertion order.
     */
    public List<String> fieldNames() {
        return List.copyOf(fields.keySet());
    }

    public int fieldCount() {
        return fields.size();
    }

    /**
     * The name of this row in one language.
     *
     * @throws KeyNotFoundException if there is no translation for the language
     */
    public String name(String language) {
        var value = nameMapping().entries().get(language);
        if (value == null) {
            throw new KeyNotFoundException(language, "Row " + id + " has no name in language '" + language + "'");
        }
        return ((FieldValue.Text) value).value();
    }

    /**
     * All (language, name) translations, in stored order.
     */
    public List<Map.Entry<String, String>> names() {
        var entries = nameMapping().entries();
        var names = new ArrayList<Map.Entry<String, String>>(entries.size());
        entries.forEach((language, value) -> names.add(Map.entry(language, ((FieldValue.Text) value).value())));
        return names;
    }

    public List<String> languages() {
        return List.copyOf(nameMapping().entries().keySet());
    }

    /**
     * Add or replace the translation for one language.
     */
    public void setName(String language, String name) {
        if (language == null) {
            throw new IllegalArgumentException("language required");
        }
        if (name == null) {
            throw new IllegalArgumentException("name required");
        }
        var names = new LinkedHashMap<>(nameMapping().entries());
        names.put(language, FieldValue.text(name));
        attachedOwner().rename(this, new FieldValue.Mapping(names));
    }

    public void removeName(String language) {
        var names = new LinkedHashMap<>(nameMapping().entries());
        if (names.remove(language) == null) {
            throw new KeyNotFoundException(language, "Row " + id + " has no name in language '" + language + "'");
        }
        attachedOwner().rename(this, new FieldValue.Mapping(names));
    }

    /**
     * Read-only, ordered view of every field.
     */
    public Map<String, FieldValue> asMap() {
        return Collections.unmodifiableMap(fields);
    }

    /**
     * Ordered copy of every field as plain Java values.
     */
    public Map<String, Object> toRaw() {
        var raw = new LinkedHashMap<String, Object>(Math.max(8, fields.size() * 2));
        fields.forEach((field, value) -> raw.put(field, value.toRaw()));
        return raw;
    }

    /**
     * True while the row belongs to a map.
     */
    public boolean isAttached() {
        return owner != null;
    }

    List<NameKey> nameKeys() {
        return nameKeys(nameMapping());
    }

    static List<NameKey> nameKeys(FieldValue.Mapping names) {
        var keys = new ArrayList<NameKey>(names.entries().size());
        names.entries().forEach((language, value) -> keys.add(NameKey.of(language, ((FieldValue.Text) value).value())));
        return keys;
    }

    void replaceNames(FieldValue.Mapping names) {
        fields.put(NAME_FIELD, names);
    }

    void detach() {
        owner = null;
    }

    DataMap owner() {
        return owner;
    }

    private FieldValue.Mapping nameMapping() {
        return (FieldValue.Mapping) fields.get(NAME_FIELD);
    }

    private DataMap attachedOwner() {
        if (owner == null) {
            throw new IllegalStateException("Row " + id + " was removed from its data map; its name is read-only");
        }
        return owner;
    }

    @Override
    public String toString() {
        return "DataRow{id=" + id + ", fields=" + fields + "}";
    }
}
