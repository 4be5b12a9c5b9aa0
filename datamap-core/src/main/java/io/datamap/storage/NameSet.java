package io.datamap.storage;

import java.util.Iterator;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Set-like view over the names of a {@link DataMap} in a single language.
 * <p>
 * Nothing is copied: membership goes through the map's name index and
 * iteration walks the rows in insertion order each time. A row without a
 * translation in this language makes iteration fail when it is reached.
 */
public final class NameSet implements Iterable<String> {

    private final DataMap dataMap;
    private final String language;

    NameSet(DataMap dataMap, String language) {
        this.dataMap = dataMap;
        this.language = language;
    }

    public String language() {
        return language;
    }

    public boolean contains(String name) {
        if (name == null) {
            return false;
        }
        return dataMap.entryOf(language, name).isPresent();
    }

    @Override
    public Iterator<String> iterator() {
        var rows = dataMap.iterator();
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return rows.hasNext();
            }

            @Override
            public String next() {
                return rows.next().name(language);
            }
        };
    }

    public Stream<String> stream() {
        return StreamSupport.stream(
                Spliterators.spliterator(iterator(), size(), Spliterator.ORDERED), false);
    }

    /**
     * One name per row.
     */
    public int size() {
        return dataMap.size();
    }

    public boolean isEmpty() {
        return dataMap.isEmpty();
    }

    @Override
    public String toString() {
        return "NameSet{language=" + language + ", rows=" + dataMap.size() + "}";
    }
}
