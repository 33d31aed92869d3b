/*
 * MemIDB: In-Memory Indexed Database for Java
 *
 * Copyright 2026 The MemIDB Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.memidb.access;

import com.memidb.api.CursorDirection;
import com.memidb.api.Key;
import com.memidb.api.KeyRange;

import java.util.ArrayList;
import java.util.List;
import java.util.NavigableMap;
import java.util.NavigableSet;

/**
 * ScanSource implements ordered, range-restricted navigation over a set of
 * entries, each a key paired with a primary key. Entries are ordered by key,
 * then by primary key.
 * <p>
 * A record table has exactly one entry per key, the key being the primary
 * key. An index may map a key to several primary keys.
 * <p>
 * Navigation honors {@link CursorDirection}: <code>NEXT</code> and
 * <code>PREV</code> visit every entry, while the unique variants visit each
 * key once, at its lowest primary key.
 */
public abstract class ScanSource {

    /**
     * Gets the entries of this source by key.
     */
    protected abstract NavigableMap<Key, ?> keyMap();

    /**
     * Gets the primary keys of the entries with the given key.
     *
     * @return the primary keys in ascending order, or null if there are none
     */
    protected abstract NavigableSet<Key> primaryKeys(Key key);

    /**
     * Finds the first position of a scan.
     *
     * @param range     the key range, or null for all keys
     * @param direction the scan direction
     * @return the first position, or null if the range is empty
     */
    public Position first(KeyRange range, CursorDirection direction) {
        NavigableMap<Key, ?> view = subMap(range);
        if (view.isEmpty())
            return null;
        Key key = direction.isReverse() ? view.lastKey() : view.firstKey();
        return at(key, direction);
    }

    /**
     * Finds the position that follows the current one in the scan direction.
     * The current entry need not exist any more.
     *
     * @param current   the current position
     * @param range     the key range, or null for all keys
     * @param direction the scan direction
     * @return the next position, or null if the scan is exhausted
     */
    public Position next(Position current, KeyRange range, CursorDirection direction) {
        NavigableMap<Key, ?> view = subMap(range);
        Key key = current.getKey();
        NavigableSet<Key> pks;
        Key pk;
        switch (direction) {
            case NEXT:
                pks = view.containsKey(key) ? primaryKeys(key) : null;
                pk = pks == null ? null : pks.higher(current.getPrimaryKey());
                if (pk != null)
                    return new Position(key, pk);
                return at(view.higherKey(key), direction);
            case PREV:
                pks = view.containsKey(key) ? primaryKeys(key) : null;
                pk = pks == null ? null : pks.lower(current.getPrimaryKey());
                if (pk != null)
                    return new Position(key, pk);
                return at(view.lowerKey(key), direction);
            case NEXTUNIQUE:
                return at(view.higherKey(key), direction);
            default:
                return at(view.lowerKey(key), direction);
        }
    }

    /**
     * Finds the first position at or past a key in the scan direction.
     *
     * @param target    the key to seek
     * @param range     the key range, or null for all keys
     * @param direction the scan direction
     * @return the position, or null if there is none
     */
    public Position seek(Key target, KeyRange range, CursorDirection direction) {
        NavigableMap<Key, ?> view = subMap(range);
        return at(direction.isReverse() ? view.floorKey(target) : view.ceilingKey(target), direction);
    }

    /**
     * Finds the first position at or past a key and primary key in the scan
     * direction. Only meaningful for <code>NEXT</code> and <code>PREV</code>.
     *
     * @param target    the key to seek
     * @param targetPk  the primary key to seek within the target key
     * @param range     the key range, or null for all keys
     * @param direction the scan direction
     * @return the position, or null if there is none
     */
    public Position seek(Key target, Key targetPk, KeyRange range, CursorDirection direction) {
        NavigableMap<Key, ?> view = subMap(range);
        if (view.containsKey(target)) {
            NavigableSet<Key> pks = primaryKeys(target);
            Key pk = direction.isReverse() ? pks.floor(targetPk) : pks.ceiling(targetPk);
            if (pk != null)
                return new Position(target, pk);
        }
        return at(direction.isReverse() ? view.lowerKey(target) : view.higherKey(target), direction);
    }

    /**
     * Lists the entries in a range in ascending order.
     *
     * @param range the key range, or null for all keys
     * @param limit the maximum number of entries, or 0 for no limit
     * @return the entries
     */
    public List<Position> scan(KeyRange range, int limit) {
        List<Position> positions = new ArrayList<>();
        for (Key key : subMap(range).keySet()) {
            for (Key pk : primaryKeys(key)) {
                if (limit > 0 && positions.size() == limit)
                    return positions;
                positions.add(new Position(key, pk));
            }
        }
        return positions;
    }

    /**
     * Counts the entries in a range.
     *
     * @param range the key range, or null for all keys
     * @return the number of entries
     */
    public int count(KeyRange range) {
        int count = 0;
        for (Key key : subMap(range).keySet())
            count += primaryKeys(key).size();
        return count;
    }

    protected NavigableMap<Key, ?> subMap(KeyRange range) {
        NavigableMap<Key, ?> map = keyMap();
        if (range == null)
            return map;
        if (range.getLower() != null)
            map = map.tailMap(range.getLower(), !range.isLowerOpen());
        if (range.getUpper() != null)
            map = map.headMap(range.getUpper(), !range.isUpperOpen());
        return map;
    }

    private Position at(Key key, CursorDirection direction) {
        if (key == null)
            return null;
        NavigableSet<Key> pks = primaryKeys(key);
        return new Position(key, direction == CursorDirection.PREV ? pks.last() : pks.first());
    }
}
