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

package com.memidb.api.impl;

import com.memidb.access.KeyPathExtractor;
import com.memidb.access.Position;
import com.memidb.access.ScanSource;
import com.memidb.api.*;

/**
 * CursorImpl walks a {@link ScanSource} within a key range.
 * <p>
 * Each movement computes the next position at once, the same way every
 * other operation applies its effect when issued, but the cursor only shows
 * the new position when its request is delivered. Until then the cursor
 * cannot be moved, updated or deleted through.
 */
public class CursorImpl implements CursorWithValue {

    private final Object source;
    private final ObjectStoreImpl store;
    private final ScanSource scanSource;
    private final KeyRange range;
    private final CursorDirection direction;
    private final boolean withValue;
    private final RequestImpl<? super CursorImpl> request;
    private Position position;
    private Value value;
    private Position pendingPosition;
    private Value pendingValue;
    private boolean gotValue;
    private boolean exhausted;

    CursorImpl(Object source, ObjectStoreImpl store, ScanSource scanSource, KeyRange range,
               CursorDirection direction, boolean withValue, RequestImpl<? super CursorImpl> request) {
        if (direction == null)
            throw new IllegalArgumentException("direction must not be null");
        this.source = source;
        this.store = store;
        this.scanSource = scanSource;
        this.range = range;
        this.direction = direction;
        this.withValue = withValue;
        this.request = request;
        request.setResolver(this::arrive);
    }

    /**
     * Issues the opening request, positioned at the first entry of the range.
     */
    void open() throws InvalidStateException {
        request.issue();
        moveTo(scanSource.first(range, direction));
    }

    @Override
    public Object getSource() {
        return source;
    }

    @Override
    public CursorDirection getDirection() {
        return direction;
    }

    @Override
    public Key getKey() {
        return position == null ? null : position.getKey();
    }

    @Override
    public Key getPrimaryKey() {
        return position == null ? null : position.getPrimaryKey();
    }

    @Override
    public Value getValue() {
        return value;
    }

    @Override
    public boolean isExhausted() {
        return exhausted;
    }

    @Override
    public Request<?> getRequest() {
        return request;
    }

    @Override
    public void advance(int count) throws DatabaseException {
        if (count <= 0)
            throw new IllegalArgumentException("count must be positive: " + count);
        checkMove();

        Position target = position;
        for (int i = 0; i < count && target != null; i++)
            target = scanSource.next(target, range, direction);
        move(target);
    }

    @Override
    public void continueCursor() throws DatabaseException {
        checkMove();
        move(scanSource.next(position, range, direction));
    }

    @Override
    public void continueCursor(Key key) throws DatabaseException {
        if (key == null) {
            continueCursor();
            return;
        }
        checkMove();
        int diff = key.compareTo(position.getKey());
        if (direction.isReverse() ? diff >= 0 : diff <= 0)
            throw new DataException("Key " + key + " is not past the cursor position " + position.getKey()
                    + " in direction " + direction);
        move(scanSource.seek(key, range, direction));
    }

    @Override
    public void continuePrimaryKey(Key key, Key primaryKey) throws DatabaseException {
        if (key == null || primaryKey == null)
            throw new IllegalArgumentException("key and primaryKey must not be null");
        if (!(source instanceof Index))
            throw new InvalidAccessException("continuePrimaryKey requires an index cursor");
        if (direction.isUnique())
            throw new InvalidAccessException("continuePrimaryKey is not allowed in direction " + direction);
        checkMove();

        int diff = key.compareTo(position.getKey());
        if (diff == 0)
            diff = primaryKey.compareTo(position.getPrimaryKey());
        if (direction.isReverse() ? diff >= 0 : diff <= 0)
            throw new DataException("Position (" + key + ", " + primaryKey + ") is not past the cursor position "
                    + position + " in direction " + direction);
        move(scanSource.seek(key, primaryKey, range, direction));
    }

    @Override
    public Request<Key> update(Value value) throws DatabaseException {
        if (value == null)
            throw new IllegalArgumentException("value must not be null; use Value.NULL");
        store.transaction.getTrans().validateWrite();
        checkRecord();

        Key primaryKey = position.getPrimaryKey();
        KeyPath keyPath = store.getKeyPath();
        if (keyPath != null && !primaryKey.equals(KeyPathExtractor.extractKey(value, keyPath)))
            throw new DataException("Value does not carry the primary key " + primaryKey + " at key path " + keyPath);

        return store.execute(this, () -> store.dataset.put(store.transaction.getTrans(), value,
                keyPath == null ? primaryKey : null), true);
    }

    @Override
    public Request<Void> delete() throws DatabaseException {
        store.transaction.getTrans().validateWrite();
        checkRecord();

        KeyRange only = KeyRange.only(position.getPrimaryKey());
        return store.execute(this, () -> {
            store.dataset.remove(store.transaction.getTrans(), only);
            return null;
        }, true);
    }

    private void checkMove() throws InvalidStateException {
        store.transaction.getTrans().validate();
        if (!gotValue)
            throw new InvalidStateException("The cursor is moving or has run past its end");
    }

    private void checkRecord() throws InvalidStateException {
        if (!withValue)
            throw new InvalidStateException("The cursor was opened without values");
        if (!gotValue)
            throw new InvalidStateException("The cursor is moving or has run past its end");
    }

    private void move(Position target) throws InvalidStateException {
        request.issue();
        moveTo(target);
    }

    private void moveTo(Position target) {
        gotValue = false;
        pendingPosition = target;
        pendingValue = target != null && withValue ? store.dataset.get(target.getPrimaryKey()) : null;
    }

    private void arrive() {
        position = pendingPosition;
        value = pendingValue;
        if (position == null) {
            exhausted = true;
            request.succeed(null);
        } else {
            gotValue = true;
            request.succeed(this);
        }
    }

    @Override
    public String toString() {
        return "Cursor[" + source + ", " + direction + ", " + (exhausted ? "exhausted" : position) + "]";
    }
}
