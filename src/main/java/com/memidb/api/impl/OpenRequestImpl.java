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

import com.memidb.api.*;
import com.memidb.event.EventLoop;
import com.memidb.transaction.TransactionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

public class OpenRequestImpl extends RequestImpl<Connection> implements OpenRequest {

    private static final Logger log = LoggerFactory.getLogger(OpenRequestImpl.class);

    private final String name;
    private final long version;
    private final List<UpgradeListener> upgradeListeners = new ArrayList<>();

    OpenRequestImpl(EventLoop eventLoop, TransactionManager transactionManager, String name, long version) {
        super(eventLoop, transactionManager, null, null);
        this.name = name;
        this.version = version;
    }

    String getName() {
        return name;
    }

    /**
     * Gets the requested version.
     *
     * @return the version, or 0 to open at the current version
     */
    long getVersion() {
        return version;
    }

    @Override
    public OpenRequest onUpgradeNeeded(UpgradeListener listener) {
        upgradeListeners.add(listener);
        return this;
    }

    @Override
    public OpenRequest onSuccess(RequestListener<Connection> listener) {
        super.onSuccess(listener);
        return this;
    }

    @Override
    public OpenRequest onError(RequestListener<Connection> listener) {
        super.onError(listener);
        return this;
    }

    /**
     * Runs the upgrade listeners.
     *
     * @param event the upgrade in progress
     * @return the failure of the first listener that threw, or null
     */
    DatabaseException fireUpgradeNeeded(VersionChangeEvent event) {
        for (UpgradeListener listener : new ArrayList<>(upgradeListeners)) {
            try {
                listener.upgradeNeeded(event);
            } catch (DatabaseException e) {
                log.warn("Upgrade of database {} failed", name, e);
                return e;
            } catch (RuntimeException e) {
                log.warn("Upgrade of database {} failed", name, e);
                return new AbortException("Upgrade listener failed", e);
            }
        }
        return null;
    }
}
