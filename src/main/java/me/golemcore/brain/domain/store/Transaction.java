package me.golemcore.brain.domain.store;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import org.springframework.transaction.TransactionStatus;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Unit of work handed to {@link RecordStore#transaction}. Runs on the
 * connection bound to the surrounding JDBC transaction, so reads see this
 * transaction's own writes. Nothing is visible to other readers until the
 * store commits.
 */
public final class Transaction {

    private final RecordStore store;
    private final TransactionStatus status;

    Transaction(RecordStore store, TransactionStatus status) {
        this.store = store;
        this.status = status;
    }

    public <T> Optional<T> get(String table, String key, Class<T> type) {
        return store.findOne(table, key, type);
    }

    public boolean contains(String table, String key) {
        return store.containsRow(table, key);
    }

    public <T> List<T> scan(String table, Class<T> type) {
        return store.findAll(table, type, record -> true);
    }

    public <T> List<T> scan(String table, Class<T> type, Predicate<T> predicate) {
        return store.findAll(table, type, predicate);
    }

    public <T> List<T> lookup(String table, String indexName, String value, Class<T> type) {
        return store.findByIndex(table, indexName, value, type);
    }

    public int count(String table) {
        return store.countRows(table);
    }

    /**
     * Insert a new record.
     *
     * @throws IntegrityViolationException
     *             if the key already exists
     */
    public void insert(String table, String key, Object record) {
        store.insertRow(table, key, record);
    }

    public void put(String table, String key, Object record) {
        store.putRow(table, key, record);
    }

    public boolean delete(String table, String key) {
        return store.deleteRow(table, key);
    }

    /**
     * Next value of a named monotonically increasing counter, starting at 1.
     * Rolled back together with the rest of the transaction.
     */
    public long nextSequence(String name) {
        return store.nextSequenceValue(name);
    }

    /**
     * Roll back every write of this transaction when the transaction function
     * returns.
     */
    public void setRollbackOnly() {
        status.setRollbackOnly();
    }

    public boolean isRollbackOnly() {
        return status.isRollbackOnly();
    }
}
