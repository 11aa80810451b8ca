/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.goodnamebot.store;

import java.util.Optional;

/**
 * Durable collection of good names.
 *
 * <p>Implementations never throw from these methods: I/O problems are logged
 * and reported through {@link #isConnected()} and empty results.
 */
public interface GoodNameStore {

    /**
     * Loads the backing data. On failure the store stays disconnected.
     */
    void connect();

    /**
     * @return true if the last {@link #connect()} succeeded and no write has failed since
     */
    boolean isConnected();

    /**
     * Picks one good name uniformly at random.
     *
     * @return a random good name, or empty if disconnected or nothing is stored
     */
    Optional<GoodName> getRandomGoodName();

    /**
     * Idempotently records a good name.
     *
     * @param goodName proposed text, normalized before lookup
     * @param addedBy  id of the user proposing it
     * @return the normalized text if a new record was persisted; empty for a
     *         duplicate, blank input, a disconnected store or a failed write
     */
    Optional<String> addGoodName(String goodName, String addedBy);

    /**
     * @return number of good names currently held in memory
     */
    int size();
}
