package com.gillianbc.goalplanner.store;

import com.gillianbc.goalplanner.model.Portfolio;

import java.util.Optional;

/**
 * Persisted-state port holding a single portfolio record.
 */
public interface PortfolioStore {

    /**
     * @return the stored portfolio, or empty when nothing usable is stored
     * (absent, unreadable or malformed). Never throws for bad stored data.
     */
    Optional<Portfolio> load();

    /**
     * Replaces the stored record.
     *
     * @throws java.io.UncheckedIOException if the record cannot be written
     */
    void save(Portfolio portfolio);
}
