package com.quickbite.menuservice.repository;

import com.quickbite.menuservice.model.FoodItem;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable storage for food items. Each operation is atomic for a single row;
 * nothing here spans rows or batches writes.
 * Implementations report failures as
 * {@link com.quickbite.menuservice.exception.FoodItemStorageException}.
 */
public interface FoodItemStore {

    List<FoodItem> listAll();

    Optional<FoodItem> getById(UUID id);

    /** Stores an item whose id has not been used before. */
    FoodItem insert(FoodItem item);

    /** Overwrites the stored row that has the same id. */
    FoodItem replace(FoodItem item);

    /** @return true when a row was found and removed */
    boolean deleteById(UUID id);
}
