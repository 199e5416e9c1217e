package com.quickbite.menuservice.repository;

import com.quickbite.menuservice.model.FoodItem;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Map-backed store for service tests. Hands out copies so callers cannot
 * change stored rows without going through replace.
 */
public class InMemoryFoodItemStore implements FoodItemStore {

    private final Map<UUID, FoodItem> rows = new LinkedHashMap<>();
    private int writes;

    @Override
    public List<FoodItem> listAll() {
        List<FoodItem> items = new ArrayList<>();
        rows.values().forEach(item -> items.add(item.copy()));
        return items;
    }

    @Override
    public Optional<FoodItem> getById(UUID id) {
        return Optional.ofNullable(rows.get(id)).map(FoodItem::copy);
    }

    @Override
    public FoodItem insert(FoodItem item) {
        if (rows.containsKey(item.getId())) {
            throw new IllegalStateException("Duplicate id " + item.getId());
        }
        writes++;
        rows.put(item.getId(), item.copy());
        return item.copy();
    }

    @Override
    public FoodItem replace(FoodItem item) {
        if (!rows.containsKey(item.getId())) {
            throw new IllegalStateException("Unknown id " + item.getId());
        }
        writes++;
        rows.put(item.getId(), item.copy());
        return item.copy();
    }

    @Override
    public boolean deleteById(UUID id) {
        if (rows.remove(id) == null) {
            return false;
        }
        writes++;
        return true;
    }

    public int size() {
        return rows.size();
    }

    public int writes() {
        return writes;
    }
}
