package com.quickbite.menuservice.repository;

import com.quickbite.menuservice.exception.FoodItemStorageException;
import com.quickbite.menuservice.model.FoodItem;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Component
public class JpaFoodItemStore implements FoodItemStore {

    private final FoodItemRepository foodItemRepository;

    public JpaFoodItemStore(FoodItemRepository foodItemRepository) {
        this.foodItemRepository = foodItemRepository;
    }

    @Override
    public List<FoodItem> listAll() {
        try {
            return foodItemRepository.findAll();
        } catch (DataAccessException e) {
            throw new FoodItemStorageException("Failed to list food items", e);
        }
    }

    @Override
    public Optional<FoodItem> getById(UUID id) {
        try {
            return foodItemRepository.findById(id);
        } catch (DataAccessException e) {
            throw new FoodItemStorageException("Failed to load food item " + id, e);
        }
    }

    @Override
    public FoodItem insert(FoodItem item) {
        if (!item.isNew()) {
            throw new IllegalArgumentException("Food item " + item.getId() + " is already stored");
        }
        try {
            return foodItemRepository.saveAndFlush(item);
        } catch (DataAccessException e) {
            throw new FoodItemStorageException("Failed to insert food item " + item.getId(), e);
        }
    }

    @Override
    public FoodItem replace(FoodItem item) {
        try {
            return foodItemRepository.saveAndFlush(item);
        } catch (DataAccessException e) {
            throw new FoodItemStorageException("Failed to update food item " + item.getId(), e);
        }
    }

    @Override
    public boolean deleteById(UUID id) {
        try {
            if (!foodItemRepository.existsById(id)) {
                return false;
            }
            foodItemRepository.deleteById(id);
            foodItemRepository.flush();
            return true;
        } catch (DataAccessException e) {
            throw new FoodItemStorageException("Failed to delete food item " + id, e);
        }
    }
}
