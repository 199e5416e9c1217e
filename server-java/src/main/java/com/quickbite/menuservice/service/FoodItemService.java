package com.quickbite.menuservice.service;

import com.quickbite.menuservice.dto.CreateFoodItemRequest;
import com.quickbite.menuservice.dto.FoodItemResponse;
import com.quickbite.menuservice.dto.UpdateFoodItemRequest;
import com.quickbite.menuservice.exception.FoodItemValidationException;
import com.quickbite.menuservice.model.DietaryTag;
import com.quickbite.menuservice.model.FoodCategory;
import com.quickbite.menuservice.model.FoodItem;
import com.quickbite.menuservice.repository.FoodItemStore;
import com.quickbite.menuservice.validation.FoodItemValidator;
import com.quickbite.menuservice.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Validates menu changes and applies them to the store.
 *
 * <p>Missing items are reported as an empty result or {@code false}, never as an
 * exception. Concurrent writes to the same item are not arbitrated: the last
 * read-merge-write to commit wins.
 */
@Service
public class FoodItemService {

    private static final Logger logger = LoggerFactory.getLogger(FoodItemService.class);

    private final FoodItemStore foodItemStore;
    private final FoodItemValidator foodItemValidator;
    private final Clock clock;

    public FoodItemService(FoodItemStore foodItemStore, FoodItemValidator foodItemValidator, Clock clock) {
        this.foodItemStore = foodItemStore;
        this.foodItemValidator = foodItemValidator;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public List<FoodItemResponse> getAll() {
        return foodItemStore.listAll().stream()
                .map(FoodItemResponse::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public Optional<FoodItemResponse> getById(UUID id) {
        return foodItemStore.getById(id).map(FoodItemResponse::from);
    }

    /**
     * @throws FoodItemValidationException if any field rule fails; nothing is stored
     */
    @Transactional
    public FoodItemResponse create(CreateFoodItemRequest request) throws FoodItemValidationException {
        ValidationResult result = foodItemValidator.validateCreate(request);
        if (!result.isValid()) {
            logger.debug("Rejected food item create: {}", result);
            throw new FoodItemValidationException(result);
        }

        Instant now = clock.instant();
        FoodItem item = new FoodItem(
                UUID.randomUUID(),
                request.getName(),
                request.getDescription(),
                request.getPrice(),
                FoodCategory.fromToken(request.getCategory()).orElseThrow(),
                request.getDietaryTag() != null ? DietaryTag.fromToken(request.getDietaryTag()).orElseThrow() : null,
                now,
                now
        );

        FoodItem saved = foodItemStore.insert(item);
        logger.info("Created food item {} ({}, {})", saved.getId(), saved.getName(), saved.getCategory());
        return FoodItemResponse.from(saved);
    }

    /**
     * Merges the supplied fields onto the stored item and refreshes its update time.
     *
     * @return the updated item, or empty when no item has this id
     * @throws FoodItemValidationException if a supplied field breaks a rule; the item is left unchanged
     */
    @Transactional
    public Optional<FoodItemResponse> update(UUID id, UpdateFoodItemRequest request) throws FoodItemValidationException {
        Optional<FoodItem> existing = foodItemStore.getById(id);
        if (existing.isEmpty()) {
            return Optional.empty();
        }

        ValidationResult result = foodItemValidator.validateUpdate(request);
        if (!result.isValid()) {
            logger.debug("Rejected food item update {}: {}", id, result);
            throw new FoodItemValidationException(result);
        }

        FoodItem item = existing.get();
        if (request.getName() != null) {
            item.setName(request.getName());
        }
        if (request.getDescription() != null) {
            item.setDescription(request.getDescription());
        }
        if (request.getPrice() != null) {
            item.setPrice(request.getPrice());
        }
        if (request.getCategory() != null) {
            item.setCategory(FoodCategory.fromToken(request.getCategory()).orElseThrow());
        }
        if (request.getDietaryTag() != null) {
            item.setDietaryTag(DietaryTag.fromToken(request.getDietaryTag()).orElseThrow());
        }
        item.setUpdatedAt(nextUpdateTime(item.getUpdatedAt()));

        FoodItem saved = foodItemStore.replace(item);
        logger.info("Updated food item {}", saved.getId());
        return Optional.of(FoodItemResponse.from(saved));
    }

    /**
     * A clock reading at or before the previous update (same tick, or the clock
     * stepped back) moves one millisecond past it instead, so updatedAt only grows.
     */
    private Instant nextUpdateTime(Instant previous) {
        Instant now = clock.instant();
        if (previous != null && !now.isAfter(previous)) {
            logger.debug("Clock reading {} not after last update {}, advancing", now, previous);
            return previous.plusMillis(1);
        }
        return now;
    }

    /**
     * @return true if the item existed and was removed
     */
    @Transactional
    public boolean delete(UUID id) {
        if (foodItemStore.getById(id).isEmpty()) {
            return false;
        }
        boolean removed = foodItemStore.deleteById(id);
        if (removed) {
            logger.info("Deleted food item {}", id);
        }
        return removed;
    }
}
