package com.quickbite.menuservice.service;

import com.quickbite.menuservice.dto.CreateFoodItemRequest;
import com.quickbite.menuservice.dto.FoodItemResponse;
import com.quickbite.menuservice.dto.UpdateFoodItemRequest;
import com.quickbite.menuservice.repository.InMemoryFoodItemStore;
import com.quickbite.menuservice.validation.FoodItemValidator;
import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class FoodItemServiceClockTest {

    private static final Instant START = Instant.parse("2025-01-01T00:00:00Z");

    private ValidatorFactory validatorFactory;
    private SettableClock clock;
    private FoodItemService service;

    @BeforeEach
    void setup() {
        validatorFactory = Validation.buildDefaultValidatorFactory();
        clock = new SettableClock(START);
        service = new FoodItemService(new InMemoryFoodItemStore(),
                new FoodItemValidator(validatorFactory.getValidator()), clock);
    }

    @AfterEach
    void tearDown() {
        validatorFactory.close();
    }

    @Test
    void updateOnSameTickStillMovesUpdatedAtForward() {
        FoodItemResponse created = service.create(pizza());

        FoodItemResponse first = service.update(created.id(), priceChange("17.50")).orElseThrow();
        FoodItemResponse second = service.update(created.id(), priceChange("18.00")).orElseThrow();

        assertThat(first.updatedAt()).isAfter(created.updatedAt());
        assertThat(second.updatedAt()).isAfter(first.updatedAt());
        assertEquals(START, second.createdAt());
    }

    @Test
    void clockSteppingBackNeverPutsUpdatedAtBeforeCreatedAt() {
        FoodItemResponse created = service.create(pizza());
        clock.shift(Duration.ofSeconds(-1));

        FoodItemResponse updated = service.update(created.id(), priceChange("17.50")).orElseThrow();

        assertThat(updated.updatedAt()).isAfter(updated.createdAt());
        assertThat(updated.updatedAt()).isAfter(created.updatedAt());
    }

    @Test
    void advancingClockIsUsedAsIs() {
        FoodItemResponse created = service.create(pizza());
        clock.shift(Duration.ofMinutes(5));

        FoodItemResponse updated = service.update(created.id(), priceChange("17.50")).orElseThrow();

        assertEquals(START.plus(Duration.ofMinutes(5)), updated.updatedAt());
    }

    private CreateFoodItemRequest pizza() {
        return new CreateFoodItemRequest("Margherita Pizza", null, new BigDecimal("16.99"), "MainCourses", "Vegetarian");
    }

    private UpdateFoodItemRequest priceChange(String price) {
        UpdateFoodItemRequest request = new UpdateFoodItemRequest();
        request.setPrice(new BigDecimal(price));
        return request;
    }
}
