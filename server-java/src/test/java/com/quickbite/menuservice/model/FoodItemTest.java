package com.quickbite.menuservice.model;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class FoodItemTest {

    private static final Instant NOW = Instant.parse("2025-02-14T18:30:00Z");

    @Test
    void assignedIdStaysNewUntilPersisted() {
        FoodItem item = sample();
        assertTrue(item.isNew());

        item.markPersisted();

        assertFalse(item.isNew());
    }

    @Test
    void copyCarriesPersistedStateAndIsIndependent() {
        FoodItem item = sample();
        item.markPersisted();

        FoodItem copy = item.copy();
        copy.setName("Vegan Lasagna");

        assertFalse(copy.isNew());
        assertEquals(item.getId(), copy.getId());
        assertEquals("Lasagna", item.getName());
    }

    @Test
    void enumsExposeDisplayTokens() {
        assertEquals("MainCourses", FoodCategory.MAIN_COURSES.getToken());
        assertEquals("GlutenFree", DietaryTag.GLUTEN_FREE.getToken());
        assertEquals(FoodCategory.SALADS, FoodCategory.fromToken("salads").orElseThrow());
        assertTrue(DietaryTag.fromToken("Halal").isEmpty());
    }

    private FoodItem sample() {
        return new FoodItem(UUID.randomUUID(), "Lasagna", null, new BigDecimal("14.00"),
                FoodCategory.MAIN_COURSES, DietaryTag.VEGETARIAN, NOW, NOW);
    }
}
