package com.quickbite.menuservice.config;

import com.quickbite.menuservice.dto.CreateFoodItemRequest;
import com.quickbite.menuservice.dto.FoodItemResponse;
import com.quickbite.menuservice.model.FoodCategory;
import com.quickbite.menuservice.service.FoodItemService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class MenuDataInitializerTest {

    @Mock
    private FoodItemService foodItemService;

    private MenuDataInitializer initializer;

    @BeforeEach
    void setup() {
        initializer = new MenuDataInitializer(foodItemService);
    }

    @Test
    void seedsSampleMenuIntoEmptyStore() {
        when(foodItemService.getAll()).thenReturn(List.of());

        initializer.run();

        verify(foodItemService, times(MenuDataInitializer.SAMPLE_MENU.size())).create(any(CreateFoodItemRequest.class));
    }

    @Test
    void leavesExistingMenuAlone() {
        Instant now = Instant.parse("2025-01-01T00:00:00Z");
        when(foodItemService.getAll()).thenReturn(List.of(new FoodItemResponse(UUID.randomUUID(), "Soup", null,
                BigDecimal.ONE, FoodCategory.SOUPS, null, now, now)));

        initializer.run();

        verify(foodItemService, never()).create(any());
    }

    @Test
    void sampleMenuCoversEveryCategory() {
        assertThat(MenuDataInitializer.SAMPLE_MENU)
                .extracting(CreateFoodItemRequest::getCategory)
                .contains("Appetizers", "MainCourses", "Desserts", "Beverages", "Salads", "Soups");
    }
}
