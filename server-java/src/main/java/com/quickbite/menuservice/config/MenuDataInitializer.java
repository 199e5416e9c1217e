package com.quickbite.menuservice.config;

import com.quickbite.menuservice.dto.CreateFoodItemRequest;
import com.quickbite.menuservice.service.FoodItemService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;

/**
 * Seeds a starter menu into an empty database.
 */
@Component
@ConditionalOnProperty(name = "quickbite.seed.enabled", havingValue = "true", matchIfMissing = true)
public class MenuDataInitializer implements CommandLineRunner {

    private static final Logger logger = LoggerFactory.getLogger(MenuDataInitializer.class);

    static final List<CreateFoodItemRequest> SAMPLE_MENU = List.of(
            new CreateFoodItemRequest("Bruschetta", "Grilled bread with tomato, garlic and basil",
                    new BigDecimal("8.50"), "Appetizers", "Vegan"),
            new CreateFoodItemRequest("Margherita Pizza", "Tomato, mozzarella and fresh basil",
                    new BigDecimal("16.99"), "MainCourses", "Vegetarian"),
            new CreateFoodItemRequest("Grilled Salmon", "Atlantic salmon with lemon butter and seasonal vegetables",
                    new BigDecimal("24.50"), "MainCourses", "GlutenFree"),
            new CreateFoodItemRequest("Caesar Salad", "Romaine, parmesan, croutons and Caesar dressing",
                    new BigDecimal("11.00"), "Salads", null),
            new CreateFoodItemRequest("Tom Yum Soup", "Hot and sour soup with shrimp and lemongrass",
                    new BigDecimal("9.75"), "Soups", "Spicy"),
            new CreateFoodItemRequest("Tiramisu", "Espresso-soaked ladyfingers with mascarpone",
                    new BigDecimal("7.25"), "Desserts", "Vegetarian"),
            new CreateFoodItemRequest("Fresh Lemonade", null,
                    new BigDecimal("3.50"), "Beverages", "DairyFree")
    );

    private final FoodItemService foodItemService;

    public MenuDataInitializer(FoodItemService foodItemService) {
        this.foodItemService = foodItemService;
    }

    @Override
    public void run(String... args) {
        if (!foodItemService.getAll().isEmpty()) {
            logger.info("Menu already has items, skipping sample data");
            return;
        }
        SAMPLE_MENU.forEach(foodItemService::create);
        logger.info("Seeded {} sample food items", SAMPLE_MENU.size());
    }
}
