package com.quickbite.menuservice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.quickbite.menuservice.model.DietaryTag;
import com.quickbite.menuservice.model.FoodCategory;
import com.quickbite.menuservice.model.FoodItem;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

public record FoodItemResponse(
        UUID id,
        String name,
        String description,
        BigDecimal price,
        FoodCategory category,
        @JsonProperty("dietary_tag") DietaryTag dietaryTag,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt
) {

    public static FoodItemResponse from(FoodItem item) {
        return new FoodItemResponse(
                item.getId(),
                item.getName(),
                item.getDescription(),
                item.getPrice(),
                item.getCategory(),
                item.getDietaryTag(),
                item.getCreatedAt(),
                item.getUpdatedAt()
        );
    }
}
