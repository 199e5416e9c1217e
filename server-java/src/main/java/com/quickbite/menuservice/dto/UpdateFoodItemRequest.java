package com.quickbite.menuservice.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.quickbite.menuservice.model.DietaryTag;
import com.quickbite.menuservice.model.FoodCategory;
import com.quickbite.menuservice.validation.EnumToken;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Partial update. A null field was not supplied and keeps its current value.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdateFoodItemRequest {

    @Pattern(regexp = "(?s).*\\S.*", message = "Name must not be empty or whitespace.")
    @Size(max = 100, message = "Name must not exceed 100 characters.")
    private String name;

    @Size(max = 1000, message = "Description must not exceed 1000 characters.")
    private String description;

    @DecimalMin(value = "0", inclusive = false, message = "Price must be greater than 0.")
    @Digits(integer = 10, fraction = 2, message = "Price must have at most 10 whole digits and 2 decimal places.")
    private BigDecimal price;

    @EnumToken(value = FoodCategory.class, message = "Category must be one of")
    private String category;

    @EnumToken(value = DietaryTag.class, message = "Dietary tag must be one of")
    @JsonProperty("dietary_tag")
    @JsonAlias("dietaryTag")
    private String dietaryTag;
}
