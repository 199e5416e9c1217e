package com.quickbite.menuservice.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.quickbite.menuservice.util.EnumTokenParser;

import java.util.Optional;

public enum FoodCategory implements CodedEnum {
    APPETIZERS("Appetizers"),
    MAIN_COURSES("MainCourses"),
    DESSERTS("Desserts"),
    BEVERAGES("Beverages"),
    SALADS("Salads"),
    SOUPS("Soups");

    private final String token;

    FoodCategory(String token) {
        this.token = token;
    }

    @Override
    @JsonValue
    public String getToken() {
        return token;
    }

    public static Optional<FoodCategory> fromToken(String raw) {
        return EnumTokenParser.resolve(FoodCategory.class, raw);
    }
}
