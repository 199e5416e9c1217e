package com.quickbite.menuservice.exception;

import java.util.UUID;

public class FoodItemNotFoundException extends MenuServiceException {

    public FoodItemNotFoundException(UUID id) {
        super(ErrorCode.FOOD_ITEM_NOT_FOUND, "Food item not found: " + id);
    }
}
