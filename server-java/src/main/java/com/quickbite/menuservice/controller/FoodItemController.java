package com.quickbite.menuservice.controller;

import com.quickbite.menuservice.dto.CreateFoodItemRequest;
import com.quickbite.menuservice.dto.FoodItemResponse;
import com.quickbite.menuservice.dto.UpdateFoodItemRequest;
import com.quickbite.menuservice.exception.FoodItemNotFoundException;
import com.quickbite.menuservice.service.FoodItemService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

import java.net.URI;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/fooditems")
public class FoodItemController {

    private final FoodItemService foodItemService;

    public FoodItemController(FoodItemService foodItemService) {
        this.foodItemService = foodItemService;
    }

    @GetMapping
    public ResponseEntity<List<FoodItemResponse>> getFoodItems() {
        return ResponseEntity.ok(foodItemService.getAll());
    }

    @GetMapping("/{id}")
    public ResponseEntity<FoodItemResponse> getFoodItem(@PathVariable UUID id) {
        return foodItemService.getById(id)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new FoodItemNotFoundException(id));
    }

    @PostMapping
    public ResponseEntity<FoodItemResponse> createFoodItem(@RequestBody CreateFoodItemRequest request) {
        FoodItemResponse created = foodItemService.create(request);
        URI location = ServletUriComponentsBuilder.fromCurrentRequest()
                .path("/{id}")
                .buildAndExpand(created.id())
                .toUri();
        return ResponseEntity.created(location).body(created);
    }

    @PutMapping("/{id}")
    public ResponseEntity<FoodItemResponse> updateFoodItem(@PathVariable UUID id,
                                                           @RequestBody UpdateFoodItemRequest request) {
        return foodItemService.update(id, request)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new FoodItemNotFoundException(id));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteFoodItem(@PathVariable UUID id) {
        if (!foodItemService.delete(id)) {
            throw new FoodItemNotFoundException(id);
        }
        return ResponseEntity.noContent().build();
    }
}
