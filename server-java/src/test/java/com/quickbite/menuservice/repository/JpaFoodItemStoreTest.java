package com.quickbite.menuservice.repository;

import com.quickbite.menuservice.exception.FoodItemStorageException;
import com.quickbite.menuservice.model.FoodCategory;
import com.quickbite.menuservice.model.FoodItem;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JpaFoodItemStoreTest {

    @Mock
    private FoodItemRepository foodItemRepository;

    @InjectMocks
    private JpaFoodItemStore store;

    @Test
    void translatesDataAccessFailureOnRead() {
        DataAccessResourceFailureException cause = new DataAccessResourceFailureException("database is locked");
        when(foodItemRepository.findAll()).thenThrow(cause);

        FoodItemStorageException ex = assertThrows(FoodItemStorageException.class, () -> store.listAll());

        assertSame(cause, ex.getCause());
    }

    @Test
    void translatesConstraintViolationOnInsert() {
        FoodItem item = newItem();
        when(foodItemRepository.saveAndFlush(item)).thenThrow(new DataIntegrityViolationException("UNIQUE constraint failed"));

        FoodItemStorageException ex = assertThrows(FoodItemStorageException.class, () -> store.insert(item));

        assertThat(ex.getMessage()).contains(item.getId().toString());
    }

    @Test
    void insertRefusesItemLoadedFromStorage() {
        FoodItem item = newItem();
        item.markPersisted();

        assertThrows(IllegalArgumentException.class, () -> store.insert(item));
        verify(foodItemRepository, never()).saveAndFlush(any());
    }

    @Test
    void deleteReportsMissingRow() {
        UUID id = UUID.randomUUID();
        when(foodItemRepository.existsById(id)).thenReturn(false);

        assertFalse(store.deleteById(id));
        verify(foodItemRepository, never()).deleteById(any());
    }

    @Test
    void deleteRemovesExistingRow() {
        UUID id = UUID.randomUUID();
        when(foodItemRepository.existsById(id)).thenReturn(true);

        assertTrue(store.deleteById(id));
        verify(foodItemRepository).deleteById(id);
        verify(foodItemRepository).flush();
    }

    private FoodItem newItem() {
        Instant now = Instant.parse("2025-01-01T00:00:00Z");
        return new FoodItem(UUID.randomUUID(), "Garlic Bread", null, new BigDecimal("5.00"),
                FoodCategory.APPETIZERS, null, now, now);
    }
}
