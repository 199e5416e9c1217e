package com.quickbite.menuservice.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import org.springframework.data.domain.Persistable;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A dish on the menu. The id and both timestamps are assigned by the service,
 * so the entity reports itself as new until it has been persisted or loaded.
 */
@Entity
@Table(name = "food_items", indexes = {
        @Index(name = "idx_food_items_category", columnList = "category")
})
@Getter
@Setter
@NoArgsConstructor
public class FoodItem implements Persistable<UUID> {

    @Id
    @JdbcTypeCode(SqlTypes.CHAR)
    @Column(length = 36, nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(length = 1000)
    private String description;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal price;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private FoodCategory category;

    @Enumerated(EnumType.STRING)
    @Column(name = "dietary_tag", length = 20)
    private DietaryTag dietaryTag;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Transient
    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private boolean persisted;

    public FoodItem(UUID id, String name, String description, BigDecimal price,
                    FoodCategory category, DietaryTag dietaryTag, Instant createdAt, Instant updatedAt) {
        this.id = id;
        this.name = name;
        this.description = description;
        this.price = price;
        this.category = category;
        this.dietaryTag = dietaryTag;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    @Override
    public boolean isNew() {
        return !persisted;
    }

    @PostLoad
    @PostPersist
    public void markPersisted() {
        this.persisted = true;
    }

    public FoodItem copy() {
        FoodItem copy = new FoodItem(id, name, description, price, category, dietaryTag, createdAt, updatedAt);
        copy.persisted = persisted;
        return copy;
    }

    @Override
    public String toString() {
        return "FoodItem{id=" + id + ", name='" + name + "', category=" + category + "}";
    }
}
