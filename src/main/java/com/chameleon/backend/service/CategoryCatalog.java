package com.chameleon.backend.service;

import com.chameleon.backend.model.Category;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class CategoryCatalog {

    public static final int GRID_SIZE = 4;

    private final List<Category> categories;

    public CategoryCatalog() {
        this(List.of(
                new Category("Fruits", List.of(
                        List.of("Apple", "Banana", "Cherry", "Date"),
                        List.of("Fig", "Grape", "Lemon", "Mango"),
                        List.of("Orange", "Papaya", "Pear", "Quince"),
                        List.of("Kiwi", "Lychee", "Melon", "Plum"))),
                new Category("Animals", List.of(
                        List.of("Cat", "Dog", "Horse", "Cow"),
                        List.of("Sheep", "Pig", "Goat", "Deer"),
                        List.of("Lion", "Tiger", "Bear", "Wolf"),
                        List.of("Rabbit", "Fox", "Otter", "Whale"))),
                new Category("Things at School", List.of(
                        List.of("Desk", "Chair", "Book", "Pen"),
                        List.of("Ruler", "Map", "Clock", "Bell"),
                        List.of("Laptop", "Teacher", "Board", "Locker"),
                        List.of("Bus", "Uniform", "Exam", "Class")))));
    }

    public CategoryCatalog(List<Category> categories) {
        for (Category category : categories) {
            if (category.size() != GRID_SIZE
                    || category.getGrid().stream().anyMatch(row -> row.size() != GRID_SIZE)) {
                throw new IllegalArgumentException("Category grid must be " + GRID_SIZE + "x" + GRID_SIZE
                        + ": " + category.getName());
            }
        }
        this.categories = List.copyOf(categories);
    }

    public int size() {
        return categories.size();
    }

    public Category get(int index) {
        return categories.get(index);
    }
}
