package com.acme.inventory.repository;

import com.acme.inventory.model.Item;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

public class InMemoryItemRepository implements ItemRepository {

    private final Map<String, Item> items = new TreeMap<>();

    @Override
    public Optional<Item> findBySku(String sku) {
        return Optional.ofNullable(items.get(sku));
    }

    @Override
    public List<Item> findAll() {
        return new ArrayList<>(items.values());
    }

    @Override
    public void save(Item item) {
        if (item.quantity() < 0) {
            throw new IllegalArgumentException("negative quantity for " + item.sku());
        }
        items.put(item.sku(), item);
    }
}
