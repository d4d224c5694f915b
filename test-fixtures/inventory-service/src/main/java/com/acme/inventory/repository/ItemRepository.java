package com.acme.inventory.repository;

import com.acme.inventory.model.Item;

import java.util.List;
import java.util.Optional;

public interface ItemRepository {

    Optional<Item> findBySku(String sku);

    List<Item> findAll();

    void save(Item item);
}
