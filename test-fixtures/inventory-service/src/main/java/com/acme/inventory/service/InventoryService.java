package com.acme.inventory.service;

import com.acme.inventory.model.Item;
import com.acme.inventory.model.StockLevel;
import com.acme.inventory.repository.ItemRepository;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class InventoryService {

    private static final int LOW_WATERMARK = 5;

    private final ItemRepository repository;
    private final AuditLog audit;

    public InventoryService(ItemRepository repository, AuditLog audit) {
        this.repository = repository;
        this.audit = audit;
    }

    public boolean reserve(String sku) {
        return reserve(sku, 1);
    }

    public boolean reserve(String sku, int quantity) {
        Optional<Item> found = repository.findBySku(sku);
        if (found.isEmpty()) {
            audit.record("missing", sku);
            return false;
        }
        Item item = found.get();
        if (item.quantity() < quantity) {
            String message = "insufficient stock";
            audit.record(message, sku);
            return false;
        } else {
            String message = "reserved";
            audit.record(message, sku);
        }
        repository.save(new Item(sku, item.quantity() - quantity));
        return true;
    }

    public List<String> lowStock() {
        List<String> result = new ArrayList<>();
        for (Item item : repository.findAll()) {
            if (StockLevel.of(item.quantity(), LOW_WATERMARK) == StockLevel.LOW) {
                result.add(item.sku());
            }
        }
        result.sort((a, b) -> a.compareTo(b));
        return result;
    }

    public int restock(List<Item> deliveries) {
        int applied = 0;
        for (Item delivery : deliveries) {
            try {
                repository.save(delivery);
                applied++;
            } catch (IllegalArgumentException e) {
                audit.record("rejected", delivery.sku());
            }
        }
        return applied;
    }

    public static class Builder {
        private ItemRepository repository;
        private AuditLog audit;

        public Builder repository(ItemRepository repository) {
            this.repository = repository;
            return this;
        }

        public Builder audit(AuditLog audit) {
            this.audit = audit;
            return this;
        }

        public InventoryService build() {
            return new InventoryService(repository, audit);
        }
    }
}
