package com.acme.inventory.model;

public record Item(String sku, int quantity) {

    public Item {
        if (sku == null || sku.isBlank()) {
            throw new IllegalArgumentException("sku is required");
        }
    }
}
