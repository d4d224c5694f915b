package com.acme.inventory.model;

public enum StockLevel {
    EMPTY("empty"),
    LOW("low"),
    NORMAL("normal");

    private final String label;

    StockLevel(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static StockLevel of(int quantity, int lowWatermark) {
        if (quantity == 0) return EMPTY;
        return quantity <= lowWatermark ? LOW : NORMAL;
    }
}
