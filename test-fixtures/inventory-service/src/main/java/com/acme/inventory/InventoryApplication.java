package com.acme.inventory;

import com.acme.inventory.model.Item;
import com.acme.inventory.repository.InMemoryItemRepository;
import com.acme.inventory.service.AuditLog;
import com.acme.inventory.service.InventoryService;

import java.util.List;

public class InventoryApplication {

    public static void main(String[] args) {
        InMemoryItemRepository repository = new InMemoryItemRepository();
        AuditLog audit = new AuditLog();
        InventoryService service = new InventoryService.Builder()
            .repository(repository)
            .audit(audit)
            .build();

        service.restock(List.of(new Item("A-100", 3), new Item("B-200", 40)));
        service.reserve("A-100");
        service.reserve("B-200", 10);

        System.out.println("low stock: " + service.lowStock());
        audit.dump();
    }
}
