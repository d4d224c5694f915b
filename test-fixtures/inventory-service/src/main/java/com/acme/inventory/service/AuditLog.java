package com.acme.inventory.service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class AuditLog {

    private final List<String> entries = new ArrayList<>();

    public void record(String event, String sku) {
        String line = Instant.now() + " " + event + " " + sku;
        entries.add(line);
        System.out.println(line);
    }

    public List<String> entries() {
        return Collections.unmodifiableList(entries);
    }

    public void dump() {
        System.out.println("audit log:");
        for (String entry : entries) {
            System.out.println(entry);
        }
        System.out.println("end");
    }
}
