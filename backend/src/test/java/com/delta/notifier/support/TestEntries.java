package com.delta.notifier.support;

import com.delta.notifier.model.Entry;

import java.time.LocalDate;
import java.util.UUID;

public final class TestEntries {
    private TestEntries() {
    }

    public static Entry entry(String organization, String role) {
        return new Entry(
            organization,
            role,
            "Remote",
            "https://" + organization.toLowerCase().replace(' ', '-') + ".example",
            "https://apply.example/" + organization.toLowerCase().replace(' ', '-'),
            LocalDate.of(2025, 1, 5)
        );
    }

    public static Entry relisted(Entry entry, LocalDate postedDate, String location) {
        return new Entry(
            entry.organization(),
            entry.role(),
            location,
            entry.link(),
            entry.applicationLink(),
            postedDate
        );
    }

    public static String uniqueId(String prefix) {
        return prefix + "-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
