package com.delta.notifier.model;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One listing row extracted from the source document.
 *
 * <p>{@code organization} is always present; every other field may be null. Columns the
 * parser does not map onto a named field are kept, in table order, in {@code extraFields}.
 */
public record Entry(
    String organization,
    String role,
    String location,
    String link,
    String applicationLink,
    LocalDate postedDate,
    Map<String, String> extraFields
) {
    private static final String MISSING = "N/A";

    public Entry {
        Objects.requireNonNull(organization, "organization is required");
        if (organization.isBlank()) {
            throw new IllegalArgumentException("organization must not be blank");
        }
        extraFields = extraFields == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(extraFields));
    }

    public Entry(String organization, String role, String location, String link, String applicationLink, LocalDate postedDate) {
        this(organization, role, location, link, applicationLink, postedDate, Map.of());
    }

    /**
     * Dedup key: organization followed by role. Re-listing with a new date or link keeps
     * the same identity; two postings sharing organization and role text collide.
     */
    public String identity() {
        return organization + (role == null ? MISSING : role);
    }
}
