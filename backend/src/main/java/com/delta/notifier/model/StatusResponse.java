package com.delta.notifier.model;

import java.util.Map;

public record StatusResponse(
    boolean dbConnectivity,
    Map<String, Long> counts,
    int activeSchedules
) {
}
