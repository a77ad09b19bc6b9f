package com.delta.notifier.model;

import java.util.List;

public record CommandResponse(String subscriberId, List<String> replies) {
}
