package com.ryuqq.railway.testkit.contract.fixture;

import com.ryuqq.railway.core.schedule.ManifestProperties;

public record Order(String orderId, int quantity) implements ManifestProperties {
}
