package com.ryuqq.railway.testkit.contract.fixture;

public record Receipt(String orderId, String status) {
}
