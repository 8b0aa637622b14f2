package com.ryuqq.railway.core.workflow.fixture;

public record Prefix(String value) {
}
