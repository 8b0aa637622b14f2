package com.ryuqq.railway.core.workflow.fixture;

public record Greeting(String text) {
}
