package com.ryuqq.railway.core.workflow.fixture;

import com.ryuqq.railway.core.step.Step;

public class ParseNumber implements Step<String, Integer> {

    @Override
    public Integer run(String input) {
        return Integer.parseInt(input.trim());
    }
}
