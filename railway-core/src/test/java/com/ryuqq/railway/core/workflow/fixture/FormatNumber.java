package com.ryuqq.railway.core.workflow.fixture;

import com.ryuqq.railway.core.step.Step;

public class FormatNumber implements Step<Integer, String> {

    @Override
    public String run(Integer input) {
        return String.valueOf(input);
    }
}
