package com.ryuqq.railway.testkit.contract.fixture;

import com.ryuqq.railway.core.step.Step;

public class IntToString implements Step<Integer, String> {

    @Override
    public String run(Integer input) {
        return String.valueOf(input);
    }
}
