package com.ryuqq.railway.testkit.contract.fixture;

import com.ryuqq.railway.application.effect.EffectRunner;
import com.ryuqq.railway.application.effect.EffectWorkflow;
import com.ryuqq.railway.core.result.Result;

import java.time.Clock;

public class FormatNumberWorkflow extends EffectWorkflow<Integer, String> {

    public FormatNumberWorkflow(EffectRunner effectRunner, Clock clock) {
        super(effectRunner, clock);
    }

    @Override
    protected Result<String> runInternal(Integer input) {
        return activate(input)
            .chain(IntToString.class)
            .resolve();
    }
}
