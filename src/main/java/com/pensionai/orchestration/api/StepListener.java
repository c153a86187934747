package com.pensionai.orchestration.api;

import com.pensionai.orchestration.model.StepEvent;

@FunctionalInterface
public interface StepListener {

    StepListener NONE = event -> { };

    void onStep(StepEvent event);
}
