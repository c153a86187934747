package com.pensionai.orchestration.api;

import com.pensionai.orchestration.model.StepName;

/**
 * Natural-language understanding used to pick the first step of a fresh query.
 */
public interface RouteClassifier {

    /**
     * Chooses the step that should handle the conversation.
     *
     * @param conversationText The rendered conversation, oldest message first.
     * @return The chosen step; unknown answers are reported as {@link StepName#FINISH}.
     */
    StepName classify(String conversationText);
}
