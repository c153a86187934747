package com.pensionai.orchestration.routing;

import com.pensionai.orchestration.model.ConversationState;
import com.pensionai.orchestration.model.StepName;

/**
 * Decides which step runs next. Implementations read the state and never mutate it.
 */
public interface RoutingPolicy {

    StepName decide(ConversationState state);
}
