package com.pensionai.orchestration.service;

import com.pensionai.orchestration.api.RouteClassifier;
import com.pensionai.orchestration.model.RouteDecision;
import com.pensionai.orchestration.model.StepName;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import static com.pensionai.orchestration.OrchestrationConstants.INVALID_JSON_RETRY_PROMPT;
import static com.pensionai.orchestration.OrchestrationConstants.PURPOSE_ROUTE;
import static com.pensionai.orchestration.OrchestrationConstants.PURPOSE_ROUTE_RETRY;
import static com.pensionai.orchestration.OrchestrationConstants.ROUTE_SYSTEM_PROMPT;
import static com.pensionai.orchestration.OrchestrationConstants.ROUTE_USER_TEMPLATE;

@Service
@RequiredArgsConstructor
@Slf4j
public class ChatRouteClassifier implements RouteClassifier {

    private final ChatRequestFactory chatRequestFactory;
    private final JsonProcessingService jsonProcessingService;

    @Override
    public StepName classify(String conversationText) {
        RouteDecision decision = request(PURPOSE_ROUTE, ROUTE_SYSTEM_PROMPT, conversationText);
        if (decision == null) {
            decision = request(PURPOSE_ROUTE_RETRY, ROUTE_SYSTEM_PROMPT + INVALID_JSON_RETRY_PROMPT, conversationText);
        }
        if (decision == null) {
            log.warn("Route classifier returned no usable decision, finishing.");
            return StepName.FINISH;
        }
        StepName step = StepName.parse(decision.next());
        log.debug("Route classifier chose {} (raw='{}', reason='{}').", step, decision.next(), decision.reason());
        return step;
    }

    private @Nullable RouteDecision request(String purpose, String systemPrompt, String conversationText) {
        String response = chatRequestFactory.prompt(purpose)
                .system(systemPrompt)
                .user(user -> user.text(ROUTE_USER_TEMPLATE).param("conversation", conversationText))
                .call()
                .content();
        return jsonProcessingService.parseJsonResponse(purpose, response, RouteDecision.class);
    }
}
