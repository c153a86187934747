package com.pensionai.orchestration.routing;

import com.pensionai.orchestration.api.RouteClassifier;
import com.pensionai.orchestration.model.ConversationMessage;
import com.pensionai.orchestration.model.ConversationState;
import com.pensionai.orchestration.model.StepName;
import com.pensionai.orchestration.service.CollaboratorRetry;
import com.pensionai.orchestration.service.CollaboratorTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Default routing: finished charts lead to consolidation, fresh worker output is checked
 * against the trigger table, and anything else goes to the route classifier.
 */
@Component
@Slf4j
public class SupervisorRoutingPolicy implements RoutingPolicy {

    private final RouteClassifier routeClassifier;
    private final CollaboratorRetry collaboratorRetry;
    private final List<VisualizationTrigger> triggers;

    public SupervisorRoutingPolicy(RouteClassifier routeClassifier, CollaboratorRetry collaboratorRetry) {
        this.routeClassifier = routeClassifier;
        this.collaboratorRetry = collaboratorRetry;
        this.triggers = VisualizationTrigger.defaults();
    }

    @Override
    public StepName decide(ConversationState state) {
        if (state.hasChartData() || state.isVisualized()) {
            log.debug("Run {}: charts already produced, consolidating.", state.context().runId());
            return StepName.CONSOLIDATE;
        }
        if (state.workerJustRan()) {
            Optional<VisualizationTrigger> trigger = findTrigger(state);
            if (trigger.isPresent()) {
                log.info("Run {}: visualization triggered by '{}'.", state.context().runId(), trigger.get().name());
                return StepName.VISUALIZE;
            }
            return StepName.CONSOLIDATE;
        }
        return classifyFreshQuery(state);
    }

    public Optional<VisualizationTrigger> findTrigger(ConversationState state) {
        String userMessage = state.latestUserMessage().map(ConversationMessage::content).orElse("");
        return triggers.stream()
                .filter(trigger -> trigger.matches(userMessage, state.ledger()))
                .findFirst();
    }

    private StepName classifyFreshQuery(ConversationState state) {
        String conversation = state.conversationText();
        StepName decision;
        try {
            decision = collaboratorRetry.call("route-classifier", state.deadline(),
                    () -> routeClassifier.classify(conversation));
        } catch (CollaboratorTimeoutException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            log.warn("Run {}: route classification failed, finishing. Cause: {}", state.context().runId(), ex.getMessage());
            return StepName.FINISH;
        }
        if (decision == null) {
            return StepName.FINISH;
        }
        if (decision == StepName.VISUALIZE) {
            // nothing to chart before any worker ran
            log.warn("Run {}: classifier chose visualize for a fresh query, finishing.", state.context().runId());
            return StepName.FINISH;
        }
        log.info("Run {}: fresh query routed to {}.", state.context().runId(), decision);
        return decision;
    }
}
