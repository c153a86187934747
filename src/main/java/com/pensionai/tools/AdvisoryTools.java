package com.pensionai.tools;

import com.pensionai.orchestration.model.AnalysisKind;
import com.pensionai.orchestration.model.RequestContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.model.ToolContext;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Analysis tools available to the specialist workers. The user is taken from the tool
 * context of the call, never from model-generated arguments.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AdvisoryTools {

    static final String NOT_AUTHENTICATED = "No authenticated user is associated with this request.";

    private final FinancialAnalyticsClient analyticsClient;

    @Tool(name = "analyze_risk_profile",
            description = "Returns the current user's financial risk profile as JSON: risk_level, risk_score, risk factors and positive factors.")
    public Map<String, Object> analyzeRiskProfile(ToolContext toolContext) {
        return analyse(AnalysisKind.RISK, toolContext);
    }

    @Tool(name = "detect_fraud",
            description = "Checks the current user's recent transactions for fraud. Returns JSON with is_fraudulent, confidence_score and reasoning.")
    public Map<String, Object> detectFraud(ToolContext toolContext) {
        return analyse(AnalysisKind.FRAUD, toolContext);
    }

    @Tool(name = "project_pension",
            description = "Projects the current user's pension. Returns JSON with current_savings, projected_balance, years_remaining and related figures.")
    public Map<String, Object> projectPension(ToolContext toolContext) {
        return analyse(AnalysisKind.PROJECTION, toolContext);
    }

    private Map<String, Object> analyse(AnalysisKind kind, ToolContext toolContext) {
        Object userId = toolContext == null ? null : toolContext.getContext().get(RequestContext.USER_ID_KEY);
        if (!(userId instanceof String id) || id.isBlank()) {
            log.warn("Tool {} called without a user in the tool context.", kind.toolName());
            return FinancialAnalyticsClient.error(NOT_AUTHENTICATED);
        }
        return analyticsClient.fetch(kind, id);
    }
}
