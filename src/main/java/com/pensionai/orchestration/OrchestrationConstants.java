package com.pensionai.orchestration;

public final class OrchestrationConstants {

    private OrchestrationConstants() {
    }

    // LLM request purposes
    public static final String PURPOSE_ROUTE = "route";
    public static final String PURPOSE_ROUTE_RETRY = "route-retry";
    public static final String PURPOSE_WORKER = "worker";
    public static final String PURPOSE_SYNTHESIS = "synthesis";

    // Message tags written by the visualization step
    public static final String TAG_CHART_SPECS = "[CHART_SPECS]";
    public static final String TAG_CHART_IMAGES = "[CHART_IMAGES]";
    public static final String TAG_PLOTLY_FIGS = "[PLOTLY_FIGS]";
    public static final String TAG_INDICATORS = "[INDICATORS]";

    // Fixed texts
    public static final String NO_USER_MESSAGE = "No user message found to process.";
    public static final String EMPTY_WORKER_OUTPUT = "The %s worker returned no output.";
    public static final String NO_DATA_NOTICE =
            "I could not find any data to answer your question. Please check that your account has pension data and try again.";
    public static final String CLOSING_NOTICE =
            "Thanks for getting in touch. There is nothing further to analyse for this request.";
    public static final String BEST_EFFORT_HEADER = "Here is what was gathered before the analysis stopped:";
    public static final String REFUSAL_TEMPLATE = """
            I can only help with questions about your pension, savings, risk profile and account activity. \
            I am not able to offer guidance on religion, politics, or specific investments such as buying or \
            selling individual assets.""";
    public static final String REFUSAL_DATA_HEADER = "Underlying data (preview):";
    public static final String INVALID_JSON_RETRY_PROMPT = "\nYour last response was invalid JSON. Return only valid JSON.";

    public static final String ROUTE_SYSTEM_PROMPT = """
            You route questions for a pension advisory service to exactly one specialist.

            Specialists:
            - risk: financial risk, volatility, portfolio diversity, risk profile.
            - fraud: suspicious transactions, fraud checks, account activity that looks wrong.
            - projection: future pension value, growth, retirement goals, savings progress.
            - consolidate: use when the specialists have already answered and only a final summary is missing.
            - finish: use only when the user is saying goodbye or there is nothing to analyse.

            Pick the single specialist that best addresses the most recent user message.
            Return only JSON: {"next": "<risk|fraud|projection|consolidate|finish>", "reason": "one short sentence"}
            """;
    public static final String ROUTE_USER_TEMPLATE = """
            Conversation so far:
            {conversation}
            """;

    public static final String SYNTHESIS_SYSTEM_PROMPT = """
            You are a pension advisor talking directly to the account holder. A team of analysts has gathered \
            data about their account; their findings are in the conversation history below, including raw tool \
            results. Combine them into one clear, friendly answer. Quote the concrete figures you find. \
            Do not mention analysts, tools or internal steps, and do not recommend buying or selling specific assets.""";
    public static final String SYNTHESIS_USER_TEMPLATE = """
            Conversation history:
            {messages}

            Write the final answer for the user based on these results.
            """;

    public static final String RISK_WORKER_PROMPT = """
            You assess the financial risk profile of the current account holder.
            Call the analyze_risk_profile tool once; the account holder is resolved for you, never invent a user id.
            Report the risk level, the risk score, the main risk factors, the positive factors and practical ways to reduce risk.
            If the tool reports an error, explain it plainly.
            """;
    public static final String FRAUD_WORKER_PROMPT = """
            You check the current account holder's recent activity for fraud.
            Call the detect_fraud tool once; the account holder is resolved for you, never invent a user id.
            State whether activity looks fraudulent, the confidence score and the reasoning behind it.
            If the tool reports an error, explain it plainly.
            """;
    public static final String PROJECTION_WORKER_PROMPT = """
            You project the pension of the current account holder.
            Call the project_pension tool once; the account holder is resolved for you, never invent a user id.
            Report current savings against the goal, progress, years remaining, savings rate and the projected balance at retirement.
            If the tool reports an error, explain it plainly.
            """;
}
