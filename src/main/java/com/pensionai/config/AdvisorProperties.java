package com.pensionai.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "advisor")
public class AdvisorProperties {

    private int turnCap = 5;
    private int previewLength = 200;
    private int refusalPreviewLength = 400;
    private Duration runTimeout = Duration.ofSeconds(120);
    private int orchestrationConcurrency = 8;
    private AiProvider aiProvider = AiProvider.GOOGLE;
    private String model;
    private RetryConfig retry = new RetryConfig();
    private AnalyticsConfig analytics = new AnalyticsConfig();

    public enum AiProvider {
        GOOGLE, OPENAI
    }

    public static class RetryConfig {
        private int maxAttempts = 2;
        private Duration waitDuration = Duration.ofMillis(300);

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public Duration getWaitDuration() { return waitDuration; }
        public void setWaitDuration(Duration waitDuration) { this.waitDuration = waitDuration; }
    }

    public static class AnalyticsConfig {
        private String baseUrl = "http://localhost:8090";
        private Duration timeout = Duration.ofSeconds(10);

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
    }

    public int getTurnCap() {
        return turnCap;
    }

    public void setTurnCap(int turnCap) {
        this.turnCap = turnCap;
    }

    public int getPreviewLength() {
        return previewLength;
    }

    public void setPreviewLength(int previewLength) {
        this.previewLength = previewLength;
    }

    public int getRefusalPreviewLength() {
        return refusalPreviewLength;
    }

    public void setRefusalPreviewLength(int refusalPreviewLength) {
        this.refusalPreviewLength = refusalPreviewLength;
    }

    public Duration getRunTimeout() {
        return runTimeout;
    }

    public void setRunTimeout(Duration runTimeout) {
        this.runTimeout = runTimeout;
    }

    public int getOrchestrationConcurrency() {
        return orchestrationConcurrency;
    }

    public void setOrchestrationConcurrency(int orchestrationConcurrency) {
        this.orchestrationConcurrency = orchestrationConcurrency;
    }

    public AiProvider getAiProvider() {
        return aiProvider;
    }

    public void setAiProvider(AiProvider aiProvider) {
        this.aiProvider = aiProvider;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public RetryConfig getRetry() {
        return retry;
    }

    public void setRetry(RetryConfig retry) {
        this.retry = retry != null ? retry : new RetryConfig();
    }

    public AnalyticsConfig getAnalytics() {
        return analytics;
    }

    public void setAnalytics(AnalyticsConfig analytics) {
        this.analytics = analytics != null ? analytics : new AnalyticsConfig();
    }
}
