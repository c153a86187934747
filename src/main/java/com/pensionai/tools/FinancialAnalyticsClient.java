package com.pensionai.tools;

import com.pensionai.orchestration.model.AnalysisKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Client of the remote analytics service that owns the pension, risk and fraud calculations.
 * Failures are reported back as an {@code error} object so the calling worker can explain them.
 */
@Component
@Slf4j
public class FinancialAnalyticsClient {

    private static final ParameterizedTypeReference<Map<String, Object>> JSON_OBJECT = new ParameterizedTypeReference<>() {
    };

    private final RestClient restClient;

    public FinancialAnalyticsClient(@Qualifier("analyticsRestClient") RestClient restClient) {
        this.restClient = restClient;
    }

    public Map<String, Object> fetch(AnalysisKind kind, String userId) {
        try {
            Map<String, Object> body = restClient.get()
                    .uri("/analytics/{userId}/{resource}", userId, kind.resource())
                    .retrieve()
                    .body(JSON_OBJECT);
            if (body == null || body.isEmpty()) {
                return error("The analytics service returned no %s data for user %s.".formatted(kind.resource(), userId));
            }
            return body;
        } catch (RestClientResponseException ex) {
            if (ex.getStatusCode().isSameCodeAs(HttpStatus.NOT_FOUND)) {
                return error("No pension data found for user %s.".formatted(userId));
            }
            log.warn("Analytics {} request for user {} failed with status {}.", kind.resource(), userId, ex.getStatusCode());
            return error("The analytics service failed with status %d.".formatted(ex.getStatusCode().value()));
        } catch (RestClientException ex) {
            log.warn("Analytics {} request for user {} failed: {}", kind.resource(), userId, ex.getMessage());
            return error("The analytics service is unavailable.");
        }
    }

    static Map<String, Object> error(String message) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("error", message);
        return error;
    }
}
