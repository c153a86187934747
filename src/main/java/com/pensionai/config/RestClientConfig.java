package com.pensionai.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpRequest;
import org.springframework.http.client.BufferingClientHttpRequestFactory;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.lang.Nullable;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Adds wire logging to every {@code RestClient.Builder} handed out by Spring Boot. Bodies are
 * buffered so the logger can read them without consuming the stream. Wire logging is emitted
 * at DEBUG on the {@code com.pensionai.http} logger.
 * <p>
 * The analytics timeout applies only to {@code analyticsRestClient}; the AI provider clients
 * keep their own timeouts.
 */
@Configuration
public class RestClientConfig {

    @Bean
    public RestClientCustomizer wireLoggingRestClientCustomizer() {
        return builder -> {
            builder.requestFactory(new BufferingClientHttpRequestFactory(new SimpleClientHttpRequestFactory()));
            builder.requestInterceptor(new WireLoggingInterceptor());
        };
    }

    @Bean
    public RestClient analyticsRestClient(RestClient.Builder restClientBuilder, AdvisorProperties properties) {
        AdvisorProperties.AnalyticsConfig analytics = properties.getAnalytics();
        return restClientBuilder.clone()
                .baseUrl(analytics.getBaseUrl())
                .requestFactory(new BufferingClientHttpRequestFactory(analyticsRequestFactory(analytics.getTimeout())))
                .build();
    }

    static SimpleClientHttpRequestFactory analyticsRequestFactory(@Nullable Duration timeout) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        if (timeout != null) {
            requestFactory.setConnectTimeout(timeout);
            requestFactory.setReadTimeout(timeout);
        }
        return requestFactory;
    }

    static class WireLoggingInterceptor implements ClientHttpRequestInterceptor {

        private static final Logger httpLogger = LoggerFactory.getLogger("com.pensionai.http");

        @Override
        public ClientHttpResponse intercept(HttpRequest request, byte[] body, ClientHttpRequestExecution execution)
                throws IOException {
            if (httpLogger.isDebugEnabled()) {
                httpLogger.debug("HTTP {} {} body={}", request.getMethod(), request.getURI(),
                        body.length > 0 ? new String(body, StandardCharsets.UTF_8) : "<empty>");
            }
            ClientHttpResponse response = execution.execute(request, body);
            if (httpLogger.isDebugEnabled()) {
                byte[] responseBody = StreamUtils.copyToByteArray(response.getBody());
                httpLogger.debug("HTTP {} {} -> {} body={}", request.getMethod(), request.getURI(),
                        response.getStatusCode(), new String(responseBody, StandardCharsets.UTF_8));
            }
            return response;
        }
    }
}
