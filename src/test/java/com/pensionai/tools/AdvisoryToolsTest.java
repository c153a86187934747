package com.pensionai.tools;

import com.pensionai.orchestration.model.AnalysisKind;
import com.pensionai.orchestration.model.RequestContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.model.ToolContext;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class AdvisoryToolsTest {

    private FinancialAnalyticsClient analyticsClient;
    private AdvisoryTools tools;

    @BeforeEach
    void setUp() {
        analyticsClient = mock(FinancialAnalyticsClient.class);
        tools = new AdvisoryTools(analyticsClient);
    }

    private static ToolContext contextFor(String userId) {
        return new ToolContext(new RequestContext("run-" + userId, userId).toolContext());
    }

    @Test
    void testEachToolFetchesItsAnalysisForTheContextUser() {
        when(analyticsClient.fetch(any(AnalysisKind.class), anyString()))
                .thenAnswer(invocation -> Map.of("kind", invocation.getArgument(0, AnalysisKind.class).resource()));

        assertEquals("risk", tools.analyzeRiskProfile(contextFor("user-7")).get("kind"));
        assertEquals("fraud", tools.detectFraud(contextFor("user-7")).get("kind"));
        assertEquals("projection", tools.projectPension(contextFor("user-7")).get("kind"));

        verify(analyticsClient).fetch(AnalysisKind.RISK, "user-7");
        verify(analyticsClient).fetch(AnalysisKind.FRAUD, "user-7");
        verify(analyticsClient).fetch(AnalysisKind.PROJECTION, "user-7");
    }

    @Test
    void testMissingUserReturnsErrorWithoutCallingAnalytics() {
        ToolContext anonymous = new ToolContext(new RequestContext("run-anon", null).toolContext());

        Map<String, Object> result = tools.detectFraud(anonymous);

        assertEquals(AdvisoryTools.NOT_AUTHENTICATED, result.get("error"));
        verifyNoInteractions(analyticsClient);
    }

    @Test
    void testConcurrentRunsKeepTheirOwnUser() throws Exception {
        when(analyticsClient.fetch(any(AnalysisKind.class), anyString()))
                .thenAnswer(invocation -> Map.of("user", invocation.getArgument(1, String.class)));
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Callable<Object> alice = () -> {
                start.await();
                return tools.projectPension(contextFor("alice")).get("user");
            };
            Callable<Object> bob = () -> {
                start.await();
                return tools.projectPension(contextFor("bob")).get("user");
            };
            List<Future<Object>> futures = List.of(executor.submit(alice), executor.submit(bob));
            start.countDown();

            assertEquals("alice", futures.get(0).get());
            assertEquals("bob", futures.get(1).get());
        } finally {
            executor.shutdownNow();
        }
    }
}
