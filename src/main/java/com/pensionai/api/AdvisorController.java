package com.pensionai.api;

import com.pensionai.orchestration.AdvisoryRunService;
import com.pensionai.orchestration.model.RequestContext;
import com.pensionai.orchestration.model.RunSummary;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;

@RestController
@RequestMapping("/api/advisor")
public class AdvisorController {

    private final AdvisoryRunService runService;

    public AdvisorController(AdvisoryRunService runService) {
        this.runService = runService;
    }

    @PostMapping("/query")
    public QueryResponse query(@Valid @RequestBody QueryRequest request) {
        RequestContext context = RequestContext.forUser(request.userId());
        return QueryResponse.from(context.runId(), runService.answer(request.message(), context));
    }

    @PostMapping("/stream")
    public StreamStartResponse stream(@Valid @RequestBody QueryRequest request) {
        String runId = runService.startStreaming(request.message(), request.userId());
        return new StreamStartResponse(runId, Instant.now());
    }

    @PostMapping("/cancel/{runId}")
    public CancelRunResponse cancel(@PathVariable String runId) {
        return runService.cancel(runId) ? CancelRunResponse.success() : CancelRunResponse.notFound();
    }

    @GetMapping("/runs/{runId}")
    public RunSummary run(@PathVariable String runId) {
        return runService.findRun(runId).orElseThrow(() -> new RunNotFoundException(runId));
    }
}
