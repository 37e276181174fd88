package com.claudeye.dispatch.api;

import com.claudeye.core.processing.BatchOutcome;
import com.claudeye.core.processing.SessionResultService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Whole-batch results for one session, served from the whole-result cache when valid.
 */
@RestController
@RequestMapping("/api/sessions/{projectName}/{sessionId}")
public class SessionResultsController {

    private final SessionResultService resultService;

    public SessionResultsController(SessionResultService resultService) {
        this.resultService = resultService;
    }

    @GetMapping("/evals")
    public ResponseEntity<BatchOutcome<?>> evals(@PathVariable String projectName,
                                                 @PathVariable String sessionId,
                                                 @RequestParam(defaultValue = "false") boolean forceRefresh) {
        return respond(resultService.runEvals(projectName, sessionId, forceRefresh));
    }

    @GetMapping("/enrichments")
    public ResponseEntity<BatchOutcome<?>> enrichments(@PathVariable String projectName,
                                                       @PathVariable String sessionId,
                                                       @RequestParam(defaultValue = "false") boolean forceRefresh) {
        return respond(resultService.runEnrichments(projectName, sessionId, forceRefresh));
    }

    @GetMapping("/filters/{view}")
    public ResponseEntity<BatchOutcome<?>> filters(@PathVariable String projectName,
                                                   @PathVariable String sessionId,
                                                   @PathVariable String view) {
        return respond(resultService.computeFilters(view, projectName, sessionId));
    }

    private static ResponseEntity<BatchOutcome<?>> respond(BatchOutcome<?> outcome) {
        return outcome.ok() ? ResponseEntity.ok(outcome) : ResponseEntity.internalServerError().body(outcome);
    }
}
