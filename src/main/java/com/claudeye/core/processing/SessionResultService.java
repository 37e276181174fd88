package com.claudeye.core.processing;

import com.claudeye.core.cache.CacheKind;
import com.claudeye.core.cache.CacheManager;
import com.claudeye.core.evals.EnrichRunSummary;
import com.claudeye.core.evals.EnrichmentRunner;
import com.claudeye.core.evals.EvalContext;
import com.claudeye.core.evals.EvalRegistry;
import com.claudeye.core.evals.EvalRunSummary;
import com.claudeye.core.evals.EvalRunner;
import com.claudeye.core.evals.EvalsModuleLoader;
import com.claudeye.core.evals.FilterComputeSummary;
import com.claudeye.core.evals.FilterRunner;
import com.claudeye.core.evals.RegisteredEnricher;
import com.claudeye.core.evals.RegisteredEval;
import com.claudeye.core.evals.RegisteredFilter;
import com.claudeye.core.transcript.SessionLog;
import com.claudeye.core.transcript.SessionLogLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;

/**
 * Whole-batch runs for one session, cached as a single summary keyed by the
 * set of registered item names.
 */
@Service
public class SessionResultService {

    private static final Logger log = LoggerFactory.getLogger(SessionResultService.class);

    private final EvalsModuleLoader moduleLoader;
    private final EvalRegistry registry;
    private final CacheManager cache;
    private final SessionLogLoader logLoader;
    private final EvalRunner evalRunner;
    private final EnrichmentRunner enrichmentRunner;
    private final FilterRunner filterRunner;

    public SessionResultService(EvalsModuleLoader moduleLoader, EvalRegistry registry, CacheManager cache,
                                SessionLogLoader logLoader, EvalRunner evalRunner,
                                EnrichmentRunner enrichmentRunner, FilterRunner filterRunner) {
        this.moduleLoader = moduleLoader;
        this.registry = registry;
        this.cache = cache;
        this.logLoader = logLoader;
        this.evalRunner = evalRunner;
        this.enrichmentRunner = enrichmentRunner;
        this.filterRunner = filterRunner;
    }

    public BatchOutcome<EvalRunSummary> runEvals(String projectName, String sessionId, boolean forceRefresh) {
        try {
            moduleLoader.ensureLoaded();
            List<RegisteredEval> evals = registry.sessionScopedEvals();
            if (evals.isEmpty()) {
                return BatchOutcome.nothingRegistered();
            }
            List<String> names = evals.stream().map(RegisteredEval::name).toList();
            if (!forceRefresh) {
                var cached = cache.getWholeResult(CacheKind.EVALS, projectName, sessionId, names,
                        EvalRunSummary.class);
                if (cached.isPresent()) {
                    return BatchOutcome.fromCache(cached.get().value());
                }
            }
            EvalRunSummary summary = evalRunner.run(evals, load(projectName, sessionId));
            cache.setWholeResult(CacheKind.EVALS, projectName, sessionId, summary, names);
            return BatchOutcome.computed(summary);
        } catch (Exception e) {
            return failed("evals", projectName, sessionId, e);
        }
    }

    public BatchOutcome<EnrichRunSummary> runEnrichments(String projectName, String sessionId,
                                                         boolean forceRefresh) {
        try {
            moduleLoader.ensureLoaded();
            List<RegisteredEnricher> enrichers = registry.sessionScopedEnrichers();
            if (enrichers.isEmpty()) {
                return BatchOutcome.nothingRegistered();
            }
            List<String> names = enrichers.stream().map(RegisteredEnricher::name).toList();
            if (!forceRefresh) {
                var cached = cache.getWholeResult(CacheKind.ENRICHMENTS, projectName, sessionId, names,
                        EnrichRunSummary.class);
                if (cached.isPresent()) {
                    return BatchOutcome.fromCache(cached.get().value());
                }
            }
            EnrichRunSummary summary = enrichmentRunner.run(enrichers, load(projectName, sessionId));
            cache.setWholeResult(CacheKind.ENRICHMENTS, projectName, sessionId, summary, names);
            return BatchOutcome.computed(summary);
        } catch (Exception e) {
            return failed("enrichments", projectName, sessionId, e);
        }
    }

    /**
     * Filter values of one view for one session, cached under
     * {@code filters/{project}/{view}/{session}} against the session's content hash.
     */
    public BatchOutcome<FilterComputeSummary> computeFilters(String view, String projectName, String sessionId) {
        try {
            moduleLoader.ensureLoaded();
            List<RegisteredFilter> filters = registry.filtersForView(view);
            if (filters.isEmpty()) {
                return BatchOutcome.nothingRegistered();
            }
            List<String> names = filters.stream().map(RegisteredFilter::name).toList();
            String sessionKey = view + "/" + sessionId;
            String contentHash = cache.hasher().hashSessionFile(projectName, sessionId);
            var cached = cache.getWholeResult(CacheKind.FILTERS, projectName, sessionKey, names,
                    FilterComputeSummary.class, contentHash);
            if (cached.isPresent()) {
                return BatchOutcome.fromCache(cached.get().value());
            }
            FilterComputeSummary summary = filterRunner.run(filters, load(projectName, sessionId));
            cache.setWholeResult(CacheKind.FILTERS, projectName, sessionKey, summary, names, contentHash);
            return BatchOutcome.computed(summary);
        } catch (Exception e) {
            return failed("filters", projectName, sessionId, e);
        }
    }

    private EvalContext load(String projectName, String sessionId) throws IOException {
        SessionLog sessionLog = logLoader.load(projectName, sessionId);
        return EvalContext.forSession(sessionLog.entries(), sessionLog.stats(), projectName, sessionId);
    }

    private static <S> BatchOutcome<S> failed(String kind, String projectName, String sessionId, Exception e) {
        String message = e.getMessage() != null ? e.getMessage() : e.toString();
        log.warn("Running {} for {}/{} failed: {}", kind, projectName, sessionId, message);
        return BatchOutcome.failure(message);
    }
}
