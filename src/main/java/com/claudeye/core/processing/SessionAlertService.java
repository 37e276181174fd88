package com.claudeye.core.processing;

import com.claudeye.core.cache.CacheEntry;
import com.claudeye.core.cache.CacheKind;
import com.claudeye.core.cache.CacheManager;
import com.claudeye.core.evals.AlertContext;
import com.claudeye.core.evals.AlertDispatcher;
import com.claudeye.core.evals.EnrichRunResult;
import com.claudeye.core.evals.EnrichRunSummary;
import com.claudeye.core.evals.EvalRegistry;
import com.claudeye.core.evals.EvalRunResult;
import com.claudeye.core.evals.EvalRunSummary;
import com.claudeye.core.evals.EvalsModuleLoader;
import com.claudeye.core.evals.RegisteredEnricher;
import com.claudeye.core.evals.RegisteredEval;
import com.claudeye.core.scheduler.SessionSettledListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Optional;

/**
 * Fires alerts for a session once every session-scoped eval and enrichment
 * has a valid cached result for the session's current transcript.
 * Subagent work never fires alerts.
 */
@Service
public class SessionAlertService implements SessionSettledListener {

    private static final Logger log = LoggerFactory.getLogger(SessionAlertService.class);

    private final EvalsModuleLoader moduleLoader;
    private final EvalRegistry registry;
    private final CacheManager cache;
    private final AlertDispatcher dispatcher;

    public SessionAlertService(EvalsModuleLoader moduleLoader, EvalRegistry registry,
                               CacheManager cache, AlertDispatcher dispatcher) {
        this.moduleLoader = moduleLoader;
        this.registry = registry;
        this.cache = cache;
        this.dispatcher = dispatcher;
    }

    @Override
    public void onSessionSettled(String projectName, String sessionId) {
        if (sessionId.contains("/agent-")) {
            return;
        }
        tryFire(projectName, sessionId);
    }

    /** @return true when alerts were dispatched */
    public boolean tryFire(String projectName, String sessionId) {
        try {
            if (!registry.hasAlerts()) {
                return false;
            }
            moduleLoader.ensureLoaded();
            String contentHash = cache.hasher().hashSessionFile(projectName, sessionId);
            if (contentHash.isEmpty()) {
                return false;
            }

            var evalResults = new ArrayList<EvalRunResult>();
            for (RegisteredEval eval : registry.sessionScopedEvals()) {
                Optional<EvalRunResult> cached = cache.getPerItem(CacheKind.EVALS, projectName, sessionId,
                                eval.name(), cache.hasher().hashItemCode(eval.fn()), contentHash, EvalRunResult.class)
                        .map(CacheEntry::value);
                if (cached.isEmpty()) {
                    return false;
                }
                evalResults.add(cached.get());
            }
            var enrichResults = new ArrayList<EnrichRunResult>();
            for (RegisteredEnricher enricher : registry.sessionScopedEnrichers()) {
                Optional<EnrichRunResult> cached = cache.getPerItem(CacheKind.ENRICHMENTS, projectName, sessionId,
                                enricher.name(), cache.hasher().hashItemCode(enricher.fn()), contentHash,
                                EnrichRunResult.class)
                        .map(CacheEntry::value);
                if (cached.isEmpty()) {
                    return false;
                }
                enrichResults.add(cached.get());
            }

            log.debug("All results cached for {}/{}, firing alerts", projectName, sessionId);
            dispatcher.fire(new AlertContext(projectName, sessionId,
                    evalResults.isEmpty() ? null : EvalRunSummary.of(evalResults,
                            evalResults.stream().mapToLong(EvalRunResult::durationMs).sum()),
                    enrichResults.isEmpty() ? null : EnrichRunSummary.of(enrichResults,
                            enrichResults.stream().mapToLong(EnrichRunResult::durationMs).sum())));
            return true;
        } catch (RuntimeException e) {
            log.warn("Alert check for {}/{} failed: {}", projectName, sessionId, e.getMessage(), e);
            return false;
        }
    }
}
