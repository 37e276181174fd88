package com.claudeye.core.processing;

import com.claudeye.core.cache.CacheKind;
import com.claudeye.core.cache.CacheManager;
import com.claudeye.core.cache.CacheEntry;
import com.claudeye.core.cache.ContentHasher;
import com.claudeye.core.evals.ActionContext;
import com.claudeye.core.evals.ActionRunResult;
import com.claudeye.core.evals.ActionRunner;
import com.claudeye.core.evals.EnrichRunResult;
import com.claudeye.core.evals.EnrichmentRunner;
import com.claudeye.core.evals.EvalContext;
import com.claudeye.core.evals.EvalRegistry;
import com.claudeye.core.evals.EvalRunResult;
import com.claudeye.core.evals.EvalRunner;
import com.claudeye.core.evals.EvalsModuleLoader;
import com.claudeye.core.evals.RegisteredAction;
import com.claudeye.core.evals.RegisteredEnricher;
import com.claudeye.core.evals.RegisteredEval;
import com.claudeye.core.transcript.SessionLog;
import com.claudeye.core.transcript.SessionLogLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Single-item workers handed to the work queue: run one named eval,
 * enrichment or action against one session or subagent, going through the
 * per-item cache.
 * <p>
 * These never throw; every failure comes back as {@link ItemOutcome#failure}.
 */
@Service
public class SessionItemProcessor {

    private static final Logger log = LoggerFactory.getLogger(SessionItemProcessor.class);

    private final EvalsModuleLoader moduleLoader;
    private final EvalRegistry registry;
    private final CacheManager cache;
    private final SessionLogLoader logLoader;
    private final EvalRunner evalRunner;
    private final EnrichmentRunner enrichmentRunner;
    private final ActionRunner actionRunner;

    public SessionItemProcessor(EvalsModuleLoader moduleLoader,
                                EvalRegistry registry,
                                CacheManager cache,
                                SessionLogLoader logLoader,
                                EvalRunner evalRunner,
                                EnrichmentRunner enrichmentRunner,
                                ActionRunner actionRunner) {
        this.moduleLoader = moduleLoader;
        this.registry = registry;
        this.cache = cache;
        this.logLoader = logLoader;
        this.evalRunner = evalRunner;
        this.enrichmentRunner = enrichmentRunner;
        this.actionRunner = actionRunner;
    }

    public ItemOutcome<EvalRunResult> processSessionEval(String projectName, String sessionId,
                                                         String evalName, boolean forceRefresh) {
        return processEval(WorkTarget.session(projectName, sessionId), evalName, forceRefresh);
    }

    public ItemOutcome<EvalRunResult> processSubagentEval(String projectName, String sessionId, String agentId,
                                                          String evalName, boolean forceRefresh,
                                                          String subagentType, String subagentDescription) {
        return processEval(WorkTarget.subagent(projectName, sessionId, agentId, subagentType, subagentDescription),
                evalName, forceRefresh);
    }

    public ItemOutcome<EnrichRunResult> processSessionEnrichment(String projectName, String sessionId,
                                                                 String enricherName, boolean forceRefresh) {
        return processEnrichment(WorkTarget.session(projectName, sessionId), enricherName, forceRefresh);
    }

    public ItemOutcome<EnrichRunResult> processSubagentEnrichment(String projectName, String sessionId,
                                                                  String agentId, String enricherName,
                                                                  boolean forceRefresh, String subagentType,
                                                                  String subagentDescription) {
        return processEnrichment(WorkTarget.subagent(projectName, sessionId, agentId, subagentType,
                subagentDescription), enricherName, forceRefresh);
    }

    public ItemOutcome<ActionRunResult> processSessionAction(String projectName, String sessionId,
                                                             String actionName, boolean forceRefresh) {
        return processAction(WorkTarget.session(projectName, sessionId), actionName, forceRefresh);
    }

    public ItemOutcome<ActionRunResult> processSubagentAction(String projectName, String sessionId, String agentId,
                                                              String actionName, boolean forceRefresh,
                                                              String subagentType, String subagentDescription) {
        return processAction(WorkTarget.subagent(projectName, sessionId, agentId, subagentType, subagentDescription),
                actionName, forceRefresh);
    }

    public ItemOutcome<EvalRunResult> processEval(WorkTarget target, String evalName, boolean forceRefresh) {
        try {
            moduleLoader.ensureLoaded();
            List<RegisteredEval> scoped = target.isSubagent()
                    ? registry.subagentScopedEvals(target.subagentType())
                    : registry.sessionScopedEvals();
            Optional<RegisteredEval> item = scoped.stream().filter(e -> e.name().equals(evalName)).findFirst();
            if (item.isEmpty()) {
                return ItemOutcome.failure(notFound("Eval", evalName, target));
            }
            RegisteredEval eval = item.get();
            String contentHash = contentHash(target);
            String codeHash = hasher().hashItemCode(eval.fn());

            if (!forceRefresh) {
                Optional<CacheEntry<EvalRunResult>> cached = cache.getPerItem(CacheKind.EVALS,
                        target.projectName(), target.sessionKey(), eval.name(), codeHash, contentHash,
                        EvalRunResult.class);
                if (cached.isPresent()) {
                    return ItemOutcome.success(cached.get().value());
                }
            }

            var results = evalRunner.run(List.of(eval), context(target)).results();
            if (results.isEmpty()) {
                return ItemOutcome.failure("No result returned from eval");
            }
            EvalRunResult result = results.get(0);
            cache.setPerItem(CacheKind.EVALS, target.projectName(), target.sessionKey(), eval.name(),
                    codeHash, result, contentHash);
            return ItemOutcome.success(result);
        } catch (Exception e) {
            return failed("eval", evalName, target, e);
        }
    }

    public ItemOutcome<EnrichRunResult> processEnrichment(WorkTarget target, String enricherName,
                                                          boolean forceRefresh) {
        try {
            moduleLoader.ensureLoaded();
            List<RegisteredEnricher> scoped = target.isSubagent()
                    ? registry.subagentScopedEnrichers(target.subagentType())
                    : registry.sessionScopedEnrichers();
            Optional<RegisteredEnricher> item = scoped.stream()
                    .filter(e -> e.name().equals(enricherName)).findFirst();
            if (item.isEmpty()) {
                return ItemOutcome.failure(notFound("Enricher", enricherName, target));
            }
            RegisteredEnricher enricher = item.get();
            String contentHash = contentHash(target);
            String codeHash = hasher().hashItemCode(enricher.fn());

            if (!forceRefresh) {
                Optional<CacheEntry<EnrichRunResult>> cached = cache.getPerItem(CacheKind.ENRICHMENTS,
                        target.projectName(), target.sessionKey(), enricher.name(), codeHash, contentHash,
                        EnrichRunResult.class);
                if (cached.isPresent()) {
                    return ItemOutcome.success(cached.get().value());
                }
            }

            var results = enrichmentRunner.run(List.of(enricher), context(target)).results();
            if (results.isEmpty()) {
                return ItemOutcome.failure("No result returned from enricher");
            }
            EnrichRunResult result = results.get(0);
            cache.setPerItem(CacheKind.ENRICHMENTS, target.projectName(), target.sessionKey(), enricher.name(),
                    codeHash, result, contentHash);
            return ItemOutcome.success(result);
        } catch (Exception e) {
            return failed("enrichment", enricherName, target, e);
        }
    }

    /**
     * Actions see the eval and enrichment results already cached for the same
     * transcript. Their own results are cached only when registered with caching on.
     */
    public ItemOutcome<ActionRunResult> processAction(WorkTarget target, String actionName, boolean forceRefresh) {
        try {
            moduleLoader.ensureLoaded();
            List<RegisteredAction> scoped = target.isSubagent()
                    ? registry.subagentScopedActions(target.subagentType())
                    : registry.sessionScopedActions();
            Optional<RegisteredAction> item = scoped.stream().filter(a -> a.name().equals(actionName)).findFirst();
            if (item.isEmpty()) {
                return ItemOutcome.failure(notFound("Action", actionName, target));
            }
            RegisteredAction action = item.get();
            String contentHash = contentHash(target);
            String codeHash = hasher().hashItemCode(action.fn());

            if (!forceRefresh && action.cache()) {
                Optional<CacheEntry<ActionRunResult>> cached = cache.getPerItem(CacheKind.ACTIONS,
                        target.projectName(), target.sessionKey(), action.name(), codeHash, contentHash,
                        ActionRunResult.class);
                if (cached.isPresent()) {
                    return ItemOutcome.success(cached.get().value());
                }
            }

            EvalContext context = context(target);
            var actionContext = new ActionContext(context,
                    cachedEvalResults(target, contentHash), cachedEnrichmentResults(target, contentHash));
            var results = actionRunner.run(List.of(action), actionContext).results();
            if (results.isEmpty()) {
                return ItemOutcome.failure("No result returned from action");
            }
            ActionRunResult result = results.get(0);
            if (action.cache()) {
                cache.setPerItem(CacheKind.ACTIONS, target.projectName(), target.sessionKey(), action.name(),
                        codeHash, result, contentHash);
            }
            return ItemOutcome.success(result);
        } catch (Exception e) {
            return failed("action", actionName, target, e);
        }
    }

    private Map<String, EvalRunResult> cachedEvalResults(WorkTarget target, String contentHash) {
        var results = new HashMap<String, EvalRunResult>();
        List<RegisteredEval> evals = target.isSubagent()
                ? registry.subagentScopedEvals(target.subagentType())
                : registry.sessionScopedEvals();
        for (RegisteredEval eval : evals) {
            cache.getPerItem(CacheKind.EVALS, target.projectName(), target.sessionKey(), eval.name(),
                            hasher().hashItemCode(eval.fn()), contentHash, EvalRunResult.class)
                    .ifPresent(entry -> results.put(eval.name(), entry.value()));
        }
        return results;
    }

    private Map<String, EnrichRunResult> cachedEnrichmentResults(WorkTarget target, String contentHash) {
        var results = new HashMap<String, EnrichRunResult>();
        List<RegisteredEnricher> enrichers = target.isSubagent()
                ? registry.subagentScopedEnrichers(target.subagentType())
                : registry.sessionScopedEnrichers();
        for (RegisteredEnricher enricher : enrichers) {
            cache.getPerItem(CacheKind.ENRICHMENTS, target.projectName(), target.sessionKey(), enricher.name(),
                            hasher().hashItemCode(enricher.fn()), contentHash, EnrichRunResult.class)
                    .ifPresent(entry -> results.put(enricher.name(), entry.value()));
        }
        return results;
    }

    private String contentHash(WorkTarget target) {
        return target.isSubagent()
                ? hasher().hashSubagentFile(target.projectName(), target.sessionId(), target.agentId())
                : hasher().hashSessionFile(target.projectName(), target.sessionId());
    }

    private EvalContext context(WorkTarget target) throws IOException {
        if (target.isSubagent()) {
            SessionLog subagentLog = logLoader.loadSubagent(target.projectName(), target.sessionId(), target.agentId());
            return EvalContext.forSubagent(subagentLog.entries(), subagentLog.stats(), target.projectName(),
                    target.sessionId(), target.agentId(), target.subagentType(), target.subagentDescription());
        }
        SessionLog sessionLog = logLoader.load(target.projectName(), target.sessionId());
        return EvalContext.forSession(sessionLog.entries(), sessionLog.stats(),
                target.projectName(), target.sessionId());
    }

    private ContentHasher hasher() {
        return cache.hasher();
    }

    private static String notFound(String kind, String name, WorkTarget target) {
        if (target.isSubagent()) {
            String type = target.subagentType() != null ? target.subagentType() : "any";
            return kind + " \"" + name + "\" not found for subagent type \"" + type + "\"";
        }
        return kind + " \"" + name + "\" not found";
    }

    private static <R> ItemOutcome<R> failed(String kind, String name, WorkTarget target, Exception e) {
        String message = e.getMessage() != null ? e.getMessage() : e.toString();
        log.warn("Processing {} '{}' for {}/{} failed: {}", kind, name, target.projectName(),
                target.sessionKey(), message);
        return ItemOutcome.failure(message);
    }
}
