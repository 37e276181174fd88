package com.claudeye.core.evals;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Process-wide registry of operator-supplied evals, enrichers, actions,
 * filters and alerts, plus the optional global condition.
 * <p>
 * Registering a name that already exists replaces the earlier item in place,
 * keeping its position. Safe for concurrent reads while items are registered.
 */
@Component
public class EvalRegistry {

    private static final Logger log = LoggerFactory.getLogger(EvalRegistry.class);

    private final CopyOnWriteArrayList<RegisteredEval> evals = new CopyOnWriteArrayList<>();
    private final CopyOnWriteArrayList<RegisteredEnricher> enrichers = new CopyOnWriteArrayList<>();
    private final CopyOnWriteArrayList<RegisteredAction> actions = new CopyOnWriteArrayList<>();
    private final CopyOnWriteArrayList<RegisteredFilter> filters = new CopyOnWriteArrayList<>();
    private final CopyOnWriteArrayList<RegisteredAlert> alerts = new CopyOnWriteArrayList<>();
    private volatile ItemCondition globalCondition;

    public void registerEval(RegisteredEval eval) {
        upsert(evals, eval, RegisteredEval::name);
    }

    public void registerEval(String name, ItemFunction<EvalResult> fn) {
        registerEval(RegisteredEval.of(name, fn));
    }

    public void registerEnricher(RegisteredEnricher enricher) {
        upsert(enrichers, enricher, RegisteredEnricher::name);
    }

    public void registerAction(RegisteredAction action) {
        upsert(actions, action, RegisteredAction::name);
    }

    /** Filters are unique per view, so the same name may appear in two views. */
    public void registerFilter(RegisteredFilter filter) {
        synchronized (filters) {
            for (int i = 0; i < filters.size(); i++) {
                var existing = filters.get(i);
                if (existing.name().equals(filter.name()) && existing.view().equals(filter.view())) {
                    filters.set(i, filter);
                    return;
                }
            }
            filters.add(filter);
        }
    }

    public void registerAlert(RegisteredAlert alert) {
        upsert(alerts, alert, RegisteredAlert::name);
    }

    public void setGlobalCondition(ItemCondition condition) {
        this.globalCondition = condition;
    }

    /** Null when no global condition is registered. */
    public ItemCondition globalCondition() {
        return globalCondition;
    }

    public List<RegisteredEval> evals() {
        return List.copyOf(evals);
    }

    public List<RegisteredEval> sessionScopedEvals() {
        return evals.stream().filter(e -> e.scope().includesSession()).toList();
    }

    public List<RegisteredEval> subagentScopedEvals(String subagentType) {
        return evals.stream()
                .filter(e -> e.scope().includesSubagent() && typeMatches(e.subagentType(), subagentType))
                .toList();
    }

    public List<RegisteredEnricher> enrichers() {
        return List.copyOf(enrichers);
    }

    public List<RegisteredEnricher> sessionScopedEnrichers() {
        return enrichers.stream().filter(e -> e.scope().includesSession()).toList();
    }

    public List<RegisteredEnricher> subagentScopedEnrichers(String subagentType) {
        return enrichers.stream()
                .filter(e -> e.scope().includesSubagent() && typeMatches(e.subagentType(), subagentType))
                .toList();
    }

    public List<RegisteredAction> actions() {
        return List.copyOf(actions);
    }

    public List<RegisteredAction> sessionScopedActions() {
        return actions.stream().filter(a -> a.scope().includesSession()).toList();
    }

    public List<RegisteredAction> subagentScopedActions(String subagentType) {
        return actions.stream()
                .filter(a -> a.scope().includesSubagent() && typeMatches(a.subagentType(), subagentType))
                .toList();
    }

    public List<RegisteredFilter> filtersForView(String view) {
        return filters.stream().filter(f -> f.view().equals(view)).toList();
    }

    /** View names in registration order. */
    public List<String> registeredViews() {
        var views = new LinkedHashSet<String>();
        filters.forEach(f -> views.add(f.view()));
        return List.copyOf(views);
    }

    public List<RegisteredAlert> alerts() {
        return List.copyOf(alerts);
    }

    public boolean hasEvals() { return !evals.isEmpty(); }
    public boolean hasEnrichers() { return !enrichers.isEmpty(); }
    public boolean hasActions() { return !actions.isEmpty(); }
    public boolean hasAlerts() { return !alerts.isEmpty(); }

    public void clear() {
        evals.clear();
        enrichers.clear();
        actions.clear();
        filters.clear();
        alerts.clear();
        globalCondition = null;
    }

    /** A typed item is excluded only when both its type and the caller's type are set and differ. */
    private static boolean typeMatches(String itemType, String requestedType) {
        return itemType == null || requestedType == null || Objects.equals(itemType, requestedType);
    }

    private static <T> void upsert(CopyOnWriteArrayList<T> list, T item, Function<T, String> nameOf) {
        String name = nameOf.apply(item);
        synchronized (list) {
            for (int i = 0; i < list.size(); i++) {
                if (nameOf.apply(list.get(i)).equals(name)) {
                    list.set(i, item);
                    log.debug("Replaced registered item '{}'", name);
                    return;
                }
            }
            list.add(item);
        }
    }
}
