package ai.lodestar.strategy;

import static ai.lodestar.evidence.ProviderType.DIFF;
import static ai.lodestar.evidence.ProviderType.LSP;
import static ai.lodestar.evidence.ProviderType.SEARCH;

import ai.lodestar.intent.TaskIntent;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** Built-in strategy per intent. */
public final class DefaultStrategies {
    private static final Map<TaskIntent, IntentStrategy> DEFAULTS = build();

    private DefaultStrategies() {}

    public static IntentStrategy forIntent(TaskIntent intent) {
        return DEFAULTS.get(intent);
    }

    public static Map<TaskIntent, IntentStrategy> all() {
        return DEFAULTS;
    }

    private static Map<TaskIntent, IntentStrategy> build() {
        var map = new EnumMap<TaskIntent, IntentStrategy>(TaskIntent.class);
        // Errors usually come from something just edited, and the trace points straight at the culprit
        map.put(TaskIntent.DEBUG, new IntentStrategy(
                new BudgetRatios(0.5, 0.3, 0.2),
                WeightModifiers.NONE.withDiff(150).withStackFrame(120),
                List.of(DIFF, LSP, SEARCH),
                List.of("error_logs", "recent_changes")));
        map.put(TaskIntent.IMPLEMENT, new IntentStrategy(
                new BudgetRatios(0.2, 0.5, 0.3),
                WeightModifiers.NONE.withDefinition(80).withReference(40),
                List.of(LSP, SEARCH, DIFF),
                List.of("type_definitions", "similar_implementations")));
        map.put(TaskIntent.REFACTOR, new IntentStrategy(
                new BudgetRatios(0.2, 0.6, 0.2),
                WeightModifiers.NONE.withDefinition(80).withReference(60),
                List.of(LSP, DIFF, SEARCH),
                List.of("references", "call_hierarchy")));
        map.put(TaskIntent.EXPLORE, new IntentStrategy(
                new BudgetRatios(0.1, 0.3, 0.6),
                WeightModifiers.NONE.withKeyword(30),
                List.of(SEARCH, LSP, DIFF),
                List.of("project_structure", "documentation")));
        map.put(TaskIntent.TEST, new IntentStrategy(
                new BudgetRatios(0.3, 0.4, 0.3),
                WeightModifiers.NONE.withDefinition(70).withWorkingSet(70),
                List.of(LSP, DIFF, SEARCH),
                List.of("test_patterns", "implementation_under_test")));
        map.put(TaskIntent.REVIEW, new IntentStrategy(
                new BudgetRatios(0.6, 0.25, 0.15),
                WeightModifiers.NONE.withDiff(150),
                List.of(DIFF, LSP, SEARCH),
                List.of("recent_changes", "commit_history")));
        map.put(TaskIntent.UNKNOWN, new IntentStrategy(
                new BudgetRatios(0.34, 0.33, 0.33), WeightModifiers.NONE, List.of(DIFF, LSP, SEARCH), List.of()));
        return Collections.unmodifiableMap(map);
    }
}
