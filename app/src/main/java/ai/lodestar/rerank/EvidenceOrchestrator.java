package ai.lodestar.rerank;

import ai.lodestar.config.EvidenceSettings;
import ai.lodestar.evidence.Evidence;
import ai.lodestar.evidence.EvidenceProvider;
import ai.lodestar.evidence.ProviderQueryOptions;
import ai.lodestar.evidence.Signal;
import ai.lodestar.evidence.SignalExtractor;
import ai.lodestar.evidence.TokenBudget;
import ai.lodestar.intent.TaskIntent;
import ai.lodestar.intent.TaskIntentClassifier;
import ai.lodestar.rerank.ProviderOutcome.Status;
import ai.lodestar.strategy.IntentStrategy;
import ai.lodestar.strategy.IntentStrategyProvider;
import ai.lodestar.strategy.StrategyFeedback;
import ai.lodestar.util.ExecutorServiceUtil;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Blocking;
import org.jetbrains.annotations.Nullable;

/**
 * Entry point for one evidence-retrieval cycle: classify the task, pick a strategy, split the token budget, query
 * every provider concurrently, then score, rank and trim the merged evidence.
 *
 * <p>Each provider runs under its own timeout, capped by the overall deadline. A provider that is unavailable, throws
 * or times out contributes nothing and is recorded in the result's outcomes; the others are unaffected. Interrupting
 * the calling thread cancels all in-flight provider queries.
 *
 * <p>A provider holds at most one pool thread. If a query ignored cancellation and is still running when the next
 * cycle starts, that provider is reported as timed out without being queried again, so the pool always has a thread
 * for every other provider.
 */
public class EvidenceOrchestrator implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(EvidenceOrchestrator.class);

    private final List<EvidenceProvider> providers;
    private final TaskIntentClassifier classifier;
    private final IntentStrategyProvider strategyProvider;
    private final SignalExtractor signalExtractor;
    private final Duration providerTimeout;
    private final Duration deadline;
    private final ExecutorService executor;
    private final ConcurrentHashMap<EvidenceProvider, Object> busy = new ConcurrentHashMap<>();

    public EvidenceOrchestrator(List<EvidenceProvider> providers, EvidenceSettings settings) {
        this(
                providers,
                settings.newClassifier(),
                settings.newStrategyProvider(),
                new SignalExtractor(),
                settings.providerTimeout(),
                settings.deadline(),
                settings.parallelism());
    }

    public EvidenceOrchestrator(
            List<EvidenceProvider> providers,
            TaskIntentClassifier classifier,
            IntentStrategyProvider strategyProvider,
            SignalExtractor signalExtractor,
            Duration providerTimeout,
            Duration deadline,
            int parallelism) {
        this.providers = List.copyOf(providers);
        this.classifier = Objects.requireNonNull(classifier);
        this.strategyProvider = Objects.requireNonNull(strategyProvider);
        this.signalExtractor = Objects.requireNonNull(signalExtractor);
        this.providerTimeout = providerTimeout;
        this.deadline = deadline;
        this.executor = ExecutorServiceUtil.newFixedThreadExecutor(
                Math.max(parallelism, this.providers.size()), "evidence-provider-");
    }

    public IntentStrategyProvider strategyProvider() {
        return strategyProvider;
    }

    @Blocking
    public EvidenceResult retrieve(EvidenceRequest request) throws InterruptedException {
        var classification = classifier.classifyWithContext(request.taskText(), request.context());
        var intent = classification.intent();
        var strategy = strategyProvider.getStrategy(intent);
        var weights = strategyProvider.applyWeightModifiers(request.baseWeights(), intent);
        var signals = request.signals().isEmpty()
                ? signalExtractor.extract(request.taskText(), request.errorOutput())
                : request.signals();
        var subBudgets = BudgetAllocator.allocate(
                request.totalTokenBudget(), strategy.budgetRatios(), strategy.providerPriority());
        logger.debug(
                "Retrieving for {} ({}) with {} signals, budgets {}",
                intent,
                classification.confidence(),
                signals.size(),
                subBudgets);

        var ordered = inPriorityOrder(strategy);
        var outcomes = new ArrayList<ProviderOutcome>();
        var evidence = new ArrayList<Evidence>();
        var pending = new ArrayList<Pending>();

        for (var provider : ordered) {
            int budget = subBudgets.getOrDefault(provider.type(), 0);
            if (budget <= 0) {
                pending.add(Pending.skipped(provider, 0, Status.SKIPPED));
                continue;
            }
            var token = new Object();
            if (busy.putIfAbsent(provider, token) != null) {
                logger.warn("{} is still running a previous query; not querying it this cycle", provider.name());
                pending.add(Pending.skipped(provider, budget, Status.TIMED_OUT));
                continue;
            }
            var options = ProviderQueryOptions.ofMaxTokens(budget);
            var started = new AtomicBoolean();
            Future<ProviderRun> future;
            try {
                future = executor.submit(() -> {
                    started.set(true);
                    try {
                        return run(provider, signals, options);
                    } finally {
                        busy.remove(provider, token);
                    }
                });
            } catch (RejectedExecutionException e) {
                busy.remove(provider, token);
                throw e;
            }
            pending.add(new Pending(provider, budget, future, null, started, token));
        }

        // One cut-off for every provider, measured from submission and never past the overall deadline
        long providerDeadlineNanos = System.nanoTime() + Math.min(providerTimeout.toNanos(), deadline.toNanos());
        try {
            for (var p : pending) {
                long waitNanos = Math.max(0, providerDeadlineNanos - System.nanoTime());
                outcomes.add(await(p, waitNanos, evidence));
            }
        } catch (InterruptedException e) {
            pending.forEach(this::cancel);
            logger.debug("Retrieval interrupted; cancelled in-flight provider queries");
            throw e;
        }

        var scorer = new CompositeScorer(weights, request.workingSet());
        var scored = new ArrayList<ScoredEvidence>(evidence.size());
        for (var item : evidence) {
            scored.add(scorer.score(item));
        }
        scored.sort(Comparator.comparingDouble(ScoredEvidence::score).reversed());
        var ranked = scored.stream().map(ScoredEvidence::evidence).toList();
        int kept = TokenBudget.apply(ranked, request.totalTokenBudget()).size();
        var result = scored.subList(0, kept);

        logger.debug("Kept {} of {} evidence items", result.size(), scored.size());
        return new EvidenceResult(classification, strategy, weights, subBudgets, outcomes, result);
    }

    /** Forwards a task outcome to the strategy provider. */
    public void reportOutcome(TaskIntent intent, StrategyFeedback feedback) {
        strategyProvider.updateStrategy(intent, feedback);
    }

    private List<EvidenceProvider> inPriorityOrder(IntentStrategy strategy) {
        var priority = strategy.providerPriority();
        var ordered = new ArrayList<>(providers);
        ordered.sort(Comparator.comparingInt(p -> {
            int index = priority.indexOf(p.type());
            return index < 0 ? priority.size() : index;
        }));
        return ordered;
    }

    private static ProviderRun run(EvidenceProvider provider, List<Signal> signals, ProviderQueryOptions options) {
        if (!provider.isAvailable()) {
            return ProviderRun.UNAVAILABLE;
        }
        var result = provider.query(signals, options);
        return new ProviderRun(true, result == null ? List.of() : result);
    }

    private ProviderOutcome await(Pending p, long waitNanos, List<Evidence> sink) throws InterruptedException {
        var provider = p.provider();
        var future = p.future();
        if (future == null) {
            var status = Objects.requireNonNull(p.skippedAs());
            var detail = status == Status.TIMED_OUT ? "previous query still running" : null;
            return outcome(p, status, 0, detail);
        }
        try {
            var run = future.get(waitNanos, TimeUnit.NANOSECONDS);
            if (!run.available()) {
                return outcome(p, Status.UNAVAILABLE, 0, null);
            }
            var items = run.evidence().stream().filter(Objects::nonNull).toList();
            sink.addAll(items);
            logger.debug("{} returned {} evidence items", provider.name(), items.size());
            return outcome(p, items.isEmpty() ? Status.EMPTY : Status.OK, items.size(), null);
        } catch (TimeoutException e) {
            cancel(p);
            logger.warn("{} timed out", provider.name());
            return outcome(p, Status.TIMED_OUT, 0, null);
        } catch (ExecutionException e) {
            var cause = e.getCause() == null ? e : e.getCause();
            logger.warn("{} failed: {}", provider.name(), cause.toString());
            return outcome(p, Status.FAILED, 0, cause.toString());
        }
    }

    private void cancel(Pending p) {
        var future = p.future();
        if (future == null) {
            return;
        }
        future.cancel(true);
        // A query cancelled before it started never reaches its own release
        if (!Objects.requireNonNull(p.started()).get()) {
            busy.remove(p.provider(), p.token());
        }
    }

    private static ProviderOutcome outcome(Pending p, Status status, int count, @Nullable String detail) {
        return new ProviderOutcome(p.provider().type(), p.provider().name(), p.budget(), status, count, detail);
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    /** A provider's slot in priority order; no future when it was not queried this cycle. */
    private record Pending(
            EvidenceProvider provider,
            int budget,
            @Nullable Future<ProviderRun> future,
            @Nullable Status skippedAs,
            @Nullable AtomicBoolean started,
            @Nullable Object token) {

        static Pending skipped(EvidenceProvider provider, int budget, Status status) {
            return new Pending(provider, budget, null, status, null, null);
        }
    }

    private record ProviderRun(boolean available, List<Evidence> evidence) {
        static final ProviderRun UNAVAILABLE = new ProviderRun(false, List.of());
    }
}
