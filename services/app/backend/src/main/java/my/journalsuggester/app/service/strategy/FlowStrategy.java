package my.journalsuggester.app.service.strategy;

import jakarta.annotation.PreDestroy;
import my.journalsuggester.app.config.AppProperties;
import my.journalsuggester.app.model.Allocation;
import my.journalsuggester.app.model.DecisionDebug;
import my.journalsuggester.app.model.DecoderStrategyType;
import my.journalsuggester.app.model.Side;
import my.journalsuggester.app.service.ShareNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Jointly balances both sides through {@link MinCostFlowSolver}. The solve runs on a worker thread bounded by
 * {@code app.decoder.flow.timeout}; any solver problem degrades to {@link GreedyStrategy} and is reported as
 * {@code greedy_fallback} in the decision debug block.
 */
@Component
public class FlowStrategy implements DecoderStrategy {
	private static final Logger logger = LoggerFactory.getLogger(FlowStrategy.class);
	private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(2);

	private final GreedyStrategy greedyStrategy;
	private final MinCostFlowSolver solver;
	private final Duration timeout;
	private final ExecutorService executor = Executors.newCachedThreadPool();

	@Autowired
	public FlowStrategy(GreedyStrategy greedyStrategy,
						ObjectProvider<MinCostFlowSolver> solverProvider,
						AppProperties properties) {
		this(greedyStrategy, solverProvider.getIfAvailable(), resolveTimeout(properties));
	}

	public FlowStrategy(GreedyStrategy greedyStrategy, MinCostFlowSolver solver, Duration timeout) {
		this.greedyStrategy = greedyStrategy;
		this.solver = solver;
		this.timeout = timeout == null || timeout.isZero() || timeout.isNegative() ? DEFAULT_TIMEOUT : timeout;
	}

	@Override
	public DecoderStrategyType type() {
		return DecoderStrategyType.COMBINATORIAL;
	}

	@Override
	public StrategyResult decode(List<ShareNormalizer.Share> debitShares, List<ShareNormalizer.Share> creditShares, long total) {
		try {
			return solve(debitShares, creditShares, total);
		} catch (SolverUnavailableException | SolverTimeoutException ex) {
			logger.warn("Flow solver not usable, falling back to greedy rounding: {}", ex.getMessage());
			return fallback(debitShares, creditShares, total, ex.getMessage());
		} catch (RuntimeException ex) {
			logger.warn("Flow solver failed, falling back to greedy rounding", ex);
			return fallback(debitShares, creditShares, total, "Solver error: " + ex.getMessage());
		}
	}

	@PreDestroy
	public void shutdown() {
		executor.shutdownNow();
	}

	private StrategyResult solve(List<ShareNormalizer.Share> debitShares, List<ShareNormalizer.Share> creditShares, long total) {
		if (solver == null) {
			throw new SolverUnavailableException("Flow solver is disabled");
		}
		Future<MinCostFlowSolver.FlowSolution> future = executor.submit(() -> solver.solve(debitShares, creditShares, total));
		MinCostFlowSolver.FlowSolution solution;
		try {
			solution = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
		} catch (TimeoutException ex) {
			future.cancel(true);
			throw new SolverTimeoutException("Flow solve exceeded " + timeout.toMillis() + " ms", ex);
		} catch (InterruptedException ex) {
			future.cancel(true);
			Thread.currentThread().interrupt();
			throw new SolverTimeoutException("Interrupted while waiting for the flow solver", ex);
		} catch (ExecutionException ex) {
			Throwable cause = ex.getCause();
			if (cause instanceof RuntimeException runtime) {
				throw runtime;
			}
			throw new IllegalStateException("Flow solver failed", cause);
		}
		List<Allocation> debits = toLines(Side.DEBIT, debitShares, solution.debitAmounts());
		List<Allocation> credits = toLines(Side.CREDIT, creditShares, solution.creditAmounts());
		return new StrategyResult(debits, credits, DecisionDebug.DECODER_COMBINATORIAL, null, solution.pairings());
	}

	private List<Allocation> toLines(Side side, List<ShareNormalizer.Share> shares, long[] amounts) {
		List<Allocation> lines = new ArrayList<>();
		for (int i = 0; i < shares.size(); i++) {
			if (amounts[i] > 0) {
				lines.add(new Allocation(shares.get(i).accountId(), side, amounts[i]));
			}
		}
		return lines;
	}

	private StrategyResult fallback(List<ShareNormalizer.Share> debitShares,
									List<ShareNormalizer.Share> creditShares,
									long total,
									String reason) {
		return greedyStrategy.decode(debitShares, creditShares, total)
				.asFallback(DecisionDebug.DECODER_GREEDY_FALLBACK, reason);
	}

	private static Duration resolveTimeout(AppProperties properties) {
		if (properties == null || properties.decoder() == null || properties.decoder().flow() == null) {
			return DEFAULT_TIMEOUT;
		}
		return properties.decoder().flow().timeout();
	}
}
