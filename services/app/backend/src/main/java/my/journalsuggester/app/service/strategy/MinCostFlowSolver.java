package my.journalsuggester.app.service.strategy;

import com.google.ortools.Loader;
import com.google.ortools.graph.MinCostFlow;
import com.google.ortools.graph.MinCostFlowBase;
import my.journalsuggester.app.model.FlowPairing;
import my.journalsuggester.app.service.ShareNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Integer min-cost flow over the transportation network source -> debit accounts -> credit accounts -> sink,
 * solved with OR-Tools {@link MinCostFlow}.
 * <p>
 * Each account edge is split into a convex piecewise-linear arc set: its share target (floor), one round-up unit
 * priced by how far the fractional remainder is from one, and an unbounded overshoot segment. Confidence enters
 * every arc as {@code -log(probability)}. The first unit of a forced account is priced below any share target,
 * so forced accounts keep a line whenever the total allows it.
 */
public class MinCostFlowSolver {
	private static final Logger logger = LoggerFactory.getLogger(MinCostFlowSolver.class);

	static final long PROBABILITY_COST_SCALE = 1_000L;
	static final long ROUNDING_COST_SCALE = 1_000_000L;
	static final long TARGET_BONUS = 1_000_000_000L;
	private static final double MIN_PROBABILITY = 1e-6d;
	private static final int SCALE = 12;

	private static volatile boolean nativeLoaded;

	public FlowSolution solve(List<ShareNormalizer.Share> debits, List<ShareNormalizer.Share> credits, long total) {
		if (debits == null || debits.isEmpty() || credits == null || credits.isEmpty()) {
			throw new IllegalArgumentException("Both sides need at least one candidate");
		}
		if (total <= 0) {
			throw new IllegalArgumentException("Total must be positive");
		}
		if (Thread.currentThread().isInterrupted()) {
			throw new SolverTimeoutException("Flow solve interrupted before it started");
		}
		MinCostFlow network = createNetwork();
		int debitCount = debits.size();
		int creditCount = credits.size();
		int source = 0;
		int sink = debitCount + creditCount + 1;

		List<List<Integer>> debitArcs = new ArrayList<>();
		long[] debitTargets = floorsAndCosts(debits, total);
		for (int i = 0; i < debitCount; i++) {
			debitArcs.add(addAccountArcs(network, source, 1 + i, debits.get(i), debitTargets, i, total));
		}
		List<List<Integer>> creditArcs = new ArrayList<>();
		long[] creditTargets = floorsAndCosts(credits, total);
		for (int j = 0; j < creditCount; j++) {
			creditArcs.add(addAccountArcs(network, 1 + debitCount + j, sink, credits.get(j), creditTargets, j, total));
		}
		int[][] pairArcs = new int[debitCount][creditCount];
		for (int i = 0; i < debitCount; i++) {
			for (int j = 0; j < creditCount; j++) {
				pairArcs[i][j] = network.addArcWithCapacityAndUnitCost(1 + i, 1 + debitCount + j, total, 0L);
			}
		}
		network.setNodeSupply(source, total);
		network.setNodeSupply(sink, -total);

		MinCostFlowBase.Status status = network.solve();
		if (status != MinCostFlowBase.Status.OPTIMAL) {
			throw new SolverUnavailableException("Flow solver finished with status " + status);
		}

		long[] debitAmounts = new long[debitCount];
		for (int i = 0; i < debitCount; i++) {
			debitAmounts[i] = flowOf(network, debitArcs.get(i));
		}
		long[] creditAmounts = new long[creditCount];
		for (int j = 0; j < creditCount; j++) {
			creditAmounts[j] = flowOf(network, creditArcs.get(j));
		}
		List<FlowPairing> pairings = new ArrayList<>();
		for (int i = 0; i < debitCount; i++) {
			for (int j = 0; j < creditCount; j++) {
				long flow = network.getFlow(pairArcs[i][j]);
				if (flow > 0) {
					pairings.add(new FlowPairing(debits.get(i).accountId(), credits.get(j).accountId(), flow));
				}
			}
		}
		return new FlowSolution(debitAmounts, creditAmounts, List.copyOf(pairings));
	}

	long probabilityCost(double probability) {
		double bounded = Double.isNaN(probability) ? MIN_PROBABILITY : Math.min(1.0d, Math.max(MIN_PROBABILITY, probability));
		return Math.round(-Math.log(bounded) * PROBABILITY_COST_SCALE);
	}

	/**
	 * Loads the OR-Tools native libraries once and creates an empty network.
	 * Fails with {@link SolverUnavailableException} when the platform has no usable native build.
	 */
	protected MinCostFlow createNetwork() {
		if (!nativeLoaded) {
			synchronized (MinCostFlowSolver.class) {
				if (!nativeLoaded) {
					try {
						Loader.loadNativeLibraries();
					} catch (RuntimeException | UnsatisfiedLinkError ex) {
						logger.warn("OR-Tools native libraries could not be loaded: {}", ex.getMessage());
						throw new SolverUnavailableException("OR-Tools native libraries unavailable: " + ex.getMessage(), ex);
					}
					nativeLoaded = true;
				}
			}
		}
		try {
			return new MinCostFlow();
		} catch (RuntimeException | UnsatisfiedLinkError ex) {
			throw new SolverUnavailableException("Could not create OR-Tools min cost flow: " + ex.getMessage(), ex);
		}
	}

	// layout: [floor_0, roundUpCost_0, floor_1, roundUpCost_1, ...]
	private long[] floorsAndCosts(List<ShareNormalizer.Share> shares, long total) {
		BigDecimal weightTotal = BigDecimal.ZERO;
		for (ShareNormalizer.Share share : shares) {
			weightTotal = weightTotal.add(share.value());
		}
		boolean uniform = weightTotal.signum() == 0;
		BigDecimal target = BigDecimal.valueOf(total);
		long[] values = new long[shares.size() * 2];
		for (int i = 0; i < shares.size(); i++) {
			BigDecimal raw = uniform
					? target.divide(BigDecimal.valueOf(shares.size()), SCALE, RoundingMode.DOWN)
					: target.multiply(shares.get(i).value()).divide(weightTotal, SCALE, RoundingMode.DOWN);
			BigDecimal floor = raw.setScale(0, RoundingMode.FLOOR);
			BigDecimal fraction = raw.subtract(floor);
			values[2 * i] = floor.longValueExact();
			values[2 * i + 1] = BigDecimal.ONE.subtract(fraction)
					.multiply(BigDecimal.valueOf(ROUNDING_COST_SCALE))
					.setScale(0, RoundingMode.HALF_EVEN)
					.longValueExact();
		}
		return values;
	}

	private List<Integer> addAccountArcs(MinCostFlow network, int from, int to, ShareNormalizer.Share share,
										 long[] targets, int index, long total) {
		long confidenceCost = probabilityCost(share.probability());
		long floor = targets[2 * index];
		long roundUpCost = targets[2 * index + 1];
		List<Integer> arcs = new ArrayList<>();
		if (share.forced()) {
			// the first unit of a forced line outranks every share target
			arcs.add(network.addArcWithCapacityAndUnitCost(from, to, 1L, confidenceCost - 2 * TARGET_BONUS));
			floor = Math.max(0L, floor - 1);
		}
		if (floor > 0) {
			arcs.add(network.addArcWithCapacityAndUnitCost(from, to, floor, confidenceCost - TARGET_BONUS));
		}
		arcs.add(network.addArcWithCapacityAndUnitCost(from, to, 1L, confidenceCost + roundUpCost));
		arcs.add(network.addArcWithCapacityAndUnitCost(from, to, total, confidenceCost + TARGET_BONUS));
		return arcs;
	}

	private long flowOf(MinCostFlow network, List<Integer> arcs) {
		long flow = 0L;
		for (int arc : arcs) {
			flow += network.getFlow(arc);
		}
		return flow;
	}

	public record FlowSolution(long[] debitAmounts, long[] creditAmounts, List<FlowPairing> pairings) {
	}
}
