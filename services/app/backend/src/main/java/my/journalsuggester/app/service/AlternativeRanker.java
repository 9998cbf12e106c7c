package my.journalsuggester.app.service;

import my.journalsuggester.app.model.Allocation;
import my.journalsuggester.app.model.RankedAllocation;
import my.journalsuggester.app.model.RankedCandidate;
import my.journalsuggester.app.model.Side;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds alternative full allocations from the filtered candidates of both sides.
 * <p>
 * Per side it tries every line count from one to {@code maxK} and a variant that swaps the weakest chosen
 * non-forced account for the strongest unchosen one. Every debit variant is combined with every credit variant,
 * greedily decoded and ranked by joint probability (product of the chosen lines' probabilities). Ties are broken by
 * the canonical account-set key so the ranking is reproducible.
 */
@Service
public class AlternativeRanker {
	private static final Comparator<Scored> RANKING = Comparator
			.comparingDouble(Scored::jointProbability).reversed()
			.thenComparing(Scored::key);

	private final CandidateFilter candidateFilter;
	private final ShareNormalizer shareNormalizer;
	private final GreedyRoundingDecoder decoder;

	public AlternativeRanker(CandidateFilter candidateFilter,
							 ShareNormalizer shareNormalizer,
							 GreedyRoundingDecoder decoder) {
		this.candidateFilter = candidateFilter;
		this.shareNormalizer = shareNormalizer;
		this.decoder = decoder;
	}

	public List<RankedAllocation> rank(List<RankedCandidate> debits,
									   List<RankedCandidate> credits,
									   long total,
									   int maxK,
									   List<Allocation> primary,
									   int limit) {
		return rank(new SidePlan(debits, total, maxK), new SidePlan(credits, total, maxK), List.of(), primary, limit);
	}

	/**
	 * Ranks alternatives when known lines already cover part of each side. A side with nothing left to decode
	 * contributes only its known lines. Keys cover the merged lines, joint probability only the decoded ones.
	 */
	public List<RankedAllocation> rank(SidePlan debit,
									   SidePlan credit,
									   List<Allocation> knownLines,
									   List<Allocation> primary,
									   int limit) {
		if (limit <= 0 || !debit.decodable() || !credit.decodable()) {
			return List.of();
		}
		Map<String, Double> probabilities = new HashMap<>();
		debit.candidates().forEach(candidate -> probabilities.put(Side.DEBIT.label() + ":" + candidate.accountId(), candidate.probability()));
		credit.candidates().forEach(candidate -> probabilities.put(Side.CREDIT.label() + ":" + candidate.accountId(), candidate.probability()));

		Set<String> seen = new HashSet<>();
		if (primary != null && !primary.isEmpty()) {
			seen.add(key(primary));
		}
		List<Scored> scored = new ArrayList<>();
		for (List<Allocation> debitLines : sideLines(Side.DEBIT, debit)) {
			for (List<Allocation> creditLines : sideLines(Side.CREDIT, credit)) {
				List<Allocation> decoded = new ArrayList<>(debitLines);
				decoded.addAll(creditLines);
				List<Allocation> lines = KnownLines.merge(knownLines, decoded);
				String key = key(lines);
				if (!seen.add(key)) {
					continue;
				}
				scored.add(new Scored(key, new RankedAllocation(lines, jointProbability(decoded, probabilities))));
			}
		}
		scored.sort(RANKING);
		return scored.stream()
				.limit(limit)
				.map(Scored::allocation)
				.toList();
	}

	/**
	 * Canonical account-set key, e.g. {@code D:Bank,Cash|C:Revenue}. Amounts are not part of the key.
	 */
	public static String key(List<Allocation> lines) {
		return "D:" + sortedIds(lines, Side.DEBIT) + "|C:" + sortedIds(lines, Side.CREDIT);
	}

	public static double jointProbability(List<Allocation> lines, Map<String, Double> probabilities) {
		double joint = 1.0d;
		for (Allocation line : lines) {
			joint *= probabilities.getOrDefault(line.side().label() + ":" + line.accountId(), 0.0d);
		}
		return joint;
	}

	private List<List<Allocation>> sideLines(Side side, SidePlan plan) {
		if (plan.total() == 0) {
			return List.of(List.of());
		}
		List<List<Allocation>> lines = new ArrayList<>();
		for (List<RankedCandidate> variant : variants(plan.candidates(), plan.maxK())) {
			lines.add(decoder.decodeSide(side, shareNormalizer.normalize(variant), plan.total()));
		}
		return lines;
	}

	private List<List<RankedCandidate>> variants(List<RankedCandidate> filtered, int maxK) {
		Map<String, List<RankedCandidate>> unique = new LinkedHashMap<>();
		int upper = Math.max(1, Math.min(maxK, filtered.size()));
		for (int k = 1; k <= upper; k++) {
			List<RankedCandidate> selected = candidateFilter.selectTop(filtered, k, maxK);
			unique.putIfAbsent(idKey(selected), selected);
			List<RankedCandidate> swapped = swapWeakest(filtered, selected);
			if (swapped != null) {
				unique.putIfAbsent(idKey(swapped), swapped);
			}
		}
		return new ArrayList<>(unique.values());
	}

	private List<RankedCandidate> swapWeakest(List<RankedCandidate> filtered, List<RankedCandidate> selected) {
		RankedCandidate weakest = null;
		for (RankedCandidate candidate : selected) {
			if (!candidate.forced()) {
				weakest = candidate;
			}
		}
		if (weakest == null) {
			return null;
		}
		RankedCandidate next = null;
		for (RankedCandidate candidate : filtered) {
			if (!selected.contains(candidate)) {
				next = candidate;
				break;
			}
		}
		if (next == null) {
			return null;
		}
		List<RankedCandidate> swapped = new ArrayList<>(selected);
		swapped.remove(weakest);
		swapped.add(next);
		swapped.sort(RankedCandidate.ORDER);
		return List.copyOf(swapped);
	}

	private static String idKey(List<RankedCandidate> candidates) {
		return candidates.stream()
				.map(RankedCandidate::accountId)
				.sorted()
				.collect(Collectors.joining(","));
	}

	private static String sortedIds(List<Allocation> lines, Side side) {
		return lines.stream()
				.filter(line -> line.side() == side)
				.map(Allocation::accountId)
				.sorted()
				.collect(Collectors.joining(","));
	}

	/**
	 * Filtered candidates of one side, the amount still open on it and its line budget.
	 */
	public record SidePlan(List<RankedCandidate> candidates, long total, int maxK) {
		public SidePlan {
			candidates = candidates == null ? List.of() : candidates;
		}

		boolean decodable() {
			return total == 0 || (total > 0 && maxK >= 1 && !candidates.isEmpty());
		}
	}

	private record Scored(String key, RankedAllocation allocation) {
		double jointProbability() {
			return allocation.jointProbability();
		}
	}
}
