package my.journalsuggester.app.service;

import my.journalsuggester.app.model.RankedCandidate;
import my.journalsuggester.app.model.ScoredCandidate;
import my.journalsuggester.app.model.Side;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

@Service
public class CandidateFilter {
	private static final double FORCED_DEFAULT_PROBABILITY = 1.0d;

	/**
	 * Applies block list, threshold and force list to one side's scores.
	 * The result is ordered by probability (descending, ties by account id) and never empty.
	 */
	public List<RankedCandidate> filter(Side side,
										List<ScoredCandidate> candidates,
										double threshold,
										Set<String> forced,
										Set<String> blocked,
										int maxK) {
		if (candidates == null || candidates.isEmpty()) {
			throw new EmptyCandidateException(side, "No scored " + side.label() + " candidates");
		}
		Set<String> forcedAccounts = forced == null ? Set.of() : forced;
		Set<String> blockedAccounts = blocked == null ? Set.of() : blocked;

		Map<String, ScoredCandidate> pool = new LinkedHashMap<>();
		for (ScoredCandidate candidate : candidates) {
			if (candidate == null || candidate.accountId() == null) {
				continue;
			}
			pool.putIfAbsent(candidate.accountId(), candidate);
		}
		double fairShare = pool.values().stream().mapToDouble(ScoredCandidate::share).average().orElse(0.0d);

		List<RankedCandidate> forcedCandidates = new ArrayList<>();
		for (String accountId : new TreeSet<>(forcedAccounts)) {
			if (blockedAccounts.contains(accountId)) {
				continue;
			}
			ScoredCandidate scored = pool.get(accountId);
			if (scored == null) {
				forcedCandidates.add(new RankedCandidate(accountId, FORCED_DEFAULT_PROBABILITY, fairShare, true));
			} else {
				forcedCandidates.add(new RankedCandidate(accountId, scored.probability(), scored.share(), true));
			}
		}
		if (forcedCandidates.size() > maxK) {
			throw new InvalidDecodeRequestException(String.format(
					"%d forced %s accounts exceed max_k_per_side=%d", forcedCandidates.size(), side.label(), maxK));
		}

		List<RankedCandidate> unblocked = new ArrayList<>();
		List<RankedCandidate> aboveThreshold = new ArrayList<>();
		for (ScoredCandidate scored : pool.values()) {
			if (blockedAccounts.contains(scored.accountId()) || forcedAccounts.contains(scored.accountId())) {
				continue;
			}
			RankedCandidate ranked = new RankedCandidate(scored.accountId(), scored.probability(), scored.share(), false);
			unblocked.add(ranked);
			if (scored.probability() >= threshold) {
				aboveThreshold.add(ranked);
			}
		}
		unblocked.sort(RankedCandidate.ORDER);
		aboveThreshold.sort(RankedCandidate.ORDER);

		if (aboveThreshold.isEmpty() && forcedCandidates.isEmpty()) {
			if (unblocked.isEmpty()) {
				throw new EmptyCandidateException(side, "Every " + side.label() + " candidate is blocked");
			}
			return List.of(unblocked.get(0));
		}

		int slots = maxK - forcedCandidates.size();
		List<RankedCandidate> result = new ArrayList<>(forcedCandidates);
		result.addAll(aboveThreshold.subList(0, Math.min(slots, aboveThreshold.size())));
		result.sort(RankedCandidate.ORDER);
		return List.copyOf(result);
	}

	/**
	 * Picks the lines of one side from an already filtered list: every forced account, plus the {@code k}
	 * strongest others as far as {@code maxK} leaves room for them.
	 */
	public List<RankedCandidate> selectTop(List<RankedCandidate> filtered, int k, int maxK) {
		if (filtered == null || filtered.isEmpty()) {
			return List.of();
		}
		long forcedCount = filtered.stream().filter(RankedCandidate::forced).count();
		int freeSlots = (int) Math.max(0, Math.min(k, maxK - forcedCount));
		List<RankedCandidate> selected = new ArrayList<>();
		for (RankedCandidate candidate : filtered) {
			if (candidate.forced()) {
				selected.add(candidate);
			} else if (freeSlots > 0) {
				selected.add(candidate);
				freeSlots -= 1;
			}
		}
		return List.copyOf(selected);
	}
}
