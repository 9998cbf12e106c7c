package my.journalsuggester.app.service;

import my.journalsuggester.app.model.ScoredCandidate;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Mixes an external single-pair verdict into one side's scores before filtering.
 * <p>
 * With weight {@code w} the named account becomes {@code (1-w)p + w} and every other account {@code (1-w)p}.
 * {@code w <= 0} leaves the pool untouched, {@code w >= 1} collapses it to the named account. Forced accounts are
 * applied afterwards by {@link CandidateFilter}, so they survive even a full collapse.
 */
@Service
public class ExternalBlender {
	public List<ScoredCandidate> blend(List<ScoredCandidate> pool, String namedAccountId, double weight) {
		List<ScoredCandidate> candidates = pool == null ? List.of() : pool;
		if (namedAccountId == null || namedAccountId.isBlank() || Double.isNaN(weight) || weight <= 0.0d) {
			return candidates;
		}
		if (weight >= 1.0d) {
			return List.of(new ScoredCandidate(namedAccountId, 1.0d, 1.0d));
		}
		List<ScoredCandidate> blended = new ArrayList<>();
		boolean named = false;
		for (ScoredCandidate candidate : candidates) {
			if (candidate == null) {
				continue;
			}
			double mixed = (1.0d - weight) * candidate.probability();
			if (namedAccountId.equals(candidate.accountId())) {
				mixed += weight;
				named = true;
			}
			blended.add(candidate.withProbability(clamp(mixed)));
		}
		if (!named) {
			blended.add(new ScoredCandidate(namedAccountId, weight, weight));
		}
		return List.copyOf(blended);
	}

	private double clamp(double value) {
		return Math.min(1.0d, Math.max(0.0d, value));
	}
}
