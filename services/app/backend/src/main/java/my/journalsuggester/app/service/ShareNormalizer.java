package my.journalsuggester.app.service;

import my.journalsuggester.app.model.RankedCandidate;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

@Service
public class ShareNormalizer {
	static final int SCALE = 12;

	public List<Share> normalize(List<RankedCandidate> candidates) {
		if (candidates == null || candidates.isEmpty()) {
			return List.of();
		}
		BigDecimal total = BigDecimal.ZERO;
		List<BigDecimal> weights = new ArrayList<>();
		for (RankedCandidate candidate : candidates) {
			BigDecimal weight = toWeight(candidate.share());
			weights.add(weight);
			total = total.add(weight);
		}
		List<Share> shares = new ArrayList<>();
		if (total.signum() == 0) {
			BigDecimal uniform = BigDecimal.ONE.divide(BigDecimal.valueOf(candidates.size()), SCALE, RoundingMode.HALF_EVEN);
			for (RankedCandidate candidate : candidates) {
				shares.add(new Share(candidate, uniform));
			}
			return List.copyOf(shares);
		}
		for (int i = 0; i < candidates.size(); i++) {
			BigDecimal share = weights.get(i).divide(total, SCALE, RoundingMode.HALF_EVEN);
			shares.add(new Share(candidates.get(i), share));
		}
		return List.copyOf(shares);
	}

	private BigDecimal toWeight(double share) {
		if (Double.isNaN(share) || Double.isInfinite(share) || share <= 0.0d) {
			return BigDecimal.ZERO;
		}
		return BigDecimal.valueOf(share);
	}

	public record Share(RankedCandidate candidate, BigDecimal value) {
		public String accountId() {
			return candidate.accountId();
		}

		public double probability() {
			return candidate.probability();
		}

		public boolean forced() {
			return candidate.forced();
		}
	}
}
