package my.journalsuggester.app.model;

import java.util.Comparator;

public record RankedCandidate(String accountId, double probability, double share, boolean forced) {
	public static final Comparator<RankedCandidate> ORDER = Comparator
			.comparingDouble(RankedCandidate::probability).reversed()
			.thenComparing(RankedCandidate::accountId);
}
