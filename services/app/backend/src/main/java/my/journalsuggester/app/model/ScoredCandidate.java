package my.journalsuggester.app.model;

/**
 * One account's likelihood of appearing on a side and its estimated proportion of that side's total.
 */
public record ScoredCandidate(String accountId, double probability, double share) {
	public ScoredCandidate withProbability(double value) {
		return new ScoredCandidate(accountId, value, share);
	}
}
