package my.journalsuggester.app.service;

import my.journalsuggester.app.model.RankedCandidate;
import my.journalsuggester.app.model.ScoredCandidate;
import my.journalsuggester.app.model.Side;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class CandidateFilterTest {
	private final CandidateFilter filter = new CandidateFilter();

	@Test
	void keepsCandidatesAboveThresholdOrderedByProbabilityThenId() {
		List<RankedCandidate> result = filter.filter(Side.DEBIT, List.of(
				new ScoredCandidate("Bank", 0.6d, 0.3d),
				new ScoredCandidate("Cash", 0.9d, 0.5d),
				new ScoredCandidate("Amex", 0.6d, 0.2d),
				new ScoredCandidate("Misc", 0.1d, 0.9d)), 0.4d, Set.of(), Set.of(), 4);

		assertThat(result).extracting(RankedCandidate::accountId).containsExactly("Cash", "Amex", "Bank");
	}

	@Test
	void removesBlockedAccounts() {
		List<RankedCandidate> result = filter.filter(Side.DEBIT, List.of(
				new ScoredCandidate("Cash", 0.9d, 0.5d),
				new ScoredCandidate("Bank", 0.8d, 0.5d)), 0.4d, Set.of(), Set.of("Cash"), 4);

		assertThat(result).extracting(RankedCandidate::accountId).containsExactly("Bank");
	}

	@Test
	void forceIncludesLowScoredAndUnscoredAccounts() {
		List<RankedCandidate> result = filter.filter(Side.DEBIT, List.of(
				new ScoredCandidate("Expense", 0.9d, 0.6d),
				new ScoredCandidate("Tax", 0.01d, 0.1d),
				new ScoredCandidate("Fees", 0.7d, 0.2d)), 0.5d, Set.of("Tax", "Rounding"), Set.of(), 4);

		assertThat(result).extracting(RankedCandidate::accountId).containsExactly("Rounding", "Expense", "Fees", "Tax");
		RankedCandidate tax = result.get(3);
		assertThat(tax.forced()).isTrue();
		assertThat(tax.probability()).isEqualTo(0.01d);
		RankedCandidate rounding = result.get(0);
		assertThat(rounding.probability()).isEqualTo(1.0d);
		assertThat(rounding.share()).isCloseTo(0.3d, within(1e-9));
	}

	@Test
	void truncatesToMaxKKeepingForcedAccounts() {
		List<RankedCandidate> result = filter.filter(Side.CREDIT, List.of(
				new ScoredCandidate("A", 0.9d, 0.3d),
				new ScoredCandidate("B", 0.8d, 0.3d),
				new ScoredCandidate("C", 0.7d, 0.3d),
				new ScoredCandidate("Tax", 0.05d, 0.1d)), 0.5d, Set.of("Tax"), Set.of(), 2);

		assertThat(result).extracting(RankedCandidate::accountId).containsExactly("A", "Tax");
	}

	@Test
	void fallsBackToStrongestUnblockedCandidate() {
		List<RankedCandidate> result = filter.filter(Side.DEBIT, List.of(
				new ScoredCandidate("A", 0.2d, 0.5d),
				new ScoredCandidate("B", 0.3d, 0.5d),
				new ScoredCandidate("C", 0.35d, 0.5d)), 0.9d, Set.of(), Set.of("C"), 4);

		assertThat(result).extracting(RankedCandidate::accountId).containsExactly("B");
	}

	@Test
	void keepsFirstOccurrenceOfDuplicateAccount() {
		List<RankedCandidate> result = filter.filter(Side.DEBIT, List.of(
				new ScoredCandidate("A", 0.9d, 0.5d),
				new ScoredCandidate("A", 0.1d, 0.1d)), 0.4d, Set.of(), Set.of(), 4);

		assertThat(result).containsExactly(new RankedCandidate("A", 0.9d, 0.5d, false));
	}

	@Test
	void rejectsEmptyAndFullyBlockedPools() {
		assertThatThrownBy(() -> filter.filter(Side.DEBIT, List.of(), 0.4d, Set.of(), Set.of(), 4))
				.isInstanceOf(EmptyCandidateException.class);
		assertThatThrownBy(() -> filter.filter(Side.CREDIT, List.of(new ScoredCandidate("A", 0.9d, 1.0d)),
				0.4d, Set.of(), Set.of("A"), 4))
				.isInstanceOf(EmptyCandidateException.class)
				.satisfies(ex -> assertThat(((EmptyCandidateException) ex).getSide()).isEqualTo(Side.CREDIT));
	}

	@Test
	void rejectsMoreForcedAccountsThanLines() {
		assertThatThrownBy(() -> filter.filter(Side.DEBIT, List.of(new ScoredCandidate("A", 0.9d, 1.0d)),
				0.4d, Set.of("X", "Y", "Z"), Set.of(), 2))
				.isInstanceOf(InvalidDecodeRequestException.class)
				.hasMessageContaining("max_k_per_side=2");
	}

	@Test
	void selectTopAddsForcedLinesOnTopOfPredictedCount() {
		List<RankedCandidate> filtered = List.of(
				new RankedCandidate("A", 0.9d, 0.3d, false),
				new RankedCandidate("B", 0.8d, 0.3d, false),
				new RankedCandidate("Tax", 0.1d, 0.1d, true));

		assertThat(filter.selectTop(filtered, 1, 4)).extracting(RankedCandidate::accountId).containsExactly("A", "Tax");
		assertThat(filter.selectTop(filtered, 2, 4)).extracting(RankedCandidate::accountId).containsExactly("A", "B", "Tax");
		assertThat(filter.selectTop(filtered, 3, 2)).extracting(RankedCandidate::accountId).containsExactly("A", "Tax");
	}
}
