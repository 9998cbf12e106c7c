package my.journalsuggester.app.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Everything one decode call needs for a single transaction. Created once per transaction and never mutated.
 */
public record DecodeRequest(String transactionId,
							long total,
							List<ScoredCandidate> debitCandidates,
							List<ScoredCandidate> creditCandidates,
							int predictedKDebit,
							int predictedKCredit,
							int maxKPerSide,
							double thresholdDebit,
							double thresholdCredit,
							Set<String> forcedAccounts,
							Set<String> blockedAccounts,
							ExternalPrediction externalPrediction,
							String description,
							LocalDate date,
							DecoderStrategyType strategy,
							int maxAlternatives,
							List<Allocation> knownLines) {
	public DecodeRequest {
		debitCandidates = debitCandidates == null ? List.of() : List.copyOf(debitCandidates);
		creditCandidates = creditCandidates == null ? List.of() : List.copyOf(creditCandidates);
		forcedAccounts = forcedAccounts == null ? Set.of() : Set.copyOf(forcedAccounts);
		blockedAccounts = blockedAccounts == null ? Set.of() : Set.copyOf(blockedAccounts);
		strategy = strategy == null ? DecoderStrategyType.GREEDY : strategy;
		knownLines = knownLines == null ? List.of() : List.copyOf(knownLines);
	}

	public List<ScoredCandidate> candidates(Side side) {
		return side == Side.DEBIT ? debitCandidates : creditCandidates;
	}

	public double threshold(Side side) {
		return side == Side.DEBIT ? thresholdDebit : thresholdCredit;
	}

	public int predictedK(Side side) {
		return side == Side.DEBIT ? predictedKDebit : predictedKCredit;
	}

	public TransactionContext context() {
		return new TransactionContext(transactionId, description, date, total);
	}

	public static Builder builder() {
		return new Builder();
	}

	public static final class Builder {
		private String transactionId;
		private long total;
		private final List<ScoredCandidate> debitCandidates = new ArrayList<>();
		private final List<ScoredCandidate> creditCandidates = new ArrayList<>();
		private int predictedKDebit = 1;
		private int predictedKCredit = 1;
		private int maxKPerSide = 4;
		private double thresholdDebit = 0.4d;
		private double thresholdCredit = 0.4d;
		private final Set<String> forcedAccounts = new LinkedHashSet<>();
		private final Set<String> blockedAccounts = new LinkedHashSet<>();
		private ExternalPrediction externalPrediction;
		private String description;
		private LocalDate date;
		private DecoderStrategyType strategy = DecoderStrategyType.GREEDY;
		private int maxAlternatives = 3;
		private final List<Allocation> knownLines = new ArrayList<>();

		private Builder() {
		}

		public Builder transactionId(String value) {
			this.transactionId = value;
			return this;
		}

		public Builder total(long value) {
			this.total = value;
			return this;
		}

		public Builder debit(String accountId, double probability, double share) {
			debitCandidates.add(new ScoredCandidate(accountId, probability, share));
			return this;
		}

		public Builder credit(String accountId, double probability, double share) {
			creditCandidates.add(new ScoredCandidate(accountId, probability, share));
			return this;
		}

		public Builder debitCandidates(List<ScoredCandidate> values) {
			debitCandidates.clear();
			if (values != null) {
				debitCandidates.addAll(values);
			}
			return this;
		}

		public Builder creditCandidates(List<ScoredCandidate> values) {
			creditCandidates.clear();
			if (values != null) {
				creditCandidates.addAll(values);
			}
			return this;
		}

		public Builder predictedK(int debit, int credit) {
			this.predictedKDebit = debit;
			this.predictedKCredit = credit;
			return this;
		}

		public Builder maxKPerSide(int value) {
			this.maxKPerSide = value;
			return this;
		}

		public Builder thresholds(double debit, double credit) {
			this.thresholdDebit = debit;
			this.thresholdCredit = credit;
			return this;
		}

		public Builder forced(String... accounts) {
			forcedAccounts.addAll(List.of(accounts));
			return this;
		}

		public Builder forcedAccounts(Set<String> values) {
			if (values != null) {
				forcedAccounts.addAll(values);
			}
			return this;
		}

		public Builder blocked(String... accounts) {
			blockedAccounts.addAll(List.of(accounts));
			return this;
		}

		public Builder blockedAccounts(Set<String> values) {
			if (values != null) {
				blockedAccounts.addAll(values);
			}
			return this;
		}

		public Builder externalPrediction(ExternalPrediction value) {
			this.externalPrediction = value;
			return this;
		}

		public Builder description(String value) {
			this.description = value;
			return this;
		}

		public Builder date(LocalDate value) {
			this.date = value;
			return this;
		}

		public Builder strategy(DecoderStrategyType value) {
			this.strategy = value;
			return this;
		}

		public Builder maxAlternatives(int value) {
			this.maxAlternatives = value;
			return this;
		}

		public Builder knownDebit(String accountId, long amount) {
			knownLines.add(new Allocation(accountId, Side.DEBIT, amount));
			return this;
		}

		public Builder knownCredit(String accountId, long amount) {
			knownLines.add(new Allocation(accountId, Side.CREDIT, amount));
			return this;
		}

		public DecodeRequest build() {
			return new DecodeRequest(transactionId, total, debitCandidates, creditCandidates,
					predictedKDebit, predictedKCredit, maxKPerSide, thresholdDebit, thresholdCredit,
					forcedAccounts, blockedAccounts, externalPrediction, description, date, strategy, maxAlternatives,
					knownLines);
		}
	}
}
