package my.journalsuggester.app.model;

import java.util.List;

public record Decision(String transactionId,
					   List<Allocation> primary,
					   List<RankedAllocation> alternates,
					   DecisionDebug debug) {
	public Decision {
		primary = primary == null ? List.of() : List.copyOf(primary);
		alternates = alternates == null ? List.of() : List.copyOf(alternates);
	}

	public List<Allocation> debits() {
		return lines(Side.DEBIT);
	}

	public List<Allocation> credits() {
		return lines(Side.CREDIT);
	}

	public long total(Side side) {
		return lines(side).stream().mapToLong(Allocation::amount).sum();
	}

	private List<Allocation> lines(Side side) {
		return primary.stream()
				.filter(line -> line.side() == side)
				.toList();
	}
}
