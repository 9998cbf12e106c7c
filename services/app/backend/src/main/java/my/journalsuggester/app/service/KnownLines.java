package my.journalsuggester.app.service;

import my.journalsuggester.app.model.Allocation;
import my.journalsuggester.app.model.Side;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Helpers for lines the caller has already booked. Decoded lines only cover what the known lines leave open
 * and are merged back afterwards; a decoded line on a known account is added to it.
 */
public final class KnownLines {
	private KnownLines() {
	}

	public static long sum(List<Allocation> known, Side side) {
		long sum = 0L;
		for (Allocation line : known) {
			if (line.side() == side) {
				sum = Math.addExact(sum, line.amount());
			}
		}
		return sum;
	}

	public static int count(List<Allocation> known, Side side) {
		return (int) known.stream().filter(line -> line.side() == side).count();
	}

	public static List<String> accounts(List<Allocation> known, Side side) {
		return known.stream()
				.filter(line -> line.side() == side)
				.map(Allocation::accountId)
				.toList();
	}

	/**
	 * Debits first, then credits; per side the known lines keep their order and new accounts follow.
	 */
	public static List<Allocation> merge(List<Allocation> known, List<Allocation> decoded) {
		if (known == null || known.isEmpty()) {
			return decoded;
		}
		List<Allocation> merged = new ArrayList<>();
		for (Side side : Side.values()) {
			Map<String, Long> amounts = new LinkedHashMap<>();
			for (Allocation line : known) {
				if (line.side() == side) {
					amounts.merge(line.accountId(), line.amount(), Long::sum);
				}
			}
			for (Allocation line : decoded) {
				if (line.side() == side) {
					amounts.merge(line.accountId(), line.amount(), Long::sum);
				}
			}
			amounts.forEach((accountId, amount) -> merged.add(new Allocation(accountId, side, amount)));
		}
		return merged;
	}
}
