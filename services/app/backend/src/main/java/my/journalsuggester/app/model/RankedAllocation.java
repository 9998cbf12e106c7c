package my.journalsuggester.app.model;

import java.util.List;

public record RankedAllocation(List<Allocation> lines, double jointProbability) {
	public RankedAllocation {
		lines = lines == null ? List.of() : List.copyOf(lines);
	}

	public List<Allocation> lines(Side side) {
		return lines.stream()
				.filter(line -> line.side() == side)
				.toList();
	}
}
