package my.journalsuggester.app.service.strategy;

import my.journalsuggester.app.model.Allocation;
import my.journalsuggester.app.model.FlowPairing;

import java.util.List;

public record StrategyResult(List<Allocation> debits,
							 List<Allocation> credits,
							 String decoderUsed,
							 String fallbackReason,
							 List<FlowPairing> pairings) {
	public StrategyResult {
		debits = List.copyOf(debits);
		credits = List.copyOf(credits);
		pairings = pairings == null ? List.of() : List.copyOf(pairings);
	}

	public StrategyResult asFallback(String decoder, String reason) {
		return new StrategyResult(debits, credits, decoder, reason, pairings);
	}
}
