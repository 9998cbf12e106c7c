package my.journalsuggester.app.service.strategy;

import my.journalsuggester.app.model.Allocation;
import my.journalsuggester.app.model.DecisionDebug;
import my.journalsuggester.app.model.DecoderStrategyType;
import my.journalsuggester.app.model.Side;
import my.journalsuggester.app.service.GreedyRoundingDecoder;
import my.journalsuggester.app.service.ShareNormalizer;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class GreedyStrategy implements DecoderStrategy {
	private final GreedyRoundingDecoder decoder;

	public GreedyStrategy(GreedyRoundingDecoder decoder) {
		this.decoder = decoder;
	}

	@Override
	public DecoderStrategyType type() {
		return DecoderStrategyType.GREEDY;
	}

	@Override
	public StrategyResult decode(List<ShareNormalizer.Share> debitShares, List<ShareNormalizer.Share> creditShares, long total) {
		// both sides are rounded against the same total, so they balance without reconciliation
		return decodeSides(debitShares, total, creditShares, total);
	}

	/**
	 * Rounds each side against its own open amount. A side with nothing open gets no lines.
	 */
	public StrategyResult decodeSides(List<ShareNormalizer.Share> debitShares, long debitTotal,
									  List<ShareNormalizer.Share> creditShares, long creditTotal) {
		List<Allocation> debits = debitTotal == 0 ? List.of() : decoder.decodeSide(Side.DEBIT, debitShares, debitTotal);
		List<Allocation> credits = creditTotal == 0 ? List.of() : decoder.decodeSide(Side.CREDIT, creditShares, creditTotal);
		return new StrategyResult(debits, credits, DecisionDebug.DECODER_GREEDY, null, List.of());
	}
}
