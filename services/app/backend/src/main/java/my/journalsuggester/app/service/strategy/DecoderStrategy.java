package my.journalsuggester.app.service.strategy;

import my.journalsuggester.app.model.DecoderStrategyType;
import my.journalsuggester.app.service.ShareNormalizer;

import java.util.List;

/**
 * Turns normalized debit and credit shares into integer lines that both sum to {@code total}.
 */
public interface DecoderStrategy {
	DecoderStrategyType type();

	StrategyResult decode(List<ShareNormalizer.Share> debitShares, List<ShareNormalizer.Share> creditShares, long total);
}
