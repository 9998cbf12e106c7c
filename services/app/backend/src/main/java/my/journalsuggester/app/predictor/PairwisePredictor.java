package my.journalsuggester.app.predictor;

import my.journalsuggester.app.model.PairPrediction;
import my.journalsuggester.app.model.TransactionContext;

import java.util.Optional;

/**
 * Single-pair model consulted when a request carries no external prediction of its own.
 */
public interface PairwisePredictor {
	Optional<PairPrediction> predict(TransactionContext transaction);

	default boolean isEnabled() {
		return true;
	}
}
