package my.journalsuggester.app.predictor;

import my.journalsuggester.app.model.PairPrediction;
import my.journalsuggester.app.model.TransactionContext;

import java.util.Optional;

public class NoopPairwisePredictor implements PairwisePredictor {
	@Override
	public Optional<PairPrediction> predict(TransactionContext transaction) {
		return Optional.empty();
	}

	@Override
	public boolean isEnabled() {
		return false;
	}
}
