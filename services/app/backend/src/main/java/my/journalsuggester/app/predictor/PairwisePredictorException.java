package my.journalsuggester.app.predictor;

public class PairwisePredictorException extends RuntimeException {
	private final Integer statusCode;
	private final boolean retryable;

	public PairwisePredictorException(String message, Integer statusCode, boolean retryable, Throwable cause) {
		super(message, cause);
		this.statusCode = statusCode;
		this.retryable = retryable;
	}

	public Integer getStatusCode() {
		return statusCode;
	}

	public boolean isRetryable() {
		return retryable;
	}
}
