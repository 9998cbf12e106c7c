package my.journalsuggester.app.service.strategy;

public class SolverTimeoutException extends RuntimeException {
	public SolverTimeoutException(String message) {
		super(message);
	}

	public SolverTimeoutException(String message, Throwable cause) {
		super(message, cause);
	}
}
