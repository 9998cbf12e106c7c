package my.journalsuggester.app.service.strategy;

public class SolverUnavailableException extends RuntimeException {
	public SolverUnavailableException(String message) {
		super(message);
	}

	public SolverUnavailableException(String message, Throwable cause) {
		super(message, cause);
	}
}
