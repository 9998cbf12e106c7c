package my.journalsuggester.app.service;

/**
 * Fatal, per-transaction decode failure. No partial allocation accompanies it.
 */
public abstract class DecodeException extends RuntimeException {
	private final String errorCode;

	protected DecodeException(String errorCode, String message) {
		super(message);
		this.errorCode = errorCode;
	}

	public String getErrorCode() {
		return errorCode;
	}
}
