package my.journalsuggester.app.service;

public class InvalidTotalException extends DecodeException {
	public InvalidTotalException(long total) {
		super("INVALID_TOTAL", "Transaction total must be positive, got " + total);
	}
}
