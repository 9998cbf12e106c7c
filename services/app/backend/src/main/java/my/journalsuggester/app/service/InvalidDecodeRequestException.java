package my.journalsuggester.app.service;

public class InvalidDecodeRequestException extends DecodeException {
	public InvalidDecodeRequestException(String message) {
		super("INVALID_REQUEST", message);
	}
}
