package my.journalsuggester.app.dto;

public enum DecodeStatus {
	OK,
	FAILED
}
