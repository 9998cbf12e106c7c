package my.journalsuggester.app.service;

import my.journalsuggester.app.model.Side;

public class EmptyCandidateException extends DecodeException {
	private final Side side;

	public EmptyCandidateException(Side side, String message) {
		super("EMPTY_CANDIDATES", message);
		this.side = side;
	}

	public Side getSide() {
		return side;
	}
}
