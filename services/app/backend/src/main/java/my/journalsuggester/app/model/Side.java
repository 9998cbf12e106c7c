package my.journalsuggester.app.model;

import java.util.Locale;

public enum Side {
	DEBIT,
	CREDIT;

	public String label() {
		return name().toLowerCase(Locale.ROOT);
	}
}
