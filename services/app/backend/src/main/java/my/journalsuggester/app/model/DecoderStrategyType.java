package my.journalsuggester.app.model;

import java.util.Locale;

public enum DecoderStrategyType {
	GREEDY("greedy"),
	COMBINATORIAL("combinatorial");

	private final String code;

	DecoderStrategyType(String code) {
		this.code = code;
	}

	public String code() {
		return code;
	}

	public static DecoderStrategyType fromCode(String value) {
		if (value == null || value.isBlank()) {
			return null;
		}
		String normalized = value.trim().toLowerCase(Locale.ROOT);
		for (DecoderStrategyType type : values()) {
			if (type.code.equals(normalized)) {
				return type;
			}
		}
		if (normalized.equals("flow") || normalized.equals("ilp")) {
			return COMBINATORIAL;
		}
		throw new IllegalArgumentException("Unknown decoder strategy: " + value);
	}
}
