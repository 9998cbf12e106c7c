package my.journalsuggester.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record DecodeOutcomeDto(
		@JsonProperty("transaction_id") String transactionId,
		@JsonProperty("status") DecodeStatus status,
		@JsonProperty("decision") DecisionDto decision,
		@JsonProperty("error_code") String errorCode,
		@JsonProperty("error_message") String errorMessage
) {
	public static DecodeOutcomeDto ok(DecisionDto decision) {
		return new DecodeOutcomeDto(decision.transactionId(), DecodeStatus.OK, decision, null, null);
	}

	public static DecodeOutcomeDto failed(String transactionId, String errorCode, String errorMessage) {
		return new DecodeOutcomeDto(transactionId, DecodeStatus.FAILED, null, errorCode, errorMessage);
	}
}
