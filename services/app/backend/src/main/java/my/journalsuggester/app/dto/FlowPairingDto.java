package my.journalsuggester.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record FlowPairingDto(
		@JsonProperty("debit_account_id") String debitAccountId,
		@JsonProperty("credit_account_id") String creditAccountId,
		@JsonProperty("amount") long amount
) {
}
