package my.journalsuggester.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record AllocationLineDto(
		@JsonProperty("account_id") String accountId,
		@JsonProperty("side") String side,
		@JsonProperty("amount") long amount
) {
}
