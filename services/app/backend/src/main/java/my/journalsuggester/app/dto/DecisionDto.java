package my.journalsuggester.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(description = "Balanced allocation for one transaction.")
public record DecisionDto(
		@JsonProperty("transaction_id") String transactionId,
		@Schema(description = "Primary allocation lines; debits first.")
		@JsonProperty("primary") List<AllocationLineDto> primary,
		@Schema(description = "Alternative allocations, best first.")
		@JsonProperty("alternates") List<AlternativeDto> alternates,
		@JsonProperty("debug") DecisionDebugDto debug
) {
}
