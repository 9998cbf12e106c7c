package my.journalsuggester.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;

@Schema(description = "Single debit/credit pair from an external model, blended into the scores with the given weight.")
public record ExternalPredictionDto(
		@JsonProperty("debit_account_id") String debitAccountId,
		@JsonProperty("credit_account_id") String creditAccountId,
		@Schema(description = "Blend weight within [0, 1].")
		@JsonProperty("weight") @NotNull Double weight
) {
}
