package my.journalsuggester.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

@Schema(description = "Model score for one account on one side.")
public record ScoredCandidateDto(
		@Schema(description = "Account identifier.")
		@JsonProperty("account_id") @NotBlank String accountId,
		@Schema(description = "Probability that the account appears on this side, within [0, 1].")
		@JsonProperty("probability") @NotNull Double probability,
		@Schema(description = "Estimated proportion of the side total. Missing means 0.")
		@JsonProperty("share") Double share
) {
}
