package my.journalsuggester.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.time.LocalDate;
import java.util.List;

@Schema(description = "One transaction to decode. Null tuning fields fall back to the configured defaults.")
public record DecodeRequestDto(
		@JsonProperty("transaction_id") String transactionId,
		@Schema(description = "Transaction total in integer minor units.")
		@JsonProperty("total") @NotNull Long total,
		@JsonProperty("debit_candidates") @Valid List<ScoredCandidateDto> debitCandidates,
		@JsonProperty("credit_candidates") @Valid List<ScoredCandidateDto> creditCandidates,
		@JsonProperty("predicted_k_debit") Integer predictedKDebit,
		@JsonProperty("predicted_k_credit") Integer predictedKCredit,
		@JsonProperty("max_k_per_side") Integer maxKPerSide,
		@JsonProperty("threshold_debit") Double thresholdDebit,
		@JsonProperty("threshold_credit") Double thresholdCredit,
		@JsonProperty("forced_accounts") List<String> forcedAccounts,
		@JsonProperty("blocked_accounts") List<String> blockedAccounts,
		@JsonProperty("external_prediction") @Valid ExternalPredictionDto externalPrediction,
		@Schema(description = "Free-text description, used by the account rules and the pairwise predictor.")
		@JsonProperty("description") String description,
		@JsonProperty("date") LocalDate date,
		@Schema(description = "greedy or combinatorial.")
		@JsonProperty("strategy") String strategy,
		@Schema(description = "Number of allocations to return, primary included.")
		@JsonProperty("max_alternatives") Integer maxAlternatives,
		@Schema(description = "Debit lines already booked; the decoder fills the remaining amount.")
		@JsonProperty("known_debits") @Valid List<KnownLineDto> knownDebits,
		@Schema(description = "Credit lines already booked; the decoder fills the remaining amount.")
		@JsonProperty("known_credits") @Valid List<KnownLineDto> knownCredits
) {
}
