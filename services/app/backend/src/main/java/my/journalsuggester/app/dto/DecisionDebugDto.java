package my.journalsuggester.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

@Schema(description = "How the primary allocation was reached.")
public record DecisionDebugDto(
		@Schema(description = "Debit probabilities after blending.")
		@JsonProperty("debit_probabilities") Map<String, Double> debitProbabilities,
		@Schema(description = "Credit probabilities after blending.")
		@JsonProperty("credit_probabilities") Map<String, Double> creditProbabilities,
		@Schema(description = "Normalized debit shares of the primary allocation.")
		@JsonProperty("debit_shares") Map<String, BigDecimal> debitShares,
		@Schema(description = "Normalized credit shares of the primary allocation.")
		@JsonProperty("credit_shares") Map<String, BigDecimal> creditShares,
		@Schema(description = "greedy, combinatorial or greedy_fallback.")
		@JsonProperty("decoder_used") String decoderUsed,
		@JsonProperty("fallback_reason") String fallbackReason,
		@Schema(description = "Debit to credit flows, combinatorial decoder only.")
		@JsonProperty("pairings") List<FlowPairingDto> pairings,
		@JsonProperty("primary_joint_probability") double primaryJointProbability,
		@Schema(description = "Ids of the account rules that matched the description.")
		@JsonProperty("fired_rules") List<String> firedRules
) {
}
