package my.journalsuggester.app.model;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

public record DecisionDebug(Map<String, Double> debitProbabilities,
							Map<String, Double> creditProbabilities,
							Map<String, BigDecimal> debitShares,
							Map<String, BigDecimal> creditShares,
							String decoderUsed,
							String fallbackReason,
							List<FlowPairing> pairings,
							double primaryJointProbability,
							List<String> firedRules) {
	public static final String DECODER_GREEDY = "greedy";
	public static final String DECODER_COMBINATORIAL = "combinatorial";
	public static final String DECODER_GREEDY_FALLBACK = "greedy_fallback";
	public static final String DECODER_KNOWN_LINES = "known_lines";
}
