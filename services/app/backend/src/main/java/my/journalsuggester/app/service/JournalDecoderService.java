package my.journalsuggester.app.service;

import my.journalsuggester.app.config.AppProperties;
import my.journalsuggester.app.model.Allocation;
import my.journalsuggester.app.model.Decision;
import my.journalsuggester.app.model.DecisionDebug;
import my.journalsuggester.app.model.DecodeRequest;
import my.journalsuggester.app.model.DecoderStrategyType;
import my.journalsuggester.app.model.ExternalPrediction;
import my.journalsuggester.app.model.PairPrediction;
import my.journalsuggester.app.model.RankedAllocation;
import my.journalsuggester.app.model.RankedCandidate;
import my.journalsuggester.app.model.ScoredCandidate;
import my.journalsuggester.app.model.Side;
import my.journalsuggester.app.predictor.PairwisePredictor;
import my.journalsuggester.app.rules.AccountRulesEngine;
import my.journalsuggester.app.rules.ResolvedAccountRules;
import my.journalsuggester.app.service.strategy.DecoderStrategy;
import my.journalsuggester.app.service.strategy.GreedyStrategy;
import my.journalsuggester.app.service.strategy.StrategyResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Decodes one transaction into a balanced primary allocation plus ranked alternates.
 * <p>
 * Order of work: validation, description rules, known lines, external blend, candidate filtering, primary line
 * count, normalization, strategy, alternatives. Known lines are kept as given and only the amount they leave open
 * on each side is decoded. The call is synchronous and keeps no state between requests.
 */
@Service
public class JournalDecoderService {
	private static final Logger logger = LoggerFactory.getLogger(JournalDecoderService.class);

	private final CandidateFilter candidateFilter;
	private final ShareNormalizer shareNormalizer;
	private final ExternalBlender externalBlender;
	private final AlternativeRanker alternativeRanker;
	private final Map<DecoderStrategyType, DecoderStrategy> strategies;
	private final AccountRulesEngine rulesEngine;
	private final PairwisePredictor pairwisePredictor;
	private final double predictorWeight;

	public JournalDecoderService(CandidateFilter candidateFilter,
								 ShareNormalizer shareNormalizer,
								 ExternalBlender externalBlender,
								 AlternativeRanker alternativeRanker,
								 List<DecoderStrategy> strategies,
								 AccountRulesEngine rulesEngine,
								 PairwisePredictor pairwisePredictor,
								 AppProperties properties) {
		this.candidateFilter = candidateFilter;
		this.shareNormalizer = shareNormalizer;
		this.externalBlender = externalBlender;
		this.alternativeRanker = alternativeRanker;
		this.strategies = new EnumMap<>(DecoderStrategyType.class);
		for (DecoderStrategy strategy : strategies) {
			this.strategies.put(strategy.type(), strategy);
		}
		this.rulesEngine = rulesEngine == null ? AccountRulesEngine.empty() : rulesEngine;
		this.pairwisePredictor = pairwisePredictor;
		this.predictorWeight = properties == null || properties.predictor() == null ? 0.0d : properties.predictor().weight();
	}

	public Decision decode(DecodeRequest request) {
		validate(request);
		ResolvedAccountRules rules = rulesEngine.resolve(request.description());
		Set<String> forced = union(request.forcedAccounts(), rules.forcedAccounts());
		Set<String> blocked = union(request.blockedAccounts(), rules.blockedAccounts());
		Set<String> conflicts = new TreeSet<>(forced);
		conflicts.retainAll(blocked);
		if (!conflicts.isEmpty()) {
			throw new InfeasibleForceBlockException(conflicts);
		}
		List<Allocation> known = request.knownLines();
		validateKnownLines(request, blocked);
		int maxK = request.maxKPerSide();
		Map<Side, Long> open = new EnumMap<>(Side.class);
		Map<Side, Integer> sideMaxK = new EnumMap<>(Side.class);
		for (Side side : Side.values()) {
			open.put(side, request.total() - KnownLines.sum(known, side));
			sideMaxK.put(side, maxK - KnownLines.count(known, side));
		}

		Map<Side, Set<String>> forcedBySide = forcedBySide(forced, request);
		Map<Side, Set<String>> openForced = new EnumMap<>(Side.class);
		for (Side side : Side.values()) {
			Set<String> unmet = new LinkedHashSet<>(forcedBySide.get(side));
			unmet.removeAll(KnownLines.accounts(known, side));
			openForced.put(side, unmet);
			if (open.get(side) == 0) {
				if (!unmet.isEmpty()) {
					throw new InvalidDecodeRequestException(String.format(
							"Known %s lines cover the total but leave forced accounts %s without a line",
							side.label(), unmet));
				}
				continue;
			}
			requireCandidates(side, request.candidates(side));
			if (unmet.size() > open.get(side)) {
				throw new InvalidDecodeRequestException(String.format(
						"total=%d cannot give each of the %d forced %s accounts a line",
						open.get(side), unmet.size(), side.label()));
			}
		}

		ExternalPrediction external = resolveExternal(request);
		List<ScoredCandidate> debitPool = blendSide(Side.DEBIT, request.debitCandidates(),
				external == null ? null : external.debitAccountId(), external, blocked);
		List<ScoredCandidate> creditPool = blendSide(Side.CREDIT, request.creditCandidates(),
				external == null ? null : external.creditAccountId(), external, blocked);

		List<RankedCandidate> debitFiltered = filterSide(Side.DEBIT, debitPool, request, openForced, blocked,
				open, sideMaxK);
		List<RankedCandidate> creditFiltered = filterSide(Side.CREDIT, creditPool, request, openForced, blocked,
				open, sideMaxK);
		List<ShareNormalizer.Share> debitShares = debitFiltered.isEmpty() ? List.of() : shareNormalizer.normalize(
				candidateFilter.selectTop(debitFiltered, clampK(request.predictedKDebit(), sideMaxK.get(Side.DEBIT)),
						sideMaxK.get(Side.DEBIT)));
		List<ShareNormalizer.Share> creditShares = creditFiltered.isEmpty() ? List.of() : shareNormalizer.normalize(
				candidateFilter.selectTop(creditFiltered, clampK(request.predictedKCredit(), sideMaxK.get(Side.CREDIT)),
						sideMaxK.get(Side.CREDIT)));

		StrategyResult result = decodeOpen(request.strategy(), debitShares, open.get(Side.DEBIT),
				creditShares, open.get(Side.CREDIT));
		List<Allocation> decoded = new ArrayList<>(result.debits());
		decoded.addAll(result.credits());
		List<Allocation> primary = KnownLines.merge(known, decoded);

		List<RankedAllocation> alternates = alternativeRanker.rank(
				new AlternativeRanker.SidePlan(debitFiltered, open.get(Side.DEBIT), sideMaxK.get(Side.DEBIT)),
				new AlternativeRanker.SidePlan(creditFiltered, open.get(Side.CREDIT), sideMaxK.get(Side.CREDIT)),
				known, primary, request.maxAlternatives() - 1);

		Map<String, Double> probabilities = new HashMap<>();
		debitFiltered.forEach(c -> probabilities.put(Side.DEBIT.label() + ":" + c.accountId(), c.probability()));
		creditFiltered.forEach(c -> probabilities.put(Side.CREDIT.label() + ":" + c.accountId(), c.probability()));
		DecisionDebug debug = new DecisionDebug(
				probabilityMap(debitPool),
				probabilityMap(creditPool),
				shareMap(debitShares),
				shareMap(creditShares),
				result.decoderUsed(),
				result.fallbackReason(),
				result.pairings(),
				AlternativeRanker.jointProbability(decoded, probabilities),
				rules.firedRuleIds()
		);
		Decision decision = new Decision(request.transactionId(), primary, alternates, debug);
		verify(decision, request, forcedBySide);
		logger.debug("Decoded transaction {} (decoder={}, debits={}, credits={}, known={}, alternates={})",
				request.transactionId(), result.decoderUsed(), decision.debits().size(), decision.credits().size(),
				known.size(), alternates.size());
		return decision;
	}

	private void validate(DecodeRequest request) {
		if (request == null) {
			throw new InvalidDecodeRequestException("Decode request is required");
		}
		if (request.total() <= 0) {
			throw new InvalidTotalException(request.total());
		}
		if (request.predictedKDebit() < 1 || request.predictedKCredit() < 1) {
			throw new InvalidDecodeRequestException("predicted_k must be at least 1 on both sides");
		}
		if (request.maxKPerSide() < 1) {
			throw new InvalidDecodeRequestException("max_k_per_side must be at least 1");
		}
		if (request.maxAlternatives() < 1) {
			throw new InvalidDecodeRequestException("max_alternatives must be at least 1");
		}
		requireUnitInterval("threshold_debit", request.thresholdDebit());
		requireUnitInterval("threshold_credit", request.thresholdCredit());
		validateCandidates(Side.DEBIT, request.debitCandidates());
		validateCandidates(Side.CREDIT, request.creditCandidates());
		ExternalPrediction external = request.externalPrediction();
		if (external != null) {
			requireUnitInterval("external_prediction.weight", external.weight());
		}
	}

	private void validateKnownLines(DecodeRequest request, Set<String> blocked) {
		List<Allocation> known = request.knownLines();
		for (Side side : Side.values()) {
			Set<String> accounts = new HashSet<>();
			for (Allocation line : known) {
				if (line.side() != side) {
					continue;
				}
				if (line.accountId() == null || line.accountId().isBlank()) {
					throw new InvalidDecodeRequestException("Every known " + side.label() + " line needs an account id");
				}
				if (line.amount() < 1) {
					throw new InvalidDecodeRequestException(
							"Known " + side.label() + " line " + line.accountId() + " must have a positive amount");
				}
				if (!accounts.add(line.accountId())) {
					throw new InvalidDecodeRequestException(
							"Known " + side.label() + " account " + line.accountId() + " is listed twice");
				}
				if (blocked.contains(line.accountId())) {
					throw new InvalidDecodeRequestException(
							"Known " + side.label() + " account " + line.accountId() + " is blocked");
				}
			}
			long booked = KnownLines.sum(known, side);
			if (booked > request.total()) {
				throw new InvalidDecodeRequestException(String.format(
						"Known %s lines sum to %d, more than total=%d", side.label(), booked, request.total()));
			}
			int count = accounts.size();
			if (count > request.maxKPerSide() || (count == request.maxKPerSide() && booked < request.total())) {
				throw new InvalidDecodeRequestException(String.format(
						"%d known %s lines leave no room within max_k_per_side=%d",
						count, side.label(), request.maxKPerSide()));
			}
		}
	}

	private void validateCandidates(Side side, List<ScoredCandidate> candidates) {
		for (ScoredCandidate candidate : candidates) {
			if (candidate == null || candidate.accountId() == null || candidate.accountId().isBlank()) {
				throw new InvalidDecodeRequestException("Every " + side.label() + " candidate needs an account id");
			}
			requireUnitInterval(side.label() + " probability of " + candidate.accountId(), candidate.probability());
			double share = candidate.share();
			if (Double.isNaN(share) || Double.isInfinite(share) || share < 0.0d) {
				throw new InvalidDecodeRequestException(
						side.label() + " share of " + candidate.accountId() + " must be a finite value >= 0");
			}
		}
	}

	private void requireUnitInterval(String field, double value) {
		if (Double.isNaN(value) || value < 0.0d || value > 1.0d) {
			throw new InvalidDecodeRequestException(field + " must be within [0, 1]");
		}
	}

	private void requireCandidates(Side side, List<ScoredCandidate> candidates) {
		if (candidates.isEmpty()) {
			throw new EmptyCandidateException(side, "No scored " + side.label() + " candidates");
		}
	}

	private ExternalPrediction resolveExternal(DecodeRequest request) {
		if (request.externalPrediction() != null) {
			return request.externalPrediction();
		}
		if (pairwisePredictor == null || !pairwisePredictor.isEnabled() || predictorWeight <= 0.0d) {
			return null;
		}
		try {
			Optional<PairPrediction> prediction = pairwisePredictor.predict(request.context());
			return prediction
					.map(pair -> new ExternalPrediction(pair.debitAccountId(), pair.creditAccountId(), predictorWeight))
					.orElse(null);
		} catch (RuntimeException ex) {
			logger.warn("Pairwise predictor failed for transaction {}, decoding without it: {}",
					request.transactionId(), ex.getMessage());
			return null;
		}
	}

	private List<ScoredCandidate> blendSide(Side side, List<ScoredCandidate> pool, String namedAccountId,
											ExternalPrediction external, Set<String> blocked) {
		if (external == null) {
			return pool;
		}
		if (namedAccountId != null && blocked.contains(namedAccountId)) {
			logger.debug("External {} account {} is blocked, keeping the scored pool", side.label(), namedAccountId);
			return pool;
		}
		return externalBlender.blend(pool, namedAccountId, external.weight());
	}

	private List<RankedCandidate> filterSide(Side side, List<ScoredCandidate> pool, DecodeRequest request,
											 Map<Side, Set<String>> openForced, Set<String> blocked,
											 Map<Side, Long> open, Map<Side, Integer> sideMaxK) {
		if (open.get(side) == 0) {
			return List.of();
		}
		return candidateFilter.filter(side, pool, request.threshold(side), openForced.get(side), blocked,
				sideMaxK.get(side));
	}

	private StrategyResult decodeOpen(DecoderStrategyType type,
									  List<ShareNormalizer.Share> debitShares, long debitOpen,
									  List<ShareNormalizer.Share> creditShares, long creditOpen) {
		if (debitOpen == 0 && creditOpen == 0) {
			return new StrategyResult(List.of(), List.of(), DecisionDebug.DECODER_KNOWN_LINES, null, List.of());
		}
		DecoderStrategy requested = strategy(type);
		if (debitOpen == creditOpen) {
			return requested.decode(debitShares, creditShares, debitOpen);
		}
		if (!(strategy(DecoderStrategyType.GREEDY) instanceof GreedyStrategy greedy)) {
			throw new IllegalStateException("Unequal open amounts need the greedy strategy");
		}
		StrategyResult result = greedy.decodeSides(debitShares, debitOpen, creditShares, creditOpen);
		if (requested.type() != DecoderStrategyType.GREEDY) {
			return result.asFallback(DecisionDebug.DECODER_GREEDY_FALLBACK, "Known lines leave unequal side totals");
		}
		return result;
	}

	// forced on each side where it is scored; scored nowhere means the debit side
	private Map<Side, Set<String>> forcedBySide(Set<String> forced, DecodeRequest request) {
		Set<String> debitIds = accountIds(request.debitCandidates());
		Set<String> creditIds = accountIds(request.creditCandidates());
		Map<Side, Set<String>> result = new EnumMap<>(Side.class);
		result.put(Side.DEBIT, new LinkedHashSet<>());
		result.put(Side.CREDIT, new LinkedHashSet<>());
		for (String accountId : forced) {
			boolean onDebit = debitIds.contains(accountId);
			boolean onCredit = creditIds.contains(accountId);
			if (onDebit || !onCredit) {
				result.get(Side.DEBIT).add(accountId);
			}
			if (onCredit) {
				result.get(Side.CREDIT).add(accountId);
			}
		}
		return result;
	}

	private DecoderStrategy strategy(DecoderStrategyType type) {
		DecoderStrategy strategy = strategies.get(type == null ? DecoderStrategyType.GREEDY : type);
		if (strategy == null) {
			throw new IllegalStateException("No decoder strategy registered for " + type);
		}
		return strategy;
	}

	private void verify(Decision decision, DecodeRequest request, Map<Side, Set<String>> forcedBySide) {
		for (Side side : Side.values()) {
			List<Allocation> lines = side == Side.DEBIT ? decision.debits() : decision.credits();
			if (decision.total(side) != request.total()) {
				throw new IllegalStateException(side.label() + " lines sum to " + decision.total(side)
						+ " instead of " + request.total());
			}
			if (lines.isEmpty() || lines.size() > request.maxKPerSide()) {
				throw new IllegalStateException(side.label() + " side has " + lines.size() + " lines");
			}
			Set<String> present = new HashSet<>();
			for (Allocation line : lines) {
				if (line.amount() < 1) {
					throw new IllegalStateException("Non-positive amount on " + line.accountId());
				}
				present.add(line.accountId());
			}
			if (!present.containsAll(forcedBySide.get(side))) {
				throw new IllegalStateException("Forced " + side.label() + " account missing from allocation");
			}
		}
	}

	private int clampK(int k, int maxK) {
		return Math.max(1, Math.min(k, maxK));
	}

	private Set<String> union(Set<String> first, Set<String> second) {
		Set<String> union = new LinkedHashSet<>(first);
		union.addAll(second);
		return union;
	}

	private Set<String> accountIds(List<ScoredCandidate> candidates) {
		Set<String> ids = new HashSet<>();
		for (ScoredCandidate candidate : candidates) {
			ids.add(candidate.accountId());
		}
		return ids;
	}

	private Map<String, Double> probabilityMap(List<ScoredCandidate> pool) {
		Map<String, Double> probabilities = new LinkedHashMap<>();
		for (ScoredCandidate candidate : pool) {
			probabilities.putIfAbsent(candidate.accountId(), candidate.probability());
		}
		return probabilities;
	}

	private Map<String, BigDecimal> shareMap(List<ShareNormalizer.Share> shares) {
		Map<String, BigDecimal> values = new LinkedHashMap<>();
		for (ShareNormalizer.Share share : shares) {
			values.put(share.accountId(), share.value());
		}
		return values;
	}
}
