package my.journalsuggester.app.service;

import my.journalsuggester.app.config.AppProperties;
import my.journalsuggester.app.dto.AllocationLineDto;
import my.journalsuggester.app.dto.AlternativeDto;
import my.journalsuggester.app.dto.DecisionDebugDto;
import my.journalsuggester.app.dto.DecisionDto;
import my.journalsuggester.app.dto.DecodeRequestDto;
import my.journalsuggester.app.dto.ExternalPredictionDto;
import my.journalsuggester.app.dto.FlowPairingDto;
import my.journalsuggester.app.dto.KnownLineDto;
import my.journalsuggester.app.dto.ScoredCandidateDto;
import my.journalsuggester.app.model.Allocation;
import my.journalsuggester.app.model.Decision;
import my.journalsuggester.app.model.DecisionDebug;
import my.journalsuggester.app.model.DecodeRequest;
import my.journalsuggester.app.model.DecoderStrategyType;
import my.journalsuggester.app.model.ExternalPrediction;
import my.journalsuggester.app.model.ScoredCandidate;
import my.journalsuggester.app.model.Side;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Converts between the JSON surface and the decoder model. Fields a caller leaves null take the values configured
 * under {@code app.decoder}.
 */
@Component
public class DecodeDtoMapper {
	private final AppProperties.Decoder defaults;
	private final DecoderStrategyType defaultStrategy;

	public DecodeDtoMapper(AppProperties properties) {
		this.defaults = properties.decoder();
		this.defaultStrategy = parseStrategy(defaults.strategy(), DecoderStrategyType.GREEDY);
	}

	public DecodeRequest toRequest(DecodeRequestDto dto) {
		if (dto == null) {
			throw new InvalidDecodeRequestException("Decode request is required");
		}
		// no line count from the caller: let the threshold decide how many lines survive
		int maxK = dto.maxKPerSide() == null ? defaults.maxKPerSide() : dto.maxKPerSide();
		return new DecodeRequest(
				dto.transactionId(),
				dto.total() == null ? 0L : dto.total(),
				toCandidates(dto.debitCandidates()),
				toCandidates(dto.creditCandidates()),
				dto.predictedKDebit() == null ? maxK : dto.predictedKDebit(),
				dto.predictedKCredit() == null ? maxK : dto.predictedKCredit(),
				maxK,
				dto.thresholdDebit() == null ? defaults.thresholdDebit() : dto.thresholdDebit(),
				dto.thresholdCredit() == null ? defaults.thresholdCredit() : dto.thresholdCredit(),
				toSet(dto.forcedAccounts()),
				toSet(dto.blockedAccounts()),
				toExternal(dto.externalPrediction()),
				dto.description(),
				dto.date(),
				requestStrategy(dto.strategy()),
				dto.maxAlternatives() == null ? defaults.maxAlternatives() : dto.maxAlternatives(),
				toKnownLines(dto.knownDebits(), dto.knownCredits())
		);
	}

	public DecisionDto toDto(Decision decision) {
		DecisionDebug debug = decision.debug();
		DecisionDebugDto debugDto = debug == null ? null : new DecisionDebugDto(
				debug.debitProbabilities(),
				debug.creditProbabilities(),
				debug.debitShares(),
				debug.creditShares(),
				debug.decoderUsed(),
				debug.fallbackReason(),
				debug.pairings().stream()
						.map(p -> new FlowPairingDto(p.debitAccountId(), p.creditAccountId(), p.amount()))
						.toList(),
				debug.primaryJointProbability(),
				debug.firedRules()
		);
		List<AlternativeDto> alternates = decision.alternates().stream()
				.map(alternate -> new AlternativeDto(toLines(alternate.lines()), alternate.jointProbability()))
				.toList();
		return new DecisionDto(decision.transactionId(), toLines(decision.primary()), alternates, debugDto);
	}

	private List<AllocationLineDto> toLines(List<Allocation> lines) {
		return lines.stream()
				.map(line -> new AllocationLineDto(line.accountId(), line.side().label(), line.amount()))
				.toList();
	}

	private List<ScoredCandidate> toCandidates(List<ScoredCandidateDto> dtos) {
		if (dtos == null) {
			return List.of();
		}
		List<ScoredCandidate> candidates = new ArrayList<>();
		for (ScoredCandidateDto dto : dtos) {
			if (dto == null) {
				continue;
			}
			candidates.add(new ScoredCandidate(
					dto.accountId(),
					dto.probability() == null ? Double.NaN : dto.probability(),
					dto.share() == null ? 0.0d : dto.share()));
		}
		return candidates;
	}

	private List<Allocation> toKnownLines(List<KnownLineDto> debits, List<KnownLineDto> credits) {
		List<Allocation> lines = new ArrayList<>();
		addKnownLines(lines, Side.DEBIT, debits);
		addKnownLines(lines, Side.CREDIT, credits);
		return lines;
	}

	private void addKnownLines(List<Allocation> lines, Side side, List<KnownLineDto> dtos) {
		if (dtos == null) {
			return;
		}
		for (KnownLineDto dto : dtos) {
			if (dto == null) {
				continue;
			}
			lines.add(new Allocation(dto.accountId(), side, dto.amount() == null ? 0L : dto.amount()));
		}
	}

	private ExternalPrediction toExternal(ExternalPredictionDto dto) {
		if (dto == null) {
			return null;
		}
		return new ExternalPrediction(dto.debitAccountId(), dto.creditAccountId(),
				dto.weight() == null ? Double.NaN : dto.weight());
	}

	private Set<String> toSet(List<String> values) {
		Set<String> set = new LinkedHashSet<>();
		if (values != null) {
			for (String value : values) {
				if (value != null && !value.isBlank()) {
					set.add(value.trim());
				}
			}
		}
		return set;
	}

	private DecoderStrategyType requestStrategy(String value) {
		try {
			return parseStrategy(value, defaultStrategy);
		} catch (IllegalArgumentException ex) {
			throw new InvalidDecodeRequestException(ex.getMessage());
		}
	}

	private static DecoderStrategyType parseStrategy(String value, DecoderStrategyType fallback) {
		DecoderStrategyType type = DecoderStrategyType.fromCode(value);
		return type == null ? fallback : type;
	}
}
