package my.journalsuggester.app.service;

import my.journalsuggester.app.config.AppProperties;
import my.journalsuggester.app.dto.DecodeBatchResponseDto;
import my.journalsuggester.app.dto.DecodeOutcomeDto;
import my.journalsuggester.app.dto.DecodeRequestDto;
import my.journalsuggester.app.dto.DecodeStatus;
import my.journalsuggester.app.dto.ScoredCandidateDto;
import my.journalsuggester.app.predictor.NoopPairwisePredictor;
import my.journalsuggester.app.rules.AccountRulesEngine;
import my.journalsuggester.app.service.strategy.FlowStrategy;
import my.journalsuggester.app.service.strategy.GreedyStrategy;
import my.journalsuggester.app.service.strategy.MinCostFlowSolver;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DecodeBatchServiceTest {
	private FlowStrategy flowStrategy;
	private DecodeBatchService batchService;

	@BeforeEach
	void setUp() {
		AppProperties properties = new AppProperties(
				new AppProperties.Decoder(0.4d, 0.4d, 4, 2, "greedy", null,
						new AppProperties.Decoder.Flow(true, Duration.ofSeconds(5)),
						new AppProperties.Decoder.Batch(3)),
				new AppProperties.Predictor("none", 0.0d, null));
		CandidateFilter filter = new CandidateFilter();
		ShareNormalizer normalizer = new ShareNormalizer();
		GreedyRoundingDecoder decoder = new GreedyRoundingDecoder();
		GreedyStrategy greedy = new GreedyStrategy(decoder);
		flowStrategy = new FlowStrategy(greedy, new MinCostFlowSolver(), Duration.ofSeconds(5));
		JournalDecoderService decoderService = new JournalDecoderService(filter, normalizer, new ExternalBlender(),
				new AlternativeRanker(filter, normalizer, decoder), List.of(greedy, flowStrategy),
				AccountRulesEngine.empty(), new NoopPairwisePredictor(), properties);
		batchService = new DecodeBatchService(decoderService, new DecodeDtoMapper(properties), properties);
	}

	@AfterEach
	void tearDown() {
		batchService.shutdown();
		flowStrategy.shutdown();
	}

	@Test
	void isolatesFailuresAndKeepsRequestOrder() {
		DecodeBatchResponseDto response = batchService.decodeBatch(List.of(
				request("t-1", 100L, null),
				request("t-2", 0L, null),
				request("t-3", 250L, "combinatorial"),
				request("t-4", 100L, "simplex")));

		assertThat(response.results()).extracting(DecodeOutcomeDto::transactionId)
				.containsExactly("t-1", "t-2", "t-3", "t-4");
		assertThat(response.results()).extracting(DecodeOutcomeDto::status)
				.containsExactly(DecodeStatus.OK, DecodeStatus.FAILED, DecodeStatus.OK, DecodeStatus.FAILED);
		assertThat(response.results().get(1).errorCode()).isEqualTo("INVALID_TOTAL");
		assertThat(response.results().get(1).decision()).isNull();
		assertThat(response.results().get(3).errorCode()).isEqualTo("INVALID_REQUEST");
		assertThat(response.results().get(2).decision().debug().decoderUsed()).isEqualTo("combinatorial");
	}

	@Test
	void appliesConfiguredDefaults() {
		DecodeOutcomeDto outcome = batchService.decodeBatch(List.of(request("t-1", 100L, null))).results().get(0);

		// without predicted_k every candidate above the 0.4 threshold gets a line
		assertThat(outcome.decision().primary()).extracting(line -> line.accountId() + ":" + line.side() + ":" + line.amount())
				.containsExactly("Cash:debit:70", "Bank:debit:30", "Revenue:credit:100");
		// max_alternatives defaults to 2, so one alternate besides the primary
		assertThat(outcome.decision().alternates()).hasSize(1);
	}

	@Test
	void decodesManyTransactionsInParallel() {
		List<DecodeRequestDto> requests = new ArrayList<>();
		for (int i = 0; i < 40; i++) {
			requests.add(request("t-" + i, 100L + i, i % 2 == 0 ? "greedy" : "combinatorial"));
		}

		DecodeBatchResponseDto response = batchService.decodeBatch(requests);

		assertThat(response.results()).hasSize(40);
		assertThat(response.results()).allSatisfy(outcome -> assertThat(outcome.status()).isEqualTo(DecodeStatus.OK));
		assertThat(response.results().get(39).transactionId()).isEqualTo("t-39");
	}

	@Test
	void returnsEmptyResultForEmptyBatch() {
		assertThat(batchService.decodeBatch(List.of()).results()).isEmpty();
		assertThat(batchService.decodeBatch(null).results()).isEmpty();
	}

	private DecodeRequestDto request(String transactionId, long total, String strategy) {
		return new DecodeRequestDto(transactionId, total,
				List.of(new ScoredCandidateDto("Cash", 0.9d, 0.7d), new ScoredCandidateDto("Bank", 0.45d, 0.3d)),
				List.of(new ScoredCandidateDto("Revenue", 0.95d, 1.0d)),
				null, null, null, null, null, null, null, null, null, null, strategy, null, null, null);
	}
}
