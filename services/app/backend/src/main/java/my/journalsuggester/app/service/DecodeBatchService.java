package my.journalsuggester.app.service;

import jakarta.annotation.PreDestroy;
import my.journalsuggester.app.config.AppProperties;
import my.journalsuggester.app.dto.DecodeBatchResponseDto;
import my.journalsuggester.app.dto.DecodeOutcomeDto;
import my.journalsuggester.app.dto.DecodeRequestDto;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Decodes many transactions in parallel, one task per transaction. A failing transaction only fails its own
 * outcome; results come back in request order.
 */
@Service
public class DecodeBatchService {
	private static final Logger logger = LoggerFactory.getLogger(DecodeBatchService.class);
	private static final int DEFAULT_PARALLELISM = 4;
	static final String INTERNAL_ERROR = "INTERNAL_ERROR";

	private final JournalDecoderService decoderService;
	private final DecodeDtoMapper mapper;
	private final ExecutorService executor;

	public DecodeBatchService(JournalDecoderService decoderService, DecodeDtoMapper mapper, AppProperties properties) {
		this.decoderService = decoderService;
		this.mapper = mapper;
		AppProperties.Decoder.Batch batch = properties.decoder().batch();
		int parallelism = batch == null ? DEFAULT_PARALLELISM : Math.max(1, batch.parallelism());
		this.executor = Executors.newFixedThreadPool(parallelism);
	}

	public DecodeBatchResponseDto decodeBatch(List<DecodeRequestDto> transactions) {
		if (transactions == null || transactions.isEmpty()) {
			return new DecodeBatchResponseDto(List.of());
		}
		List<Future<DecodeOutcomeDto>> futures = new ArrayList<>();
		for (DecodeRequestDto transaction : transactions) {
			futures.add(executor.submit(() -> decodeOne(transaction)));
		}
		List<DecodeOutcomeDto> results = new ArrayList<>();
		for (int i = 0; i < futures.size(); i++) {
			try {
				results.add(futures.get(i).get());
			} catch (InterruptedException ex) {
				futures.forEach(future -> future.cancel(true));
				Thread.currentThread().interrupt();
				throw new IllegalStateException("Interrupted while decoding batch", ex);
			} catch (ExecutionException ex) {
				String transactionId = transactions.get(i) == null ? null : transactions.get(i).transactionId();
				logger.error("Decode task failed for transaction {}", transactionId, ex.getCause());
				results.add(DecodeOutcomeDto.failed(transactionId, INTERNAL_ERROR, "Unexpected error"));
			}
		}
		long failed = results.stream().filter(result -> result.decision() == null).count();
		logger.info("Decoded batch of {} transactions ({} failed).", results.size(), failed);
		return new DecodeBatchResponseDto(List.copyOf(results));
	}

	@PreDestroy
	public void shutdown() {
		executor.shutdownNow();
	}

	private DecodeOutcomeDto decodeOne(DecodeRequestDto transaction) {
		String transactionId = transaction == null ? null : transaction.transactionId();
		try {
			return DecodeOutcomeDto.ok(mapper.toDto(decoderService.decode(mapper.toRequest(transaction))));
		} catch (DecodeException ex) {
			logger.debug("Transaction {} rejected ({}): {}", transactionId, ex.getErrorCode(), ex.getMessage());
			return DecodeOutcomeDto.failed(transactionId, ex.getErrorCode(), ex.getMessage());
		} catch (RuntimeException ex) {
			logger.error("Unexpected decode failure for transaction {}", transactionId, ex);
			return DecodeOutcomeDto.failed(transactionId, INTERNAL_ERROR, "Unexpected error");
		}
	}
}
