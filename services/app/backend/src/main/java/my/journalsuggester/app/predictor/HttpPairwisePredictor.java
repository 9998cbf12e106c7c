package my.journalsuggester.app.predictor;

import my.journalsuggester.app.model.PairPrediction;
import my.journalsuggester.app.model.TransactionContext;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Calls a remote pair model: {@code POST /predict} with the transaction context, answered by
 * {@code {"debit_account_id": ..., "credit_account_id": ...}}. A missing or blank account means "no opinion".
 */
public class HttpPairwisePredictor implements PairwisePredictor {
	private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(2);
	private static final Duration DEFAULT_READ_TIMEOUT = Duration.ofSeconds(5);

	private final RestClient restClient;

	public HttpPairwisePredictor(String baseUrl) {
		this(baseUrl, DEFAULT_CONNECT_TIMEOUT, DEFAULT_READ_TIMEOUT);
	}

	public HttpPairwisePredictor(String baseUrl, Duration connectTimeout, Duration readTimeout) {
		SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
		requestFactory.setConnectTimeout(connectTimeout == null ? DEFAULT_CONNECT_TIMEOUT : connectTimeout);
		requestFactory.setReadTimeout(readTimeout == null ? DEFAULT_READ_TIMEOUT : readTimeout);
		this.restClient = RestClient.builder()
				.baseUrl(baseUrl)
				.requestFactory(requestFactory)
				.defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
				.build();
	}

	@Override
	public Optional<PairPrediction> predict(TransactionContext transaction) {
		Map<?, ?> response;
		try {
			response = restClient.post().uri("/predict").body(buildRequest(transaction)).retrieve().body(Map.class);
		} catch (RestClientResponseException ex) {
			throw new PairwisePredictorException(safeMessage(ex), ex.getStatusCode().value(), isRetryable(ex), ex);
		} catch (ResourceAccessException ex) {
			throw new PairwisePredictorException(safeMessage(ex), null, true, ex);
		} catch (Exception ex) {
			throw new PairwisePredictorException(safeMessage(ex), null, false, ex);
		}
		if (response == null) {
			return Optional.empty();
		}
		String debit = text(response.get("debit_account_id"));
		String credit = text(response.get("credit_account_id"));
		if (debit == null && credit == null) {
			return Optional.empty();
		}
		return Optional.of(new PairPrediction(debit, credit));
	}

	private Map<String, Object> buildRequest(TransactionContext transaction) {
		Map<String, Object> request = new HashMap<>();
		if (transaction == null) {
			return request;
		}
		request.put("transaction_id", transaction.transactionId());
		request.put("description", transaction.description() == null ? "" : transaction.description());
		if (transaction.date() != null) {
			request.put("date", transaction.date().toString());
		}
		request.put("amount", transaction.total());
		return request;
	}

	private String text(Object value) {
		if (value == null) {
			return null;
		}
		String text = value.toString().trim();
		return text.isEmpty() ? null : text;
	}

	private boolean isRetryable(RestClientResponseException ex) {
		int status = ex.getStatusCode().value();
		return status == 408 || status == 429 || status >= 500;
	}

	private String safeMessage(Exception ex) {
		String message = ex.getMessage();
		if (message == null || message.isBlank()) {
			return ex.getClass().getSimpleName();
		}
		return message.length() > 300 ? message.substring(0, 300) : message;
	}
}
