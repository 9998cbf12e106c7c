package my.journalsuggester.app.predictor;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import my.journalsuggester.app.model.PairPrediction;
import my.journalsuggester.app.model.TransactionContext;
import org.junit.jupiter.api.Test;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpPairwisePredictorTest {
	private static final TransactionContext TRANSACTION =
			new TransactionContext("tx-7", "Office chairs", LocalDate.of(2024, 3, 15), 12_500L);

	@Test
	void noopPredictorIsDisabled() {
		NoopPairwisePredictor predictor = new NoopPairwisePredictor();

		assertThat(predictor.isEnabled()).isFalse();
		assertThat(predictor.predict(TRANSACTION)).isEmpty();
	}

	@Test
	void postsTransactionAndParsesPair() throws IOException {
		AtomicReference<Map<String, Object>> captured = new AtomicReference<>();
		HttpServer server = HttpServer.create(new InetSocketAddress(0), 0);
		server.createContext("/predict", exchange -> {
			Map<String, Object> body = new ObjectMapper().readValue(exchange.getRequestBody().readAllBytes(),
					new TypeReference<Map<String, Object>>() {
					});
			captured.set(body);
			respond(exchange, 200, "{\"debit_account_id\":\"Equipment\",\"credit_account_id\":\"Bank\",\"score\":0.8}");
		});
		server.start();

		try {
			HttpPairwisePredictor predictor = new HttpPairwisePredictor(baseUrl(server));
			Optional<PairPrediction> prediction = predictor.predict(TRANSACTION);

			assertThat(prediction).contains(new PairPrediction("Equipment", "Bank"));
			assertThat(captured.get())
					.containsEntry("transaction_id", "tx-7")
					.containsEntry("description", "Office chairs")
					.containsEntry("date", "2024-03-15")
					.containsEntry("amount", 12500);
		} finally {
			server.stop(0);
		}
	}

	@Test
	void treatsBlankAccountsAsNoOpinion() throws IOException {
		HttpServer server = HttpServer.create(new InetSocketAddress(0), 0);
		server.createContext("/predict", exchange ->
				respond(exchange, 200, "{\"debit_account_id\":\" \",\"credit_account_id\":null}"));
		server.start();

		try {
			HttpPairwisePredictor predictor = new HttpPairwisePredictor(baseUrl(server));

			assertThat(predictor.predict(TRANSACTION)).isEmpty();
		} finally {
			server.stop(0);
		}
	}

	@Test
	void serverErrorIsRetryable() throws IOException {
		HttpServer server = HttpServer.create(new InetSocketAddress(0), 0);
		server.createContext("/predict", exchange -> respond(exchange, 503, "{\"error\":\"warming up\"}"));
		server.start();

		try {
			HttpPairwisePredictor predictor = new HttpPairwisePredictor(baseUrl(server));

			assertThatThrownBy(() -> predictor.predict(TRANSACTION))
					.isInstanceOfSatisfying(PairwisePredictorException.class, ex -> {
						assertThat(ex.getStatusCode()).isEqualTo(503);
						assertThat(ex.isRetryable()).isTrue();
					});
		} finally {
			server.stop(0);
		}
	}

	@Test
	void clientErrorIsNotRetryable() throws IOException {
		HttpServer server = HttpServer.create(new InetSocketAddress(0), 0);
		server.createContext("/predict", exchange -> respond(exchange, 400, "{\"error\":\"bad input\"}"));
		server.start();

		try {
			HttpPairwisePredictor predictor = new HttpPairwisePredictor(baseUrl(server));

			assertThatThrownBy(() -> predictor.predict(TRANSACTION))
					.isInstanceOfSatisfying(PairwisePredictorException.class, ex -> {
						assertThat(ex.getStatusCode()).isEqualTo(400);
						assertThat(ex.isRetryable()).isFalse();
					});
		} finally {
			server.stop(0);
		}
	}

	@Test
	void unreachableServerIsRetryableWithoutStatus() throws IOException {
		HttpServer server = HttpServer.create(new InetSocketAddress(0), 0);
		String baseUrl = baseUrl(server);
		server.stop(0);

		HttpPairwisePredictor predictor = new HttpPairwisePredictor(baseUrl);

		assertThatThrownBy(() -> predictor.predict(TRANSACTION))
				.isInstanceOfSatisfying(PairwisePredictorException.class, ex -> {
					assertThat(ex.getStatusCode()).isNull();
					assertThat(ex.isRetryable()).isTrue();
				});
	}

	private static String baseUrl(HttpServer server) {
		return "http://localhost:" + server.getAddress().getPort();
	}

	private static void respond(HttpExchange exchange, int status, String body) throws IOException {
		byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
		exchange.getResponseHeaders().add("Content-Type", "application/json");
		exchange.sendResponseHeaders(status, bytes.length);
		try (OutputStream output = exchange.getResponseBody()) {
			output.write(bytes);
		}
	}
}
