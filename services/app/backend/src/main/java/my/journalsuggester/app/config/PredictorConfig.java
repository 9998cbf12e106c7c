package my.journalsuggester.app.config;

import my.journalsuggester.app.predictor.HttpPairwisePredictor;
import my.journalsuggester.app.predictor.NoopPairwisePredictor;
import my.journalsuggester.app.predictor.PairwisePredictor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class PredictorConfig {
	private static final Logger logger = LoggerFactory.getLogger(PredictorConfig.class);

	@Bean
	@ConditionalOnProperty(name = "app.predictor.provider", havingValue = "http")
	public HttpPairwisePredictor httpPairwisePredictor(AppProperties properties) {
		AppProperties.Predictor.Http http = properties.predictor() == null ? null : properties.predictor().http();
		String baseUrl = http == null ? null : http.baseUrl();
		if (baseUrl == null || baseUrl.isBlank()) {
			throw new IllegalStateException("app.predictor.http.base-url is required for provider=http");
		}
		int connectTimeout = http.connectTimeoutSeconds() == null ? 2 : Math.max(1, http.connectTimeoutSeconds());
		int readTimeout = http.readTimeoutSeconds() == null ? 5 : Math.max(1, http.readTimeoutSeconds());
		logger.info("Pairwise predictor enabled (provider=http, baseUrl={}, weight={}).",
				baseUrl, properties.predictor().weight());
		return new HttpPairwisePredictor(baseUrl, Duration.ofSeconds(connectTimeout), Duration.ofSeconds(readTimeout));
	}

	@Bean
	@ConditionalOnMissingBean(PairwisePredictor.class)
	public NoopPairwisePredictor noopPairwisePredictor() {
		logger.info("Pairwise predictor disabled (provider=none).");
		return new NoopPairwisePredictor();
	}
}
