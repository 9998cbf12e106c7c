package my.journalsuggester.app.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "app")
public record AppProperties(
		@Valid @NotNull Decoder decoder,
		@Valid Predictor predictor
) {
	public record Decoder(
			@DecimalMin("0.0") @DecimalMax("1.0") double thresholdDebit,
			@DecimalMin("0.0") @DecimalMax("1.0") double thresholdCredit,
			@Min(1) int maxKPerSide,
			@Min(1) int maxAlternatives,
			String strategy,
			String rulesPath,
			@Valid Flow flow,
			@Valid Batch batch
	) {
		public record Flow(
				boolean solverEnabled,
				Duration timeout
		) {
		}

		public record Batch(
				@Min(1) int parallelism
		) {
		}
	}

	public record Predictor(
			@NotBlank String provider,
			@DecimalMin("0.0") @DecimalMax("1.0") double weight,
			Http http
	) {
		public record Http(
				String baseUrl,
				Integer connectTimeoutSeconds,
				Integer readTimeoutSeconds
		) {
		}
	}
}
