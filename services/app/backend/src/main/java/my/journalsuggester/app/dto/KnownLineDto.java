package my.journalsuggester.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

@Schema(description = "A line the caller has already booked. It is kept as is and only the rest of the side is decoded.")
public record KnownLineDto(
		@JsonProperty("account_id") @NotBlank String accountId,
		@Schema(description = "Amount in integer minor units.")
		@JsonProperty("amount") @NotNull @Positive Long amount
) {
}
