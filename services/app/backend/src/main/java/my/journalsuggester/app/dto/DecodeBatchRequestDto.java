package my.journalsuggester.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record DecodeBatchRequestDto(
		@JsonProperty("transactions") @NotNull @Valid List<DecodeRequestDto> transactions
) {
}
