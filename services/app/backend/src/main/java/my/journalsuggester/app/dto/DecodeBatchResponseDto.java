package my.journalsuggester.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record DecodeBatchResponseDto(
		@JsonProperty("results") List<DecodeOutcomeDto> results
) {
}
