package my.journalsuggester.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record AlternativeDto(
		@JsonProperty("lines") List<AllocationLineDto> lines,
		@JsonProperty("joint_probability") double jointProbability
) {
}
