package my.journalsuggester.app.api;

import jakarta.validation.Valid;
import my.journalsuggester.app.dto.DecisionDto;
import my.journalsuggester.app.dto.DecodeBatchRequestDto;
import my.journalsuggester.app.dto.DecodeBatchResponseDto;
import my.journalsuggester.app.dto.DecodeRequestDto;
import my.journalsuggester.app.service.DecodeBatchService;
import my.journalsuggester.app.service.DecodeDtoMapper;
import my.journalsuggester.app.service.JournalDecoderService;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/decoder")
public class DecoderController {
	private final JournalDecoderService decoderService;
	private final DecodeDtoMapper mapper;
	private final DecodeBatchService batchService;

	public DecoderController(JournalDecoderService decoderService,
							 DecodeDtoMapper mapper,
							 DecodeBatchService batchService) {
		this.decoderService = decoderService;
		this.mapper = mapper;
		this.batchService = batchService;
	}

	@PostMapping("/decode")
	public DecisionDto decode(@Valid @RequestBody DecodeRequestDto request) {
		return mapper.toDto(decoderService.decode(mapper.toRequest(request)));
	}

	@PostMapping("/batch")
	public DecodeBatchResponseDto batch(@Valid @RequestBody DecodeBatchRequestDto request) {
		return batchService.decodeBatch(request.transactions());
	}
}
