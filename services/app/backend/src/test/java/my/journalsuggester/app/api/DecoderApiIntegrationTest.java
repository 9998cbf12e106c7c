package my.journalsuggester.app.api;

import my.journalsuggester.app.AppApplication;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(classes = AppApplication.class)
@ActiveProfiles("test")
class DecoderApiIntegrationTest {
	private static final String CASH_BANK = """
			{
			  "transaction_id": "t-1",
			  "total": 100,
			  "debit_candidates": [
			    {"account_id": "Cash", "probability": 0.9, "share": 0.7},
			    {"account_id": "Bank", "probability": 0.8, "share": 0.3}
			  ],
			  "credit_candidates": [
			    {"account_id": "Revenue", "probability": 0.95, "share": 1.0}
			  ],
			  "predicted_k_debit": 2,
			  "predicted_k_credit": 1
			}
			""";

	private MockMvc mockMvc;

	@Autowired
	private WebApplicationContext context;

	@BeforeEach
	void setUp() {
		mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
	}

	@Test
	void decodesBalancedAllocation() throws Exception {
		mockMvc.perform(post("/api/decoder/decode")
						.contentType(MediaType.APPLICATION_JSON)
						.content(CASH_BANK))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.transaction_id").value("t-1"))
				.andExpect(jsonPath("$.primary", hasSize(3)))
				.andExpect(jsonPath("$.primary[0].account_id").value("Cash"))
				.andExpect(jsonPath("$.primary[0].side").value("debit"))
				.andExpect(jsonPath("$.primary[0].amount").value(70))
				.andExpect(jsonPath("$.primary[1].account_id").value("Bank"))
				.andExpect(jsonPath("$.primary[1].amount").value(30))
				.andExpect(jsonPath("$.primary[2].account_id").value("Revenue"))
				.andExpect(jsonPath("$.primary[2].side").value("credit"))
				.andExpect(jsonPath("$.primary[2].amount").value(100))
				.andExpect(jsonPath("$.debug.decoder_used").value("greedy"));
	}

	@Test
	void decodesWithCombinatorialStrategy() throws Exception {
		String body = CASH_BANK.replace("\"predicted_k_credit\": 1", "\"predicted_k_credit\": 1, \"strategy\": \"combinatorial\"");

		mockMvc.perform(post("/api/decoder/decode")
						.contentType(MediaType.APPLICATION_JSON)
						.content(body))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.debug.decoder_used").value("combinatorial"))
				.andExpect(jsonPath("$.primary[?(@.account_id == 'Cash')].amount", contains(70)))
				.andExpect(jsonPath("$.primary[?(@.account_id == 'Revenue')].amount", contains(100)))
				.andExpect(jsonPath("$.debug.pairings", hasSize(2)));
	}

	@Test
	void appliesConfiguredAccountRules() throws Exception {
		String body = """
				{
				  "transaction_id": "t-vat",
				  "total": 1000,
				  "description": "Office chairs incl. VAT",
				  "debit_candidates": [
				    {"account_id": "Expense", "probability": 0.9, "share": 0.8},
				    {"account_id": "Tax", "probability": 0.5, "share": 0.2}
				  ],
				  "credit_candidates": [
				    {"account_id": "Bank", "probability": 0.9, "share": 1.0}
				  ]
				}
				""";

		mockMvc.perform(post("/api/decoder/decode")
						.contentType(MediaType.APPLICATION_JSON)
						.content(body))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.primary[?(@.account_id == 'Tax')].amount", contains(200)))
				.andExpect(jsonPath("$.primary[?(@.account_id == 'Expense')].amount", contains(800)))
				.andExpect(jsonPath("$.debug.fired_rules", contains("vat-payable")));
	}

	@Test
	void rejectsNonPositiveTotal() throws Exception {
		mockMvc.perform(post("/api/decoder/decode")
						.contentType(MediaType.APPLICATION_JSON)
						.content(CASH_BANK.replace("\"total\": 100", "\"total\": 0")))
				.andExpect(status().is(422))
				.andExpect(jsonPath("$.error_code").value("INVALID_TOTAL"));
	}

	@Test
	void rejectsEmptyCreditSide() throws Exception {
		String body = """
				{"total": 100, "debit_candidates": [{"account_id": "Cash", "probability": 0.9}], "credit_candidates": []}
				""";

		mockMvc.perform(post("/api/decoder/decode")
						.contentType(MediaType.APPLICATION_JSON)
						.content(body))
				.andExpect(status().is(422))
				.andExpect(jsonPath("$.error_code").value("EMPTY_CANDIDATES"));
	}

	@Test
	void rejectsMissingTotalAndMalformedJson() throws Exception {
		mockMvc.perform(post("/api/decoder/decode")
						.contentType(MediaType.APPLICATION_JSON)
						.content(CASH_BANK.replace("\"total\": 100,", "")))
				.andExpect(status().isBadRequest());

		mockMvc.perform(post("/api/decoder/decode")
						.contentType(MediaType.APPLICATION_JSON)
						.content("{\"total\": "))
				.andExpect(status().isBadRequest());
	}

	@Test
	void decodesBatchWithPerTransactionOutcome() throws Exception {
		String body = "{\"transactions\": [" + CASH_BANK + ","
				+ CASH_BANK.replace("\"t-1\"", "\"t-2\"").replace("\"total\": 100", "\"total\": -5") + "]}";

		mockMvc.perform(post("/api/decoder/batch")
						.contentType(MediaType.APPLICATION_JSON)
						.content(body))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.results", hasSize(2)))
				.andExpect(jsonPath("$.results[0].status").value("OK"))
				.andExpect(jsonPath("$.results[0].decision.primary", hasSize(3)))
				.andExpect(jsonPath("$.results[1].transaction_id").value("t-2"))
				.andExpect(jsonPath("$.results[1].status").value("FAILED"))
				.andExpect(jsonPath("$.results[1].error_code").value("INVALID_TOTAL"));
	}

	@Test
	void missingLineCountsLetTheThresholdDecide() throws Exception {
		String body = """
				{
				  "transaction_id": "t-k",
				  "total": 100,
				  "debit_candidates": [
				    {"account_id": "Cash", "probability": 0.9, "share": 0.7},
				    {"account_id": "Bank", "probability": 0.4, "share": 0.3}
				  ],
				  "credit_candidates": [
				    {"account_id": "Revenue", "probability": 0.95, "share": 1.0}
				  ],
				  "threshold_debit": 0.35,
				  "max_k_per_side": 4
				}
				""";

		mockMvc.perform(post("/api/decoder/decode")
						.contentType(MediaType.APPLICATION_JSON)
						.content(body))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.primary[?(@.account_id == 'Cash')].amount", contains(70)))
				.andExpect(jsonPath("$.primary[?(@.account_id == 'Bank')].amount", contains(30)))
				.andExpect(jsonPath("$.primary[?(@.account_id == 'Revenue')].amount", contains(100)));
	}

	@Test
	void keepsKnownLinesAndDecodesTheRest() throws Exception {
		String body = CASH_BANK.replace("\"predicted_k_credit\": 1",
				"\"predicted_k_credit\": 1, \"known_debits\": [{\"account_id\": \"Fees\", \"amount\": 10}]");

		mockMvc.perform(post("/api/decoder/decode")
						.contentType(MediaType.APPLICATION_JSON)
						.content(body))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.primary", hasSize(4)))
				.andExpect(jsonPath("$.primary[0].account_id").value("Fees"))
				.andExpect(jsonPath("$.primary[0].amount").value(10))
				.andExpect(jsonPath("$.primary[?(@.account_id == 'Cash')].amount", contains(63)))
				.andExpect(jsonPath("$.primary[?(@.account_id == 'Bank')].amount", contains(27)))
				.andExpect(jsonPath("$.primary[?(@.account_id == 'Revenue')].amount", contains(100)));
	}

	@Test
	void rejectsKnownLinesAboveTotal() throws Exception {
		String body = CASH_BANK.replace("\"predicted_k_credit\": 1",
				"\"predicted_k_credit\": 1, \"known_credits\": [{\"account_id\": \"Vat\", \"amount\": 150}]");

		mockMvc.perform(post("/api/decoder/decode")
						.contentType(MediaType.APPLICATION_JSON)
						.content(body))
				.andExpect(status().is(422))
				.andExpect(jsonPath("$.error_code").value("INVALID_REQUEST"));
	}

	@Test
	void unknownRouteIsNotFound() throws Exception {
		mockMvc.perform(get("/api/decoder/jobs/{jobId}", "no-such-job"))
				.andExpect(status().isNotFound())
				.andExpect(jsonPath("$.detail").value("Resource not found."));
	}
}
