package my.journalsuggester.app;

import my.journalsuggester.app.predictor.PairwisePredictor;
import my.journalsuggester.app.rules.AccountRulesEngine;
import my.journalsuggester.app.service.strategy.DecoderStrategy;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class AppApplicationTests {
	@Autowired
	private List<DecoderStrategy> strategies;

	@Autowired
	private AccountRulesEngine rulesEngine;

	@Autowired
	private PairwisePredictor pairwisePredictor;

	@Test
	void contextLoads() {
		assertThat(strategies).hasSize(2);
		assertThat(rulesEngine.size()).isEqualTo(2);
		assertThat(pairwisePredictor.isEnabled()).isFalse();
	}
}
