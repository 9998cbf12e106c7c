package my.journalsuggester.app.config;

import my.journalsuggester.app.rules.AccountRulesEngine;
import my.journalsuggester.app.rules.AccountRulesetDefinition;
import my.journalsuggester.app.rules.AccountRulesetParser;
import my.journalsuggester.app.rules.AccountRulesetValidator;
import my.journalsuggester.app.service.strategy.MinCostFlowSolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

@Configuration
public class DecoderConfig {
	private static final Logger logger = LoggerFactory.getLogger(DecoderConfig.class);

	@Bean
	@ConditionalOnProperty(name = "app.decoder.flow.solver-enabled", havingValue = "true", matchIfMissing = true)
	public MinCostFlowSolver minCostFlowSolver(AppProperties properties) {
		AppProperties.Decoder.Flow flow = properties.decoder().flow();
		logger.info("Flow solver enabled (timeout={}).", flow == null ? null : flow.timeout());
		return new MinCostFlowSolver();
	}

	@Bean
	public AccountRulesEngine accountRulesEngine(AppProperties properties, ResourceLoader resourceLoader) {
		String path = properties.decoder().rulesPath();
		if (path == null || path.isBlank()) {
			logger.info("No account rules configured.");
			return AccountRulesEngine.empty();
		}
		Resource resource = resourceLoader.getResource(path);
		if (!resource.exists()) {
			throw new IllegalStateException("Account rules not found: " + path);
		}
		String content;
		try (InputStream input = resource.getInputStream()) {
			content = new String(input.readAllBytes(), StandardCharsets.UTF_8);
		} catch (IOException ex) {
			throw new IllegalStateException("Failed to read account rules from " + path, ex);
		}
		AccountRulesetDefinition definition = new AccountRulesetParser().parse(content);
		List<String> errors = new AccountRulesetValidator().validate(definition);
		if (!errors.isEmpty()) {
			throw new IllegalStateException("Invalid account rules in " + path + ": " + String.join("; ", errors));
		}
		AccountRulesEngine engine = new AccountRulesEngine(definition);
		logger.info("Loaded {} account rules from {}.", engine.size(), path);
		return engine;
	}
}
