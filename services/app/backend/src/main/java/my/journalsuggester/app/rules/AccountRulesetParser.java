package my.journalsuggester.app.rules;

import tools.jackson.databind.DeserializationFeature;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.PropertyNamingStrategies;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.dataformat.yaml.YAMLMapper;

public class AccountRulesetParser {
	private final ObjectMapper jsonMapper;
	private final ObjectMapper yamlMapper;

	public AccountRulesetParser() {
		this.jsonMapper = JsonMapper.builder()
				.propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
				.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
				.build();
		this.yamlMapper = YAMLMapper.builder()
				.propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
				.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
				.build();
	}

	/**
	 * Reads a ruleset written either as JSON or as YAML.
	 */
	public AccountRulesetDefinition parse(String content) {
		if (content == null || content.isBlank()) {
			throw new IllegalArgumentException("Account ruleset is empty");
		}
		try {
			return jsonMapper.readValue(content, AccountRulesetDefinition.class);
		} catch (RuntimeException jsonEx) {
			return yamlMapper.readValue(content, AccountRulesetDefinition.class);
		}
	}
}
