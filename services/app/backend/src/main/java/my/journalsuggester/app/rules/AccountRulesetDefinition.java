package my.journalsuggester.app.rules;

import java.util.List;

public class AccountRulesetDefinition {
	private int schemaVersion;
	private String name;
	private List<AccountRuleDefinition> rules;

	public int getSchemaVersion() {
		return schemaVersion;
	}

	public void setSchemaVersion(int schemaVersion) {
		this.schemaVersion = schemaVersion;
	}

	public String getName() {
		return name;
	}

	public void setName(String name) {
		this.name = name;
	}

	public List<AccountRuleDefinition> getRules() {
		return rules;
	}

	public void setRules(List<AccountRuleDefinition> rules) {
		this.rules = rules;
	}
}
