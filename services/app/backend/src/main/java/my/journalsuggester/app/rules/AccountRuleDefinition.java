package my.journalsuggester.app.rules;

import java.util.List;

/**
 * A description pattern (case-insensitive regex, matched anywhere) and the accounts it forces or blocks on both
 * sides of the entry.
 */
public class AccountRuleDefinition {
	private String id;
	private String pattern;
	private List<String> forceAccounts;
	private List<String> blockAccounts;

	public String getId() {
		return id;
	}

	public void setId(String id) {
		this.id = id;
	}

	public String getPattern() {
		return pattern;
	}

	public void setPattern(String pattern) {
		this.pattern = pattern;
	}

	public List<String> getForceAccounts() {
		return forceAccounts;
	}

	public void setForceAccounts(List<String> forceAccounts) {
		this.forceAccounts = forceAccounts;
	}

	public List<String> getBlockAccounts() {
		return blockAccounts;
	}

	public void setBlockAccounts(List<String> blockAccounts) {
		this.blockAccounts = blockAccounts;
	}
}
