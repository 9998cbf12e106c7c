package my.journalsuggester.app.rules;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Evaluates description rules. Every matching rule contributes: forced and blocked sets are the union over all
 * matches, and a clash between them is left to the decoder, which rejects the request.
 */
public class AccountRulesEngine {
	private final List<CompiledRule> rules;

	public AccountRulesEngine(AccountRulesetDefinition definition) {
		List<CompiledRule> compiled = new ArrayList<>();
		if (definition != null && definition.getRules() != null) {
			int index = 0;
			for (AccountRuleDefinition rule : definition.getRules()) {
				index += 1;
				if (rule == null || rule.getPattern() == null || rule.getPattern().isBlank()) {
					continue;
				}
				String id = rule.getId() == null || rule.getId().isBlank() ? "rule-" + index : rule.getId();
				compiled.add(new CompiledRule(
						id,
						Pattern.compile(rule.getPattern(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE),
						rule.getForceAccounts() == null ? List.of() : List.copyOf(rule.getForceAccounts()),
						rule.getBlockAccounts() == null ? List.of() : List.copyOf(rule.getBlockAccounts())
				));
			}
		}
		this.rules = List.copyOf(compiled);
	}

	public static AccountRulesEngine empty() {
		return new AccountRulesEngine(null);
	}

	public int size() {
		return rules.size();
	}

	public ResolvedAccountRules resolve(String description) {
		if (description == null || description.isBlank() || rules.isEmpty()) {
			return ResolvedAccountRules.NONE;
		}
		Set<String> forced = new LinkedHashSet<>();
		Set<String> blocked = new LinkedHashSet<>();
		List<String> fired = new ArrayList<>();
		for (CompiledRule rule : rules) {
			if (!rule.pattern().matcher(description).find()) {
				continue;
			}
			forced.addAll(rule.forceAccounts());
			blocked.addAll(rule.blockAccounts());
			fired.add(rule.id());
		}
		if (fired.isEmpty()) {
			return ResolvedAccountRules.NONE;
		}
		return new ResolvedAccountRules(forced, blocked, fired);
	}

	private record CompiledRule(String id, Pattern pattern, List<String> forceAccounts, List<String> blockAccounts) {
	}
}
