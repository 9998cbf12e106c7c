package my.journalsuggester.app.rules;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

public class AccountRulesetValidator {
	public List<String> validate(AccountRulesetDefinition definition) {
		List<String> errors = new ArrayList<>();
		if (definition == null) {
			errors.add("Ruleset is empty");
			return errors;
		}
		if (definition.getSchemaVersion() != 0 && definition.getSchemaVersion() != 1) {
			errors.add("schema_version must be 1");
		}
		if (definition.getRules() == null) {
			errors.add("rules must be provided");
			return errors;
		}
		Set<String> ids = new HashSet<>();
		for (int i = 0; i < definition.getRules().size(); i++) {
			AccountRuleDefinition rule = definition.getRules().get(i);
			String label = "rules[" + i + "]";
			if (rule == null) {
				errors.add(label + " must not be null");
				continue;
			}
			if (rule.getId() != null && !rule.getId().isBlank() && !ids.add(rule.getId())) {
				errors.add(label + ".id is duplicated: " + rule.getId());
			}
			if (rule.getPattern() == null || rule.getPattern().isBlank()) {
				errors.add(label + ".pattern is required");
			} else {
				try {
					Pattern.compile(rule.getPattern());
				} catch (PatternSyntaxException ex) {
					errors.add(label + ".pattern is not a valid regex: " + ex.getDescription());
				}
			}
			boolean forces = rule.getForceAccounts() != null && !rule.getForceAccounts().isEmpty();
			boolean blocks = rule.getBlockAccounts() != null && !rule.getBlockAccounts().isEmpty();
			if (!forces && !blocks) {
				errors.add(label + " needs force_accounts or block_accounts");
			}
			if (forces && blocks) {
				Set<String> overlap = new HashSet<>(rule.getForceAccounts());
				overlap.retainAll(rule.getBlockAccounts());
				if (!overlap.isEmpty()) {
					errors.add(label + " forces and blocks the same accounts: " + overlap);
				}
			}
		}
		return errors;
	}
}
