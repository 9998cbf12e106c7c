package my.journalsuggester.app.rules;

import java.util.List;
import java.util.Set;

public record ResolvedAccountRules(Set<String> forcedAccounts, Set<String> blockedAccounts, List<String> firedRuleIds) {
	public static final ResolvedAccountRules NONE = new ResolvedAccountRules(Set.of(), Set.of(), List.of());

	public ResolvedAccountRules {
		forcedAccounts = forcedAccounts == null ? Set.of() : Set.copyOf(forcedAccounts);
		blockedAccounts = blockedAccounts == null ? Set.of() : Set.copyOf(blockedAccounts);
		firedRuleIds = firedRuleIds == null ? List.of() : List.copyOf(firedRuleIds);
	}

	public boolean isEmpty() {
		return forcedAccounts.isEmpty() && blockedAccounts.isEmpty();
	}
}
