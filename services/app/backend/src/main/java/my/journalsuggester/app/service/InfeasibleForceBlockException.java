package my.journalsuggester.app.service;

import java.util.Set;
import java.util.TreeSet;

public class InfeasibleForceBlockException extends DecodeException {
	private final Set<String> accounts;

	public InfeasibleForceBlockException(Set<String> accounts) {
		super("INFEASIBLE_FORCE_BLOCK", "Accounts are both forced and blocked: " + new TreeSet<>(accounts));
		this.accounts = Set.copyOf(accounts);
	}

	public Set<String> getAccounts() {
		return accounts;
	}
}
