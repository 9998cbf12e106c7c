package my.journalsuggester.app.model;

public record FlowPairing(String debitAccountId, String creditAccountId, long amount) {
}
