package my.journalsuggester.app.model;

public record Allocation(String accountId, Side side, long amount) {
}
