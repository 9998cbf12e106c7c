package my.journalsuggester.app.model;

public record PairPrediction(String debitAccountId, String creditAccountId) {
}
