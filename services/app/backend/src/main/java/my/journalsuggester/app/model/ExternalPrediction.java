package my.journalsuggester.app.model;

public record ExternalPrediction(String debitAccountId, String creditAccountId, double weight) {
}
