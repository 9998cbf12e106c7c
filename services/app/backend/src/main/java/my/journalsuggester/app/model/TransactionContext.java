package my.journalsuggester.app.model;

import java.time.LocalDate;

public record TransactionContext(String transactionId, String description, LocalDate date, long total) {
}
