package ai.anchor.persistence;

import java.util.List;

public record CleanupResult(int deleted, int skipped, int failed, List<Failure> errors) {
    public record Failure(String id, String reason) {}

    public CleanupResult {
        errors = List.copyOf(errors);
    }
}
