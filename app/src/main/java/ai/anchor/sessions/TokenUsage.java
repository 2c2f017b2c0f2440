package ai.anchor.sessions;

import java.util.Collection;

/**
 * Token counts and cost reported by the provider for one response.
 */
public record TokenUsage(long inputTokens, long outputTokens, double totalCost) {
    public static final TokenUsage ZERO = new TokenUsage(0, 0, 0.0);

    public TokenUsage {
        if (inputTokens < 0 || outputTokens < 0 || totalCost < 0) {
            throw new IllegalArgumentException("usage values must not be negative");
        }
    }

    public TokenUsage plus(TokenUsage other) {
        return new TokenUsage(
                inputTokens + other.inputTokens, outputTokens + other.outputTokens, totalCost + other.totalCost);
    }

    /** Sum of the usage attached to the given messages; messages without usage count as zero. */
    public static TokenUsage sum(Collection<Message> messages) {
        var total = ZERO;
        for (var message : messages) {
            var usage = message.usage();
            if (usage != null) {
                total = total.plus(usage);
            }
        }
        return total;
    }
}
