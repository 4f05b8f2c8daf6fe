package gr.engine.cost;

/**
 * Cheap estimate from character count: one token per {@code charsPerToken} characters, rounded up.
 */
public final class CharacterCostEstimator implements CostEstimator {

    public static final int DEFAULT_CHARS_PER_TOKEN = 4;

    private final int charsPerToken;

    public CharacterCostEstimator() {
        this(DEFAULT_CHARS_PER_TOKEN);
    }

    public CharacterCostEstimator(int charsPerToken) {
        if (charsPerToken <= 0) {
            throw new IllegalArgumentException("charsPerToken must be > 0");
        }
        this.charsPerToken = charsPerToken;
    }

    @Override
    public long estimate(String payload) {
        if (payload == null || payload.isEmpty()) {
            return 0L;
        }
        return (payload.length() + charsPerToken - 1L) / charsPerToken;
    }
}
