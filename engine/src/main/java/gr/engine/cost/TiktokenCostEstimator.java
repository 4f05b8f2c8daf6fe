package gr.engine.cost;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;
import com.knuddels.jtokkit.api.EncodingType;

/**
 * Counts tokens with a BPE encoding (cl100k_base unless told otherwise).
 * Thread-safe; the encoding is built once per instance.
 */
public final class TiktokenCostEstimator implements CostEstimator {

    private final Encoding encoding;

    public TiktokenCostEstimator() {
        this(EncodingType.CL100K_BASE);
    }

    public TiktokenCostEstimator(EncodingType type) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        EncodingRegistry registry = Encodings.newDefaultEncodingRegistry();
        this.encoding = registry.getEncoding(type);
    }

    @Override
    public long estimate(String payload) {
        if (payload == null || payload.isEmpty()) {
            return 0L;
        }
        return encoding.countTokens(payload);
    }
}
