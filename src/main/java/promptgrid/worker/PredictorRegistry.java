package promptgrid.worker;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Predictors keyed by model family. The registered families are exactly the
 * capability set a worker claims with.
 */
public final class PredictorRegistry {

    private final Map<String, Predictor> byFamily = new LinkedHashMap<>();

    public PredictorRegistry register(String family, Predictor predictor) {
        if (family == null || family.isBlank()) {
            throw new IllegalArgumentException("family is required");
        }
        byFamily.put(family.trim(), predictor);
        return this;
    }

    public Optional<Predictor> forFamily(String family) {
        return Optional.ofNullable(byFamily.get(family));
    }

    public Set<String> families() {
        return Collections.unmodifiableSet(byFamily.keySet());
    }

    public boolean isEmpty() {
        return byFamily.isEmpty();
    }

    @Override
    public String toString() {
        return "PredictorRegistry" + byFamily.keySet();
    }
}
