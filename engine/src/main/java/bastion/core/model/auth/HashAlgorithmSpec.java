package bastion.core.model.auth;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Configured parameters of one hash algorithm.
 *
 * <p>Built once from configuration and shared read-only by every hash and verify call.
 * Parameter names are algorithm specific; the ones every algorithm understands are
 * listed as constants here.
 *
 * @param id         algorithm id
 * @param parameters resolved parameters (configured values over algorithm defaults)
 * @param pepper     optional application-wide secret mixed into the hash
 */
public record HashAlgorithmSpec(String id, Map<String, Integer> parameters, Optional<String> pepper) {

    public static final String DEFAULT_ROUNDS = "default_rounds";
    public static final String MIN_ROUNDS = "min_rounds";
    public static final String MAX_ROUNDS = "max_rounds";
    public static final String SALT_SIZE = "salt_size";
    public static final String MEMORY_COST = "memory_cost";
    public static final String PARALLELISM = "parallelism";

    public HashAlgorithmSpec {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Algorithm ID cannot be null or blank");
        }
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
        pepper = pepper == null ? Optional.empty() : pepper;
    }

    /**
     * Return a parameter that must be present.
     *
     * @throws ConfigurationException if the parameter is missing
     */
    public int require(String name) {
        final var value = parameters.get(name);
        if (value == null) {
            throw new ConfigurationException("Missing parameter '" + name + "' for hash algorithm " + id);
        }
        return value;
    }

    public int defaultRounds() {
        return require(DEFAULT_ROUNDS);
    }

    public int minRounds() {
        return require(MIN_ROUNDS);
    }

    public int maxRounds() {
        return require(MAX_ROUNDS);
    }

    /**
     * Create a copy with one parameter replaced.
     */
    public HashAlgorithmSpec withParameter(String name, int value) {
        final var copy = new HashMap<>(parameters);
        copy.put(name, value);
        return new HashAlgorithmSpec(id, copy, pepper);
    }
}
