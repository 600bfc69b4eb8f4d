package io.synthtools.matcher;

import io.synthtools.matcher.address.AddressFamily;

/**
 * Configuration for rule compilation and selection.
 */
public class Configuration {

    public static final long DEFAULT_MAX_COMBINATIONS = 10_000;

    /**
     * Upper bound on the number of value combinations a single one_of_each entry may expand to. Every combination
     * scans the candidate list, so the product of the bound value lists is what drives selection cost.
     */
    private final long maxCombinations;

    /**
     * Family used by an address source that does not name one.
     */
    private final AddressFamily defaultFamily;

    private Configuration(long maxCombinations, AddressFamily defaultFamily) {
        this.maxCombinations = maxCombinations;
        this.defaultFamily = defaultFamily;
    }

    public static Configuration defaults() {
        return new Builder().build();
    }

    public long getMaxCombinations() {
        return maxCombinations;
    }

    public AddressFamily getDefaultFamily() {
        return defaultFamily;
    }

    public static class Builder {

        private long maxCombinations = DEFAULT_MAX_COMBINATIONS;
        private AddressFamily defaultFamily = AddressFamily.DUAL;

        public Builder withMaxCombinations(long maxCombinations) {
            if (maxCombinations < 1) {
                throw new IllegalArgumentException("maxCombinations must be positive");
            }
            this.maxCombinations = maxCombinations;
            return this;
        }

        public Builder withDefaultFamily(AddressFamily defaultFamily) {
            if (defaultFamily == null) {
                throw new IllegalArgumentException("defaultFamily must not be null");
            }
            this.defaultFamily = defaultFamily;
            return this;
        }

        public Configuration build() {
            return new Configuration(maxCombinations, defaultFamily);
        }
    }
}
