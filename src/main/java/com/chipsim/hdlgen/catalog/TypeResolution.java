package com.chipsim.hdlgen.catalog;

import lombok.NonNull;
import lombok.Value;

/**
 * Outcome of normalizing a raw chip type name: either a canonical name (which
 * may or may not be in the catalog) or an explicit refusal.
 */
public interface TypeResolution {

    boolean isSupported();

    /**
     * Canonical name for supported types; throws for unsupported ones.
     */
    String canonicalName();

    static TypeResolution canonical(String name) {
        return new Canonical(name);
    }

    static TypeResolution unsupported(String normalizedName, String reason) {
        return new Unsupported(normalizedName, reason);
    }

    @Value
    class Canonical implements TypeResolution {
        @NonNull
        String name;

        @Override
        public boolean isSupported() {
            return true;
        }

        @Override
        public String canonicalName() {
            return name;
        }
    }

    @Value
    class Unsupported implements TypeResolution {
        @NonNull
        String normalizedName;
        @NonNull
        String reason;

        @Override
        public boolean isSupported() {
            return false;
        }

        @Override
        public String canonicalName() {
            throw new IllegalStateException("Chip '" + normalizedName + "' is unsupported: " + reason);
        }
    }
}
