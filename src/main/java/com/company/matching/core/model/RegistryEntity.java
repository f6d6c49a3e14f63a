package com.company.matching.core.model;

import java.util.Objects;

/**
 * Authoritative record from the business registry.
 * Immutable per load batch. Absent attributes are normalized to the empty string
 * so similarity scoring never receives a null.
 */
public record RegistryEntity(
        String registryNumber,
        String nameNorm,
        String nameRaw,
        String entityType,
        String entityStatus,
        String addressFull,
        String suburb,
        String postcode,
        String state,
        String startDateRaw
) {
    public RegistryEntity {
        Objects.requireNonNull(registryNumber, "registryNumber is required");
        if (registryNumber.isBlank()) {
            throw new IllegalArgumentException("registryNumber must not be blank");
        }
        nameNorm = orEmpty(nameNorm);
        nameRaw = orEmpty(nameRaw);
        entityType = orEmpty(entityType);
        entityStatus = orEmpty(entityStatus);
        addressFull = orEmpty(addressFull);
        suburb = orEmpty(suburb);
        postcode = orEmpty(postcode);
        state = orEmpty(state);
        startDateRaw = orEmpty(startDateRaw);
    }

    /**
     * Returns true if this entity has a usable normalized name.
     */
    public boolean hasName() {
        return !nameNorm.isBlank();
    }

    private static String orEmpty(String value) {
        return value != null ? value : "";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String registryNumber;
        private String nameNorm;
        private String nameRaw;
        private String entityType;
        private String entityStatus;
        private String addressFull;
        private String suburb;
        private String postcode;
        private String state;
        private String startDateRaw;

        public Builder registryNumber(String registryNumber) {
            this.registryNumber = registryNumber;
            return this;
        }

        public Builder nameNorm(String nameNorm) {
            this.nameNorm = nameNorm;
            return this;
        }

        public Builder nameRaw(String nameRaw) {
            this.nameRaw = nameRaw;
            return this;
        }

        public Builder entityType(String entityType) {
            this.entityType = entityType;
            return this;
        }

        public Builder entityStatus(String entityStatus) {
            this.entityStatus = entityStatus;
            return this;
        }

        public Builder addressFull(String addressFull) {
            this.addressFull = addressFull;
            return this;
        }

        public Builder suburb(String suburb) {
            this.suburb = suburb;
            return this;
        }

        public Builder postcode(String postcode) {
            this.postcode = postcode;
            return this;
        }

        public Builder state(String state) {
            this.state = state;
            return this;
        }

        public Builder startDateRaw(String startDateRaw) {
            this.startDateRaw = startDateRaw;
            return this;
        }

        public RegistryEntity build() {
            return new RegistryEntity(registryNumber, nameNorm, nameRaw, entityType, entityStatus,
                    addressFull, suburb, postcode, state, startDateRaw);
        }
    }
}
