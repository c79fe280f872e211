package com.driftsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Outcome of one drift detection operation.
 *
 * <p>
 * {@code score} is a severity percentage. It is not capped at 100: relative
 * prediction shifts can exceed it. {@code detail} holds the fields specific to
 * the detection type (affected features, p-values, accuracies, means) in
 * insertion order, and is flattened next to {@code detected} and
 * {@code score} when serialized.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. Instances are immutable; the detail map, and any
 * map or list inside it, is copied on build and exposed read-only.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "detected", "score" })
public final class DriftResult {

    private static final Set<String> RESERVED_KEYS = Set.of("detected", "score");

    private final boolean detected;
    private final double score;
    private final Map<String, Object> detail;

    private DriftResult(Builder builder) {
        if (Double.isNaN(builder.score) || Double.isInfinite(builder.score)) {
            throw new IllegalArgumentException("score must be finite, got: " + builder.score);
        }
        this.detected = builder.detected;
        this.score = builder.score;
        Map<String, Object> frozen = new LinkedHashMap<>();
        builder.detail.forEach((key, value) -> frozen.put(key, freeze(value)));
        this.detail = Collections.unmodifiableMap(frozen);
    }

    /** Copies nested maps and lists so they cannot change after build. */
    private static Object freeze(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(k, freeze(v)));
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(v -> copy.add(freeze(v)));
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link DriftResult}.
     */
    public static class Builder {
        private boolean detected;
        private double score;
        private final Map<String, Object> detail = new LinkedHashMap<>();

        public Builder detected(boolean detected) {
            this.detected = detected;
            return this;
        }

        public Builder score(double score) {
            this.score = score;
            return this;
        }

        /**
         * Add a detail field. Later calls with the same key replace the value.
         *
         * @param key   field name; must not be {@code null}, {@code detected}
         *              or {@code score}
         * @param value field value; must not be {@code null}
         * @return this builder
         * @throws IllegalArgumentException if {@code key} is reserved
         */
        public Builder detail(String key, Object value) {
            Objects.requireNonNull(key, "detail key must not be null");
            if (RESERVED_KEYS.contains(key)) {
                throw new IllegalArgumentException("'" + key + "' is reserved and cannot be a detail field");
            }
            detail.put(key, Objects.requireNonNull(value, "detail value for '" + key + "' must not be null"));
            return this;
        }

        /**
         * @return a new immutable {@link DriftResult}
         * @throws IllegalArgumentException if the score is NaN or infinite
         */
        public DriftResult build() {
            return new DriftResult(this);
        }
    }

    public boolean isDetected() {
        return detected;
    }

    public double getScore() {
        return score;
    }

    /**
     * @return unmodifiable, insertion-ordered detail fields
     */
    @JsonAnyGetter
    public Map<String, Object> getDetail() {
        return detail;
    }

    /**
     * Look up a detail field.
     *
     * @param key field name
     * @return the value, or empty if absent
     */
    public Optional<Object> detail(String key) {
        return Optional.ofNullable(detail.get(key));
    }

    /**
     * Look up a numeric detail field.
     *
     * @param key field name
     * @return the value as a {@code double}, or empty if absent or not numeric
     */
    public Optional<Double> numericDetail(String key) {
        Object raw = detail.get(key);
        return raw instanceof Number n ? Optional.of(n.doubleValue()) : Optional.empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DriftResult that))
            return false;
        return detected == that.detected
                && Double.compare(score, that.score) == 0
                && detail.equals(that.detail);
    }

    @Override
    public int hashCode() {
        return Objects.hash(detected, score, detail);
    }

    @Override
    public String toString() {
        return "DriftResult{" +
                "detected=" + detected +
                ", score=" + score +
                ", detail=" + detail +
                '}';
    }
}
