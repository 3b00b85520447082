package org.carball.tiercheck.model.scoring;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Locale;

/**
 * A numeric range with optional ends. A missing end always passes its check.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Bound(Double min, Double max) {

    public static Bound between(double min, double max) {
        return new Bound(min, max);
    }

    public static Bound atLeast(double min) {
        return new Bound(min, null);
    }

    public static Bound atMost(double max) {
        return new Bound(null, max);
    }

    public static Bound unbounded() {
        return new Bound(null, null);
    }

    public boolean satisfiesMin(double value) {
        return min == null || value >= min;
    }

    public boolean satisfiesMax(double value) {
        return max == null || value <= max;
    }

    public boolean contains(double value) {
        return satisfiesMin(value) && satisfiesMax(value);
    }

    public boolean hasFiniteWidth() {
        return min != null && max != null && !max.isInfinite();
    }

    public double width() {
        return hasFiniteWidth() ? max - min : Double.POSITIVE_INFINITY;
    }

    public String describe() {
        if (min == null && max == null) {
            return "any";
        }
        if (max == null || max.isInfinite()) {
            return format(min) + "+";
        }
        if (min == null) {
            return "≤ " + format(max);
        }
        return format(min) + "-" + format(max);
    }

    private static String format(double value) {
        return value == Math.rint(value)
                ? String.valueOf((long) value)
                : String.format(Locale.ROOT, "%.2f", value);
    }
}
