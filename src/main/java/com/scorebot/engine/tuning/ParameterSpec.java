package com.scorebot.engine.tuning;

public final class ParameterSpec {
    public final String name;
    public final double seed;
    public final double min;
    public final double max;
    public final boolean integral;
    public final String description;

    public ParameterSpec(String name, double seed, double min, double max, boolean integral, String description) {
        this.name = name;
        this.seed = seed;
        this.min = min;
        this.max = max;
        this.integral = integral;
        this.description = description == null ? "" : description;
    }

    /**
     * @return null when the value is acceptable, otherwise the rejection reason
     */
    public String check(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return "not a finite number";
        }
        if (value < min || value > max) {
            return "outside range [" + min + ", " + max + "]";
        }
        if (integral && value != Math.rint(value)) {
            return "must be a whole number";
        }
        return null;
    }
}
