package com.tradeintel.common.model;

/**
 * How a signal's effective weight was decided. An override never discards the computed
 * value; {@link Overridden} keeps it alongside the manual weight.
 */
public sealed interface WeightAssignment permits WeightAssignment.Computed, WeightAssignment.Overridden {

    /** Weight actually applied upstream. */
    double effectiveWeight();

    /** Weight produced by the dynamic formula, whether or not it is applied. */
    double computedWeight();

    record Computed(double weight) implements WeightAssignment {
        @Override public double effectiveWeight() { return weight; }
        @Override public double computedWeight()  { return weight; }
    }

    record Overridden(double weight, double computed) implements WeightAssignment {
        @Override public double effectiveWeight() { return weight; }
        @Override public double computedWeight()  { return computed; }
    }
}
