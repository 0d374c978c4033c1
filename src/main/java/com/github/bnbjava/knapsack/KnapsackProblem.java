package com.github.bnbjava.knapsack;

import com.github.bnbjava.model.InvalidInputException;
import com.github.bnbjava.model.LinearConstraint;
import com.github.bnbjava.model.LinearProblem;
import com.github.bnbjava.model.Sense;

import java.util.List;
import java.util.stream.IntStream;

import static java.util.Arrays.stream;

/**
 * <p>
 * The 0/1 knapsack problem: choose a subset of items with total weight at most the capacity, maximizing the total
 * value.
 * </p><p>
 * Variable <code>i</code> is 1 if item <code>i</code> is packed. Domains are ordered {1, 0}, so depth-first search
 * tries packing an item before leaving it out. As a {@link LinearProblem} it works with both default bound oracles.
 * </p>
 */
public class KnapsackProblem implements LinearProblem {
    private static final int[] DOMAIN = {1, 0};

    private final double[] weights;
    private final double[] values;
    private final double capacity;
    private final List<LinearConstraint> constraints;

    /**
     * Constructor.
     *
     * @param weights  item weights, all positive
     * @param values   item values, all non-negative; same dimension as <code>weights</code>
     * @param capacity the knapsack capacity, non-negative
     * @throws InvalidInputException if any of the above does not hold
     */
    public KnapsackProblem(double[] weights, double[] values, double capacity) {
        if (weights.length != values.length) {
            throw new InvalidInputException("weights and values should have the same dimension.");
        }
        if (stream(weights).anyMatch(w -> !(w > 0.0) || Double.isInfinite(w))) {
            throw new InvalidInputException("weights must be positive.");
        }
        if (stream(values).anyMatch(v -> !(v >= 0.0) || Double.isInfinite(v))) {
            throw new InvalidInputException("values must be non-negative.");
        }
        if (!(capacity >= 0.0) || Double.isInfinite(capacity)) {
            throw new InvalidInputException("capacity must be non-negative.");
        }
        this.weights = weights.clone();
        this.values = values.clone();
        this.capacity = capacity;
        this.constraints = List.of(LinearConstraint.atMost("capacity", this.weights, capacity));
    }

    @Override
    public int size() {
        return weights.length;
    }

    @Override
    public int[] domain(int variable) {
        return DOMAIN.clone();
    }

    @Override
    public Sense sense() {
        return Sense.MAXIMIZE;
    }

    @Override
    public double[] objectiveCoefficients() {
        return values.clone();
    }

    @Override
    public List<LinearConstraint> constraints() {
        return constraints;
    }

    /**
     * @return the knapsack capacity
     */
    public double getCapacity() {
        return capacity;
    }

    /**
     * @param packed one value per item, 1 if packed
     * @return the indices of the packed items
     */
    public static List<Integer> packedItems(int[] packed) {
        return IntStream.range(0, packed.length).filter(i -> packed[i] == 1).boxed().toList();
    }
}
