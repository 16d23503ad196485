package com.dashboard.insights.math;

import java.util.Arrays;
import java.util.Comparator;
import java.util.function.ToDoubleFunction;

/**
 * Derivative-free minimiser (Nelder-Mead downhill simplex) for the small, unconstrained
 * parameter vectors used by the forecasting models. Callers map bounded parameters into
 * unconstrained space themselves.
 */
public class NelderMeadOptimizer {

    private static final double REFLECTION = 1.0;
    private static final double EXPANSION = 2.0;
    private static final double CONTRACTION = 0.5;
    private static final double SHRINK = 0.5;

    private final int maxIterations;
    private final double tolerance;
    private final double initialStep;

    public NelderMeadOptimizer(int maxIterations, double tolerance, double initialStep) {
        this.maxIterations = maxIterations;
        this.tolerance = tolerance;
        this.initialStep = initialStep;
    }

    public Result minimize(ToDoubleFunction<double[]> objective, double[] start) {
        int dim = start.length;
        double[][] simplex = new double[dim + 1][];
        double[] values = new double[dim + 1];

        simplex[0] = start.clone();
        for (int i = 0; i < dim; i++) {
            double[] vertex = start.clone();
            vertex[i] += vertex[i] != 0.0 ? initialStep * Math.abs(vertex[i]) + initialStep : initialStep;
            simplex[i + 1] = vertex;
        }
        for (int i = 0; i <= dim; i++) {
            values[i] = safe(objective.applyAsDouble(simplex[i]));
        }

        Integer[] order = new Integer[dim + 1];
        int iteration = 0;
        boolean converged = false;

        while (iteration < maxIterations) {
            iteration++;
            for (int i = 0; i <= dim; i++) order[i] = i;
            final double[] vals = values;
            Arrays.sort(order, Comparator.comparingDouble(i -> vals[i]));
            double[][] sortedSimplex = new double[dim + 1][];
            double[] sortedValues = new double[dim + 1];
            for (int i = 0; i <= dim; i++) {
                sortedSimplex[i] = simplex[order[i]];
                sortedValues[i] = values[order[i]];
            }
            simplex = sortedSimplex;
            values = sortedValues;

            double spread = Math.abs(values[dim] - values[0]);
            if (spread <= tolerance * (Math.abs(values[0]) + tolerance)) {
                converged = true;
                break;
            }

            double[] centroid = new double[dim];
            for (int i = 0; i < dim; i++) {
                for (int j = 0; j < dim; j++) centroid[j] += simplex[i][j] / dim;
            }

            double[] reflected = combine(centroid, simplex[dim], -REFLECTION);
            double fr = safe(objective.applyAsDouble(reflected));

            if (fr < values[0]) {
                double[] expanded = combine(centroid, simplex[dim], -EXPANSION);
                double fe = safe(objective.applyAsDouble(expanded));
                if (fe < fr) {
                    simplex[dim] = expanded;
                    values[dim] = fe;
                } else {
                    simplex[dim] = reflected;
                    values[dim] = fr;
                }
            } else if (fr < values[dim - 1]) {
                simplex[dim] = reflected;
                values[dim] = fr;
            } else {
                boolean outside = fr < values[dim];
                double[] contracted = outside
                        ? combine(centroid, reflected, CONTRACTION)
                        : combine(centroid, simplex[dim], CONTRACTION);
                double fc = safe(objective.applyAsDouble(contracted));
                if (fc < Math.min(fr, values[dim])) {
                    simplex[dim] = contracted;
                    values[dim] = fc;
                } else {
                    for (int i = 1; i <= dim; i++) {
                        simplex[i] = combine(simplex[0], simplex[i], SHRINK);
                        values[i] = safe(objective.applyAsDouble(simplex[i]));
                    }
                }
            }
        }

        int best = 0;
        for (int i = 1; i <= dim; i++) {
            if (values[i] < values[best]) best = i;
        }
        return new Result(simplex[best].clone(), values[best], iteration, converged);
    }

    /** Returns {@code base + t * (other - base)}. */
    private static double[] combine(double[] base, double[] other, double t) {
        double[] out = new double[base.length];
        for (int i = 0; i < base.length; i++) {
            out[i] = base[i] + t * (other[i] - base[i]);
        }
        return out;
    }

    private static double safe(double value) {
        return Double.isFinite(value) ? value : Double.MAX_VALUE;
    }

    public record Result(double[] point, double value, int iterations, boolean converged) {}
}
