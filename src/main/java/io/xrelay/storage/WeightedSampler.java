package io.xrelay.storage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.function.ToDoubleFunction;

/**
 * Weighted selection without replacement. Each draw picks an item with probability proportional
 * to its weight among the items still remaining; when the remaining weight is zero the draw is
 * uniform instead.
 */
public final class WeightedSampler {
    private final Random random;

    public WeightedSampler(Random random) {
        this.random = random;
    }

    public <T> List<T> sample(List<T> items, ToDoubleFunction<T> weightFn, int k) {
        if (k < 0) {
            throw new IllegalArgumentException("k must be >= 0");
        }
        if (items == null || items.isEmpty() || k == 0) {
            return List.of();
        }
        List<T> remaining = new ArrayList<>(items);
        List<Double> weights = new ArrayList<>(remaining.size());
        double total = 0.0;
        for (T item : remaining) {
            double w = Math.max(0.0, weightFn.applyAsDouble(item));
            weights.add(w);
            total += w;
        }
        int picks = Math.min(k, remaining.size());
        List<T> selected = new ArrayList<>(picks);
        synchronized (random) {
            for (int i = 0; i < picks; i++) {
                int index;
                if (total <= 0.0) {
                    index = random.nextInt(remaining.size());
                } else {
                    index = pickIndex(weights, random.nextDouble() * total);
                }
                selected.add(remaining.remove(index));
                total -= weights.remove(index);
                if (total < 1e-12) {
                    total = 0.0;
                }
            }
        }
        return Collections.unmodifiableList(selected);
    }

    private static int pickIndex(List<Double> weights, double u) {
        double running = 0.0;
        int lastPositive = -1;
        for (int j = 0; j < weights.size(); j++) {
            double w = weights.get(j);
            if (w <= 0.0) {
                continue;
            }
            running += w;
            lastPositive = j;
            if (running > u) {
                return j;
            }
        }
        // Floating point drift can leave u just above the running sum.
        return lastPositive >= 0 ? lastPositive : 0;
    }
}
