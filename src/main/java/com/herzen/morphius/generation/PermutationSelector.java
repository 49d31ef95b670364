package com.herzen.morphius.generation;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.random.RandomGenerator;
import java.util.stream.IntStream;

/**
 * Picks which questions a test contains and in what order. A selection of {@code k} out of
 * {@code n} questions is uniform over all ordered arrangements of {@code min(k, n)} distinct
 * indices.
 */
@Component
public class PermutationSelector {

    public List<Integer> originalOrder(int totalQuestions) {
        return IntStream.range(0, totalQuestions).boxed().toList();
    }

    public List<Integer> select(int totalQuestions, int numQuestions, RandomGenerator random) {
        int k = Math.min(numQuestions, totalQuestions);
        int[] indices = IntStream.range(0, totalQuestions).toArray();
        // partial Fisher-Yates: positions [0, k) end up holding a uniform k-arrangement
        for (int i = 0; i < k; i++) {
            int j = random.nextInt(i, totalQuestions);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
        }
        List<Integer> order = new ArrayList<>(k);
        for (int i = 0; i < k; i++) {
            order.add(indices[i]);
        }
        return List.copyOf(order);
    }
}
