package com.chicu.homeprice.ml.training;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * K-fold с перемешиванием по фиксированному seed.
 * Размеры фолдов: первые n % k фолдов получают на одну строку больше.
 */
public class KFoldSplitter {

    public record Fold(int index, int[] train, int[] test) {
    }

    private final int folds;
    private final long seed;

    public KFoldSplitter(int folds, long seed) {
        if (folds < 2) throw new IllegalArgumentException("folds must be >= 2, got " + folds);
        this.folds = folds;
        this.seed = seed;
    }

    public int folds() {
        return folds;
    }

    public List<Fold> split(int samples) {
        if (samples < folds) {
            throw new IllegalArgumentException("cannot split " + samples + " samples into " + folds + " folds");
        }

        List<Integer> order = new ArrayList<>(samples);
        for (int i = 0; i < samples; i++) order.add(i);
        Collections.shuffle(order, new Random(seed));

        List<Fold> out = new ArrayList<>(folds);
        int start = 0;
        for (int k = 0; k < folds; k++) {
            int size = samples / folds + (k < samples % folds ? 1 : 0);

            int[] test = new int[size];
            int[] train = new int[samples - size];
            int t = 0;
            for (int i = 0; i < samples; i++) {
                if (i >= start && i < start + size) {
                    test[i - start] = order.get(i);
                } else {
                    train[t++] = order.get(i);
                }
            }
            out.add(new Fold(k, train, test));
            start += size;
        }
        return out;
    }
}
