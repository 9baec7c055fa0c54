/*
* Copyright 2016 Samsung Research America. All rights reserved.
*
* Licensed under the Apache License, Version 2.0 (the "License");
* you may not use this file except in compliance with the License.
* You may obtain a copy of the License at
*
*     http://www.apache.org/licenses/LICENSE-2.0
*
* Unless required by applicable law or agreed to in writing, software
* distributed under the License is distributed on an "AS IS" BASIS,
* WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
* See the License for the specific language governing permissions and
* limitations under the License.
*/
package com.samsung.sra.anomaly.aggregation;

import com.samsung.sra.anomaly.context.Context;
import com.samsung.sra.anomaly.filter.Sample;

import java.util.Arrays;

/**
 * Collects per-context scores at every series index the context's evaluation sample touched, then folds them into
 * one score per index. One instance serves exactly one detector run.
 */
public abstract class ScoreAggregator {
    /** Score of indices no context touched */
    public static final double DEFAULT_SCORE = 0d;

    protected final int length;
    private final boolean[] touched;

    protected ScoreAggregator(int length) {
        if (length <= 0) throw new IllegalArgumentException("length must be positive");
        this.length = length;
        this.touched = new boolean[length];
    }

    public void add(Context context, Sample evaluation, double score) {
        assert Double.isFinite(score) : "non-finite score " + score;
        for (int i = 0; i < evaluation.size(); ++i) {
            int index = evaluation.getIndex(i);
            touched[index] = true;
            accumulate(context, index, score);
        }
    }

    protected abstract void accumulate(Context context, int index, double score);

    /** Combined score at a touched index */
    protected abstract double combined(int index);

    /**
     * Returns a new array of the given length. Does not modify the accumulated state, so calling it again returns an
     * identical result.
     */
    public double[] finish() {
        double[] scores = new double[length];
        Arrays.fill(scores, DEFAULT_SCORE);
        for (int i = 0; i < length; ++i) {
            if (touched[i]) {
                scores[i] = combined(i);
            }
        }
        return scores;
    }

    public int getLength() {
        return length;
    }

    public boolean isTouched(int index) {
        return touched[index];
    }
}
