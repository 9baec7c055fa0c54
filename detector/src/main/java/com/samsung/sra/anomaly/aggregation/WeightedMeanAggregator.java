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

/**
 * Mean weighted towards the contexts centered closest to the index: weight 1 / (1 + |index - center|). Weights are
 * always positive, so an index touched at least once always has a defined mean.
 */
public class WeightedMeanAggregator extends ScoreAggregator {
    private final double[] weightedSum, totalWeight;

    public WeightedMeanAggregator(int length) {
        super(length);
        weightedSum = new double[length];
        totalWeight = new double[length];
    }

    static double weight(Context context, int index) {
        return 1 / (1 + Math.abs(index - context.center()));
    }

    @Override
    protected void accumulate(Context context, int index, double score) {
        double w = weight(context, index);
        weightedSum[index] += w * score;
        totalWeight[index] += w;
    }

    @Override
    protected double combined(int index) {
        return weightedSum[index] / totalWeight[index];
    }
}
