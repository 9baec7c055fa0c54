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

import java.util.Arrays;

/** Highest score of any context touching the index */
public class MaxAggregator extends ScoreAggregator {
    private final double[] max;

    public MaxAggregator(int length) {
        super(length);
        max = new double[length];
        Arrays.fill(max, Double.NEGATIVE_INFINITY);
    }

    @Override
    protected void accumulate(Context context, int index, double score) {
        max[index] = Math.max(max[index], score);
    }

    @Override
    protected double combined(int index) {
        return max[index];
    }
}
