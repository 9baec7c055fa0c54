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

/** Arithmetic mean over the contexts touching the index */
public class MeanAggregator extends ScoreAggregator {
    private final double[] sum;
    private final int[] count;

    public MeanAggregator(int length) {
        super(length);
        sum = new double[length];
        count = new int[length];
    }

    @Override
    protected void accumulate(Context context, int index, double score) {
        sum[index] += score;
        ++count[index];
    }

    @Override
    protected double combined(int index) {
        return sum[index] / count[index];
    }
}
