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
package com.samsung.sra.anomaly.filter;

import com.samsung.sra.anomaly.Configuration;
import com.samsung.sra.anomaly.TimeSeries;
import com.samsung.sra.anomaly.context.Context;

import java.util.Arrays;
import java.util.function.DoublePredicate;

/**
 * Indices whose value compares against a fixed threshold, e.g. "every value below 100" as the reference. The
 * selection depends on the data, so it may well come back empty.
 */
public class ValuePredicateFilter implements SampleFilter {
    public enum Operator {
        LT, LE, GT, GE;

        DoublePredicate against(double threshold) {
            switch (this) {
                case LT:
                    return v -> v < threshold;
                case LE:
                    return v -> v <= threshold;
                case GT:
                    return v -> v > threshold;
                case GE:
                    return v -> v >= threshold;
                default:
                    throw new IllegalStateException("unknown operator " + this);
            }
        }
    }

    private final Operator operator;
    private final double threshold;
    private final DoublePredicate predicate;

    public ValuePredicateFilter(Operator operator, double threshold) {
        this.operator = operator;
        this.threshold = threshold;
        this.predicate = operator.against(threshold);
    }

    @Override
    public Sample select(Context context, TimeSeries series) {
        int[] indices = new int[context.length()];
        int n = 0;
        for (int i = context.start; i < context.end; ++i) {
            if (predicate.test(series.get(i))) {
                indices[n++] = i;
            }
        }
        return Sample.of(context, series, Arrays.copyOf(indices, n));
    }

    @Override
    public int maxSampleSize(int contextLength) {
        return contextLength;
    }

    @Override
    public String toString() {
        return String.format("value %s %s", Configuration.nameOf(operator), threshold);
    }
}
