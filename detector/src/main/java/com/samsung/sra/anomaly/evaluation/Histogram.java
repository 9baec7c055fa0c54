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
package com.samsung.sra.anomaly.evaluation;

import com.samsung.sra.anomaly.discretization.DiscretizedRepresentation;

/** Symbol counts over the bins of a discretized representation */
public class Histogram {
    private final long[] counts;
    private final long total;

    public Histogram(DiscretizedRepresentation discretized) {
        counts = new long[discretized.getNumBins()];
        for (int i = 0; i < discretized.size(); ++i) {
            ++counts[discretized.get(i)];
        }
        total = discretized.size();
    }

    public int getNumBins() {
        return counts.length;
    }

    public long getCount(int bin) {
        return counts[bin];
    }

    public long getTotal() {
        return total;
    }

    /**
     * Additively smoothed probabilities (count + alpha) / (total + bins * alpha). With alpha = 0 this is the plain
     * empirical distribution. An empty histogram with alpha = 0 yields all zeros.
     */
    public double[] getProbabilities(double alpha) {
        assert alpha >= 0;
        double denominator = total + counts.length * alpha;
        double[] probabilities = new double[counts.length];
        if (denominator == 0) {
            return probabilities;
        }
        for (int i = 0; i < counts.length; ++i) {
            probabilities[i] = (counts[i] + alpha) / denominator;
        }
        return probabilities;
    }
}
