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
package com.samsung.sra.anomaly.representation;

import com.samsung.sra.anomaly.InsufficientDataException;
import com.samsung.sra.anomaly.filter.Sample;
import org.apache.commons.math3.stat.StatUtils;

/**
 * Piecewise aggregate approximation: splits the sample into (at most) segments nearly equal runs and replaces each
 * run by its mean. Segment i covers positions [i*m/segments, (i+1)*m/segments). Samples shorter than segments get
 * one segment per value.
 */
public class PiecewiseAggregateRepresenter implements Representer {
    private final int segments;

    public PiecewiseAggregateRepresenter(int segments) {
        if (segments <= 0) throw new IllegalArgumentException("segments must be positive");
        this.segments = segments;
    }

    @Override
    public Representation represent(Sample sample) throws InsufficientDataException {
        int m = sample.size();
        if (m == 0) {
            throw new InsufficientDataException("cannot aggregate an empty sample");
        }
        int k = Math.min(segments, m);
        double[] values = sample.getValues();
        double[] means = new double[k];
        for (int i = 0; i < k; ++i) {
            int from = (int) ((long) i * m / k), to = (int) ((long) (i + 1) * m / k);
            means[i] = StatUtils.mean(values, from, to - from);
        }
        return new Representation(means);
    }

    @Override
    public int minimumSampleSize() {
        return 1;
    }

    @Override
    public String toString() {
        return "paa " + segments;
    }
}
