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

import com.samsung.sra.anomaly.ConfigurationException;

/** Total variation distance (half the L1 distance between the histograms), in [0, 1] */
public class TotalVariationEvaluator extends HistogramEvaluator {
    public TotalVariationEvaluator(double smoothing) throws ConfigurationException {
        super(smoothing);
    }

    @Override
    protected double divergence(double[] expected, double[] observed) {
        double sum = 0;
        for (int i = 0; i < observed.length; ++i) {
            sum += Math.abs(expected[i] - observed[i]);
        }
        return Math.min(1, sum / 2);
    }

    @Override
    public String toString() {
        return "total_variation, smoothing " + smoothing;
    }
}
