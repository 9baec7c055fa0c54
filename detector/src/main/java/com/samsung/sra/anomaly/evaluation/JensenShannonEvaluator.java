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

/** Base-2 Jensen-Shannon divergence, in [0, 1] */
public class JensenShannonEvaluator extends HistogramEvaluator {
    private static final double LN2 = Math.log(2);

    public JensenShannonEvaluator(double smoothing) throws ConfigurationException {
        super(smoothing);
    }

    @Override
    protected double divergence(double[] expected, double[] observed) {
        double js = 0;
        for (int i = 0; i < observed.length; ++i) {
            double mid = (expected[i] + observed[i]) / 2;
            if (expected[i] > 0) js += expected[i] * Math.log(expected[i] / mid);
            if (observed[i] > 0) js += observed[i] * Math.log(observed[i] / mid);
        }
        return Math.min(1, js / (2 * LN2));
    }

    @Override
    public String toString() {
        return "jensen_shannon, smoothing " + smoothing;
    }
}
