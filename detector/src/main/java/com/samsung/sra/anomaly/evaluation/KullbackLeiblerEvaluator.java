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

/**
 * KL(observed || expected) in nats: the information lost when the reference distribution is used to describe the
 * evaluation sample. Unbounded. With zero smoothing, reference probabilities are floored at {@link #FLOOR} so bins the
 * reference never visited give a large but finite score.
 */
public class KullbackLeiblerEvaluator extends HistogramEvaluator {
    static final double FLOOR = 1e-10;

    public KullbackLeiblerEvaluator(double smoothing) throws ConfigurationException {
        super(smoothing);
    }

    @Override
    protected double divergence(double[] expected, double[] observed) {
        double kl = 0;
        for (int i = 0; i < observed.length; ++i) {
            if (observed[i] > 0) {
                kl += observed[i] * Math.log(observed[i] / Math.max(expected[i], FLOOR));
            }
        }
        return kl;
    }

    @Override
    public String toString() {
        return "kl, smoothing " + smoothing;
    }
}
