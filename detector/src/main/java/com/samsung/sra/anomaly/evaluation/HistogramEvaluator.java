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
import com.samsung.sra.anomaly.discretization.DiscretizationModel;
import com.samsung.sra.anomaly.discretization.DiscretizedRepresentation;

/**
 * Compares the smoothed bin distributions of the reference (the expected distribution) and the evaluation sample.
 */
public abstract class HistogramEvaluator implements Evaluator {
    protected final double smoothing;

    protected HistogramEvaluator(double smoothing) throws ConfigurationException {
        if (!(smoothing >= 0) || Double.isInfinite(smoothing)) {
            throw new ConfigurationException("evaluator smoothing must be a non-negative number, got " + smoothing);
        }
        this.smoothing = smoothing;
    }

    /** @param expected reference distribution, @param observed evaluation distribution */
    protected abstract double divergence(double[] expected, double[] observed);

    @Override
    public double score(DiscretizationModel model,
                        DiscretizedRepresentation reference, DiscretizedRepresentation evaluation) {
        assert reference.getNumBins() == model.getNumBins() && evaluation.getNumBins() == model.getNumBins();
        double[] expected = new Histogram(reference).getProbabilities(smoothing);
        double[] observed = new Histogram(evaluation).getProbabilities(smoothing);
        double score = divergence(expected, observed);
        // rounding can leave tiny negatives on identical distributions
        return score > 0 ? score : 0;
    }

    public double getSmoothing() {
        return smoothing;
    }
}
