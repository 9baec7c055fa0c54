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
package com.samsung.sra.anomaly.discretization;

import com.samsung.sra.anomaly.ConfigurationException;
import com.samsung.sra.anomaly.InsufficientDataException;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.stat.StatUtils;

/**
 * SAX-style breakpoints: assumes the reference is roughly normal and places cut point k at the k/bins quantile of
 * N(mean, sd) fitted to it. A zero standard deviation collapses the cut points onto the mean, as for
 * {@link EqualWidthDiscretizer}. References so spread out that the variance overflows cannot be fitted.
 */
public class GaussianDiscretizer extends CutPointDiscretizer {
    private static final NormalDistribution normalDist = new NormalDistribution(0, 1);

    public GaussianDiscretizer(int bins) throws ConfigurationException {
        super(bins);
    }

    @Override
    protected DiscretizationModel fitValues(double[] reference) throws InsufficientDataException {
        double mean = StatUtils.mean(reference);
        double sd = Math.sqrt(StatUtils.populationVariance(reference, mean));
        if (!Double.isFinite(mean) || !Double.isFinite(sd)) {
            throw new InsufficientDataException(String.format(
                    "reference mean %s / standard deviation %s overflows, cannot place gaussian cut points", mean, sd));
        }
        double[] cuts = new double[bins - 1];
        for (int k = 1; k < bins; ++k) {
            cuts[k - 1] = mean + sd * normalDist.inverseCumulativeProbability((double) k / bins);
        }
        return new DiscretizationModel(cuts);
    }

    @Override
    public String toString() {
        return "gaussian " + bins;
    }
}
