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

/**
 * Splits [min, max] of the reference into bins intervals of equal width. A constant reference is accepted: all cut
 * points collapse onto the constant, so the constant itself and anything smaller land in bin 0 and anything larger
 * in the last bin.
 */
public class EqualWidthDiscretizer extends CutPointDiscretizer {
    public EqualWidthDiscretizer(int bins) throws ConfigurationException {
        super(bins);
    }

    @Override
    protected DiscretizationModel fitValues(double[] reference) {
        double min = Double.POSITIVE_INFINITY, max = Double.NEGATIVE_INFINITY;
        for (double v : reference) {
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        double width = (max - min) / bins;
        double[] cuts = new double[bins - 1];
        for (int k = 1; k < bins; ++k) {
            cuts[k - 1] = min + k * width;
        }
        return new DiscretizationModel(cuts);
    }

    @Override
    public String toString() {
        return "equal_width " + bins;
    }
}
