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

import java.util.Arrays;

/**
 * Quantile bins: each bin receives (about) the same number of reference values. Ranking the m reference values,
 * rank r belongs to bin floor(r * bins / m), so cut point k is the value at rank ceil(k * m / bins) - 1, the last
 * rank of bin k - 1.
 *
 * Ties are broken by original order, the earlier index getting the lower bin: when a cut point's value occurs
 * several times, the model records how many of those occurrences rank at or below the cut, and
 * {@link DiscretizationModel#binsOf} hands that many out below the cut in representation order. The reference
 * therefore always discretizes into equally filled bins.
 *
 * Needs at least as many distinct reference values as bins, otherwise the reference is too degenerate to tell the
 * bins apart.
 */
public class EqualFrequencyDiscretizer extends CutPointDiscretizer {
    public EqualFrequencyDiscretizer(int bins) throws ConfigurationException {
        super(bins);
    }

    @Override
    protected DiscretizationModel fitValues(double[] reference) throws InsufficientDataException {
        int m = reference.length;
        long distinct = Arrays.stream(reference).distinct().count();
        if (distinct < bins) {
            throw new InsufficientDataException(String.format(
                    "equal-frequency discretization into %d bins needs %d distinct values, reference has %d",
                    bins, bins, distinct));
        }
        double[] sorted = reference.clone();
        Arrays.sort(sorted);
        double[] cuts = new double[bins - 1];
        int[] quotas = new int[bins - 1];
        for (int k = 1; k < bins; ++k) {
            int rank = (int) ((long) k * m / bins + ((long) k * m % bins == 0 ? 0 : 1)) - 1;
            double cut = sorted[rank];
            int first = rank;
            while (first > 0 && sorted[first - 1] == cut) {
                --first;
            }
            cuts[k - 1] = cut;
            quotas[k - 1] = rank - first + 1;
        }
        return new DiscretizationModel(cuts, quotas);
    }

    @Override
    public String toString() {
        return "equal_frequency " + bins;
    }
}
