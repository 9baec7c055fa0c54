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

/**
 * First differences v[i+1] - v[i] between consecutive sample values. Consecutive means consecutive in the sample,
 * which for a stride or predicate filter is not the same as adjacent in the series.
 */
public class DifferenceRepresenter implements Representer {
    @Override
    public Representation represent(Sample sample) throws InsufficientDataException {
        if (sample.size() < 2) {
            throw new InsufficientDataException(
                    "first differences need at least 2 values, sample has " + sample.size());
        }
        double[] diffs = new double[sample.size() - 1];
        for (int i = 0; i < diffs.length; ++i) {
            diffs[i] = sample.getValue(i + 1) - sample.getValue(i);
        }
        return new Representation(diffs);
    }

    @Override
    public int minimumSampleSize() {
        return 2;
    }

    @Override
    public String toString() {
        return "difference";
    }
}
