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

/** Two-value summary: [mean, population variance] */
public class SummaryRepresenter implements Representer {
    @Override
    public Representation represent(Sample sample) throws InsufficientDataException {
        if (sample.isEmpty()) {
            throw new InsufficientDataException("cannot summarize an empty sample");
        }
        double[] values = sample.getValues();
        double mean = StatUtils.mean(values);
        return new Representation(new double[]{mean, StatUtils.populationVariance(values, mean)});
    }

    @Override
    public int minimumSampleSize() {
        return 1;
    }

    @Override
    public String toString() {
        return "summary";
    }
}
