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
package com.samsung.sra.anomaly;

import java.util.Arrays;

/**
 * Immutable univariate series, indexed 0..n-1. Only finite values are accepted.
 */
public class TimeSeries {
    private final double[] values;

    public TimeSeries(double[] values) throws InvalidInputException {
        if (values == null || values.length == 0) {
            throw new InvalidInputException("empty input series");
        }
        for (int i = 0; i < values.length; ++i) {
            if (!Double.isFinite(values[i])) {
                throw new InvalidInputException(String.format("non-finite value %s at index %d", values[i], i));
            }
        }
        this.values = values.clone();
    }

    public int size() {
        return values.length;
    }

    public double get(int index) {
        return values[index];
    }

    /** Copy of the values in [start, end) */
    public double[] slice(int start, int end) {
        return Arrays.copyOfRange(values, start, end);
    }

    public double[] toArray() {
        return values.clone();
    }

    @Override
    public String toString() {
        return String.format("<time-series: %d values>", values.length);
    }
}
