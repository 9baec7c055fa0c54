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
package com.samsung.sra.anomaly.filter;

import com.samsung.sra.anomaly.TimeSeries;
import com.samsung.sra.anomaly.context.Context;

import java.util.Arrays;

/**
 * Ordered (index, value) pairs selected from one context. Indices are strictly increasing and lie inside the
 * context. A sample may be empty; whether that is acceptable is up to the caller.
 */
public class Sample {
    private final Context context;
    private final int[] indices;
    private final double[] values;

    public Sample(Context context, int[] indices, double[] values) {
        if (indices.length != values.length) {
            throw new IllegalArgumentException(String.format("%d indices but %d values", indices.length, values.length));
        }
        for (int i = 0; i < indices.length; ++i) {
            if (!context.contains(indices[i])) {
                throw new IllegalArgumentException("index " + indices[i] + " outside context " + context);
            }
            if (i > 0 && indices[i] <= indices[i - 1]) {
                throw new IllegalArgumentException("sample indices not strictly increasing at position " + i);
            }
        }
        this.context = context;
        this.indices = indices.clone();
        this.values = values.clone();
    }

    /** Sample made of the given (increasing) indices of the series */
    public static Sample of(Context context, TimeSeries series, int[] indices) {
        double[] values = new double[indices.length];
        for (int i = 0; i < indices.length; ++i) {
            values[i] = series.get(indices[i]);
        }
        return new Sample(context, indices, values);
    }

    /** Contiguous sample covering [start, end) */
    public static Sample ofRange(Context context, TimeSeries series, int start, int end) {
        int[] indices = new int[Math.max(0, end - start)];
        for (int i = 0; i < indices.length; ++i) {
            indices[i] = start + i;
        }
        return new Sample(context, indices, series.slice(start, Math.max(start, end)));
    }

    public Context getContext() {
        return context;
    }

    public int size() {
        return indices.length;
    }

    public boolean isEmpty() {
        return indices.length == 0;
    }

    public int getIndex(int i) {
        return indices[i];
    }

    public double getValue(int i) {
        return values[i];
    }

    public int[] getIndices() {
        return indices.clone();
    }

    public double[] getValues() {
        return values.clone();
    }

    @Override
    public String toString() {
        return String.format("<sample: %d values from context %s, indices %s>",
                indices.length, context, Arrays.toString(indices));
    }
}
