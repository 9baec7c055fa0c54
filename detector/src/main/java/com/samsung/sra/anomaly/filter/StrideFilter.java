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

/**
 * Every stride-th index of the context, starting offset positions after the context start. Two stride filters with
 * the same stride and different offsets select disjoint interleaved samples.
 */
public class StrideFilter implements SampleFilter {
    private final int stride, offset;

    public StrideFilter(int stride, int offset) {
        if (stride <= 0) throw new IllegalArgumentException("stride must be positive");
        if (offset < 0 || offset >= stride) throw new IllegalArgumentException("offset must lie in [0, stride)");
        this.stride = stride;
        this.offset = offset;
    }

    @Override
    public Sample select(Context context, TimeSeries series) {
        int[] indices = new int[maxSampleSize(context.length())];
        for (int i = 0; i < indices.length; ++i) {
            indices[i] = context.start + offset + i * stride;
        }
        return Sample.of(context, series, indices);
    }

    @Override
    public int maxSampleSize(int contextLength) {
        return contextLength <= offset ? 0 : (contextLength - offset - 1) / stride + 1;
    }

    @Override
    public String toString() {
        return String.format("stride %d offset %d", stride, offset);
    }
}
