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

public class WholeContextFilter implements SampleFilter {
    @Override
    public Sample select(Context context, TimeSeries series) {
        return Sample.ofRange(context, series, context.start, context.end);
    }

    @Override
    public int maxSampleSize(int contextLength) {
        return contextLength;
    }

    @Override
    public String toString() {
        return "all";
    }
}
