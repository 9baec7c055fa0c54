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
 * Picks the part of a context that forms the reference or the evaluation sample. Filters never fail on an empty
 * selection; the detector decides what an empty sample means.
 */
public interface SampleFilter {
    Sample select(Context context, TimeSeries series);

    /** Largest sample this filter can return from a context of the given length */
    int maxSampleSize(int contextLength);
}
