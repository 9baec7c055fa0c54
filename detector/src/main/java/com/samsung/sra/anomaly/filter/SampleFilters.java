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

import com.samsung.sra.anomaly.Configuration;
import com.samsung.sra.anomaly.ConfigurationException;

public class SampleFilters {
    private SampleFilters() {}

    /**
     * Build the filter described by one filter section (reference_filter or evaluation_filter).
     *
     * <ul>
     *     <li>leading / trailing: size, 1..window, default max(1, window / 2)</li>
     *     <li>stride: stride (default 2) and offset in [0, stride) (default 0)</li>
     *     <li>predicate: operator (lt, le, gt, ge) and threshold, both required</li>
     *     <li>all: no options</li>
     * </ul>
     */
    public static SampleFilter fromConfiguration(Configuration config, String section, FilterType defaultType,
                                                 int window) throws ConfigurationException {
        FilterType type = config.getEnum(section, "type", FilterType.class, defaultType);
        switch (type) {
            case LEADING:
                return new LeadingFilter(parseSize(config, section, window));
            case TRAILING:
                return new TrailingFilter(parseSize(config, section, window));
            case STRIDE: {
                int stride = config.getPositiveInt(section, "stride", 2);
                int offset = config.getInt(section, "offset", 0);
                if (offset < 0 || offset >= stride) {
                    throw new ConfigurationException(String.format("%s.offset must lie in [0, %d), got %d",
                            section, stride, offset));
                }
                if (offset >= window) {
                    throw new ConfigurationException(String.format("%s.offset %d selects nothing from a window of %d",
                            section, offset, window));
                }
                return new StrideFilter(stride, offset);
            }
            case PREDICATE:
                return new ValuePredicateFilter(
                        config.getEnum(section, "operator", ValuePredicateFilter.Operator.class),
                        config.getDouble(section, "threshold"));
            case ALL:
                return new WholeContextFilter();
            default:
                throw new IllegalStateException("unhandled filter type " + type);
        }
    }

    private static int parseSize(Configuration config, String section, int window) throws ConfigurationException {
        int size = config.getPositiveInt(section, "size", Math.max(1, window / 2));
        if (size > window) {
            throw new ConfigurationException(String.format("%s.size %d exceeds context window %d",
                    section, size, window));
        }
        return size;
    }
}
