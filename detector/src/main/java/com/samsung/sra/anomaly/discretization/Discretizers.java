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

import com.samsung.sra.anomaly.Configuration;
import com.samsung.sra.anomaly.ConfigurationException;

public class Discretizers {
    private Discretizers() {}

    /** type: equal_width (default), equal_frequency or gaussian; bins (default 4) */
    public static Discretizer fromConfiguration(Configuration config) throws ConfigurationException {
        String section = Configuration.DISCRETIZATION;
        DiscretizationType type = config.getEnum(section, "type", DiscretizationType.class,
                DiscretizationType.EQUAL_WIDTH);
        int bins = config.getInt(section, "bins", 4);
        switch (type) {
            case EQUAL_WIDTH:
                return new EqualWidthDiscretizer(bins);
            case EQUAL_FREQUENCY:
                return new EqualFrequencyDiscretizer(bins);
            case GAUSSIAN:
                return new GaussianDiscretizer(bins);
            default:
                throw new IllegalStateException("unhandled discretization type " + type);
        }
    }
}
