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
package com.samsung.sra.anomaly.aggregation;

import com.samsung.sra.anomaly.Configuration;
import com.samsung.sra.anomaly.ConfigurationException;

/** How scores from overlapping contexts are combined. Default MAX */
public enum AggregationMethod {
    MAX {
        @Override
        public ScoreAggregator create(int length) {
            return new MaxAggregator(length);
        }
    },
    MEAN {
        @Override
        public ScoreAggregator create(int length) {
            return new MeanAggregator(length);
        }
    },
    WEIGHTED {
        @Override
        public ScoreAggregator create(int length) {
            return new WeightedMeanAggregator(length);
        }
    };

    /** Fresh, empty aggregator for a series of the given length */
    public abstract ScoreAggregator create(int length);

    public static AggregationMethod fromConfiguration(Configuration config) throws ConfigurationException {
        return config.getEnum(Configuration.AGGREGATOR, "type", AggregationMethod.class, MAX);
    }
}
