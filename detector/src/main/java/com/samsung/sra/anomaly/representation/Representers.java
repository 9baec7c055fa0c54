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

import com.samsung.sra.anomaly.Configuration;
import com.samsung.sra.anomaly.ConfigurationException;

public class Representers {
    private Representers() {}

    /** type: identity (default), difference, summary, or paa with segments (default 4) */
    public static Representer fromConfiguration(Configuration config) throws ConfigurationException {
        String section = Configuration.REPRESENTATION;
        RepresentationType type = config.getEnum(section, "type", RepresentationType.class,
                RepresentationType.IDENTITY);
        switch (type) {
            case IDENTITY:
                return new IdentityRepresenter();
            case DIFFERENCE:
                return new DifferenceRepresenter();
            case SUMMARY:
                return new SummaryRepresenter();
            case PAA:
                return new PiecewiseAggregateRepresenter(config.getPositiveInt(section, "segments", 4));
            default:
                throw new IllegalStateException("unhandled representation type " + type);
        }
    }
}
