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

import org.junit.Test;

import static org.hamcrest.CoreMatchers.containsString;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

public class TimeSeriesTest {
    @Test
    public void copiesInput() throws Exception {
        double[] values = {1, 2, 3};
        TimeSeries series = new TimeSeries(values);
        values[0] = 99;
        assertEquals(1, series.get(0), 0);
        assertEquals(3, series.size());
        assertArrayEquals(new double[]{2, 3}, series.slice(1, 3), 0);
        series.toArray()[1] = 99;
        assertEquals(2, series.get(1), 0);
    }

    @Test
    public void rejectsEmptyAndNonFinite() {
        assertRejected(new double[0], "empty");
        assertRejected(null, "empty");
        assertRejected(new double[]{1, Double.NaN}, "index 1");
        assertRejected(new double[]{Double.NEGATIVE_INFINITY}, "index 0");
    }

    private static void assertRejected(double[] values, String messagePart) {
        try {
            new TimeSeries(values);
            fail("expected InvalidInputException");
        } catch (InvalidInputException e) {
            assertThat(e.getMessage(), containsString(messagePart));
        }
    }
}
