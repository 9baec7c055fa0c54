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
package com.samsung.sra.anomaly.experiments;

import com.samsung.sra.anomaly.InvalidInputException;
import com.samsung.sra.anomaly.TimeSeries;
import org.junit.Test;

import java.io.StringReader;

import static org.hamcrest.CoreMatchers.containsString;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

public class SeriesReaderTest {
    @Test
    public void mixedSeparatorsAndComments() throws Exception {
        TimeSeries series = SeriesReader.read(new StringReader(
                "# sensor 7\n" +
                "1, 2.5,3\n" +
                "\n" +
                "  -4e1\t5 # spike follows\n" +
                "6\n"));
        assertArrayEquals(new double[]{1, 2.5, 3, -40, 5, 6}, series.toArray(), 0);
    }

    @Test
    public void longSeriesOneValuePerLine() throws Exception {
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < 5000; ++i) {
            text.append(i).append('\n');
        }
        TimeSeries series = SeriesReader.read(new StringReader(text.toString()));
        assertEquals(5000, series.size());
        assertEquals(4999, series.get(4999), 0);
    }

    @Test
    public void reportsLineOfBadToken() throws Exception {
        try {
            SeriesReader.read(new StringReader("1 2\n3 x4\n"));
            fail("expected InvalidInputException");
        } catch (InvalidInputException e) {
            assertThat(e.getMessage(), containsString("line 2"));
            assertThat(e.getMessage(), containsString("x4"));
        }
    }

    @Test(expected = InvalidInputException.class)
    public void onlyComments() throws Exception {
        SeriesReader.read(new StringReader("# nothing here\n\n"));
    }

    @Test(expected = InvalidInputException.class)
    public void nonFinite() throws Exception {
        SeriesReader.read(new StringReader("1 NaN 3"));
    }
}
