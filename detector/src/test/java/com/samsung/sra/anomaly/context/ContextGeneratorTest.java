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
package com.samsung.sra.anomaly.context;

import com.samsung.sra.anomaly.Configuration;
import com.samsung.sra.anomaly.ConfigurationException;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class ContextGeneratorTest {
    private static List<String> ranges(List<Context> contexts) {
        List<String> ranges = new ArrayList<>();
        for (Context c : contexts) {
            ranges.add(c.start + "-" + c.end);
        }
        return ranges;
    }

    @Test
    public void stridedWindowsThatTileExactly() throws Exception {
        ContextGenerator gen = new ContextGenerator(4, 2, Coverage.FULL);
        List<Context> contexts = gen.generate(10);
        assertThat(ranges(contexts), is(Arrays.asList("0-4", "2-6", "4-8", "6-10")));
        assertEquals(4, gen.count(10));
        for (int i = 0; i < contexts.size(); ++i) {
            assertEquals(i, contexts.get(i).ordinal);
        }
    }

    @Test
    public void fullCoverageAlignsLastWindowToEnd() throws Exception {
        ContextGenerator gen = new ContextGenerator(4, 3, Coverage.FULL);
        assertThat(ranges(gen.generate(11)), is(Arrays.asList("0-4", "3-7", "6-10", "7-11")));
        assertEquals(4, gen.count(11));
    }

    @Test
    public void partialCoverageLeavesTail() throws Exception {
        ContextGenerator gen = new ContextGenerator(4, 3, Coverage.PARTIAL);
        assertThat(ranges(gen.generate(11)), is(Arrays.asList("0-4", "3-7", "6-10")));
        assertEquals(3, gen.count(11));

        ContextGenerator gappy = new ContextGenerator(2, 5, Coverage.PARTIAL);
        assertThat(ranges(gappy.generate(12)), is(Arrays.asList("0-2", "5-7", "10-12")));
    }

    @Test
    public void fullCoverageCoversEveryIndex() throws Exception {
        for (int window = 1; window <= 7; ++window) {
            for (int step = 1; step <= window; ++step) {
                for (int n = window; n <= 30; ++n) {
                    List<Context> contexts = new ContextGenerator(window, step, Coverage.FULL).generate(n);
                    boolean[] covered = new boolean[n];
                    int prevStart = -1;
                    for (Context c : contexts) {
                        assertTrue(c.start >= prevStart);
                        assertEquals(window, c.length());
                        prevStart = c.start;
                        for (int i = c.start; i < c.end; ++i) covered[i] = true;
                    }
                    for (int i = 0; i < n; ++i) {
                        assertTrue(String.format("w=%d s=%d n=%d i=%d", window, step, n, i), covered[i]);
                    }
                }
            }
        }
    }

    @Test
    public void generateIsRepeatable() throws Exception {
        ContextGenerator gen = new ContextGenerator(5, 2, Coverage.FULL);
        assertEquals(gen.generate(23), gen.generate(23));
    }

    @Test
    public void windowEqualToLength() throws Exception {
        assertThat(ranges(new ContextGenerator(6, 1, Coverage.FULL).generate(6)), is(Arrays.asList("0-6")));
    }

    @Test
    public void rejectsBadParameters() {
        assertRejected(0, 1, Coverage.FULL, "window");
        assertRejected(-3, 1, Coverage.FULL, "window");
        assertRejected(4, 0, Coverage.FULL, "step");
        assertRejected(4, 5, Coverage.FULL, "gaps");
    }

    @Test
    public void rejectsWindowLongerThanSeries() throws Exception {
        ContextGenerator gen = new ContextGenerator(4, 2, Coverage.FULL);
        try {
            gen.generate(3);
            fail("expected ConfigurationException");
        } catch (ConfigurationException e) {
            assertThat(e.getMessage(), containsString("exceeds series length"));
        }
        assertEquals(0, gen.count(3));
    }

    @Test
    public void fromConfiguration() throws Exception {
        ContextGenerator gen = ContextGenerator.fromConfiguration(new Configuration()
                .set("context", "window", "8")
                .set("context", "coverage", "partial"));
        assertEquals(8, gen.getWindow());
        assertEquals(8, gen.getStep());
        assertEquals(Coverage.PARTIAL, gen.getCoverage());
    }

    @Test(expected = ConfigurationException.class)
    public void windowIsRequired() throws Exception {
        ContextGenerator.fromConfiguration(new Configuration().set("context", "step", "2"));
    }

    private static void assertRejected(int window, int step, Coverage coverage, String messagePart) {
        try {
            new ContextGenerator(window, step, coverage);
            fail("expected ConfigurationException");
        } catch (ConfigurationException e) {
            assertThat(e.getMessage(), containsString(messagePart));
        }
    }
}
