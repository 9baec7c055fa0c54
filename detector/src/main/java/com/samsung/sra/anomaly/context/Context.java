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

import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;

/**
 * Contiguous index range [start, end) over the series, plus its position in the generated context sequence.
 */
public class Context {
    public final int ordinal;
    public final int start, end;

    public Context(int ordinal, int start, int end) {
        if (start < 0 || end <= start) {
            throw new IllegalArgumentException(String.format("invalid context range [%d, %d)", start, end));
        }
        this.ordinal = ordinal;
        this.start = start;
        this.end = end;
    }

    public int length() {
        return end - start;
    }

    /** Midpoint of the first and last covered index */
    public double center() {
        return (start + end - 1) / 2d;
    }

    public boolean contains(int index) {
        return start <= index && index < end;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Context)) return false;
        Context that = (Context) o;
        return new EqualsBuilder()
                .append(ordinal, that.ordinal)
                .append(start, that.start)
                .append(end, that.end)
                .isEquals();
    }

    @Override
    public int hashCode() {
        return new HashCodeBuilder().append(ordinal).append(start).append(end).toHashCode();
    }

    @Override
    public String toString() {
        return String.format("#%d [%d, %d)", ordinal, start, end);
    }
}
