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

import com.samsung.sra.anomaly.context.Context;

/**
 * A single context did not have enough data to be scored: an empty sample, a sample too short for the
 * representation, or a reference the discretizer cannot fit. The context is attached once the orchestrator knows it.
 */
public class InsufficientDataException extends AnomalyDetectionException {
    private final Context context;

    public InsufficientDataException(String msg) {
        this(msg, (Context) null);
    }

    public InsufficientDataException(String msg, Context context) {
        super(context == null ? msg : msg + " in context " + context);
        this.context = context;
    }

    /** Re-raise with the offending context attached; where says what the detector was doing */
    public InsufficientDataException(InsufficientDataException cause, Context context, String where) {
        super(String.format("%s in context %s (%s)", cause.getMessage(), context, where), cause);
        this.context = context;
    }

    /** May be null if raised outside the orchestrator */
    public Context getContext() {
        return context;
    }
}
