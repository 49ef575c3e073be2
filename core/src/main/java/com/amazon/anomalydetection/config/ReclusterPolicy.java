/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.anomalydetection.config;

import static com.amazon.anomalydetection.CommonUtils.checkConfiguration;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Controls when a density clustering detector recomputes its clusters as new
 * points arrive. Re-clustering derives cluster membership of the whole history
 * from scratch, which is the dominant cost of the detector; the policy lets the
 * caller trade freshness of the model against that cost.
 */
@Getter
@ToString
@EqualsAndHashCode
public class ReclusterPolicy {

    public static final int DEFAULT_INTERVAL = 50;

    public enum Mode {
        /**
         * recluster after every added point
         */
        EAGER,
        /**
         * recluster after every {@code interval} added points
         */
        PERIODIC,
        /**
         * recluster only when explicitly asked to
         */
        MANUAL
    }

    private final Mode mode;

    private final int interval;

    private ReclusterPolicy(Mode mode, int interval) {
        this.mode = mode;
        this.interval = interval;
    }

    public static ReclusterPolicy eager() {
        return new ReclusterPolicy(Mode.EAGER, 1);
    }

    public static ReclusterPolicy periodic(int interval) {
        checkConfiguration(interval > 0, "recluster interval must be positive");
        return new ReclusterPolicy(Mode.PERIODIC, interval);
    }

    public static ReclusterPolicy periodic() {
        return periodic(DEFAULT_INTERVAL);
    }

    public static ReclusterPolicy manual() {
        return new ReclusterPolicy(Mode.MANUAL, 0);
    }

    /**
     * Decides whether the detector should recluster after a point was added.
     *
     * @param pointsSinceClustering points added since the last clustering
     * @param hasSnapshot           whether a clustering has been computed before
     * @param historySize           number of points currently in the history
     * @param minPoints             the minimum neighbor count of the detector
     * @return true if the detector should recluster now
     */
    public boolean shouldRecluster(int pointsSinceClustering, boolean hasSnapshot, int historySize, int minPoints) {
        if (mode == Mode.MANUAL || historySize < minPoints) {
            return false;
        }
        // the first snapshot is taken as soon as there is enough data for one
        return !hasSnapshot || pointsSinceClustering >= interval;
    }
}
