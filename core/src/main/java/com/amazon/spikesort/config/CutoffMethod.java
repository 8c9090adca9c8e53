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

package com.amazon.spikesort.config;

/**
 * How a connection-strength cutoff was obtained.
 */
public enum CutoffMethod {

    /**
     * the configured default cutoff, used unchanged for every electrode
     */
    DEFAULT,
    /**
     * the upper BCa bootstrap confidence bound of a percentile of the
     * between-cluster connection strengths
     */
    BOOTSTRAP,
    /**
     * the configured fallback, used when there are too few cluster pairs to
     * bootstrap
     */
    FALLBACK,
    /**
     * a value supplied during manual merging
     */
    MANUAL;

}
