package me.golemcore.agent.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

/**
 * Milestone categories an anchor can represent, each with its boundary weight.
 */
public enum AnchorType {

    ERROR_RESOLUTION(0.9),
    TASK_COMPLETION(0.8),
    FEATURE_MILESTONE(0.75),
    USER_CHECKPOINT(0.7);

    private final double weight;

    AnchorType(double weight) {
        this.weight = weight;
    }

    public double getWeight() {
        return weight;
    }
}
