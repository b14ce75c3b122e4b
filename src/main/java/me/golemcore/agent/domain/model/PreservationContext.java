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

import lombok.Builder;

import java.util.ArrayList;
import java.util.List;

/**
 * Facts needed to continue a conversation after older turns were summarized.
 */
@Builder
public record PreservationContext(
        List<String> activeFiles,
        List<String> currentGoals,
        List<String> errorStates,
        BuildStatus buildStatus,
        String lastUserIntent) {

    private static final String NONE = "none";

    public PreservationContext {
        activeFiles = activeFiles != null ? List.copyOf(activeFiles) : List.of();
        currentGoals = currentGoals != null ? List.copyOf(currentGoals) : List.of();
        errorStates = errorStates != null ? List.copyOf(errorStates) : List.of();
        buildStatus = buildStatus != null ? buildStatus : BuildStatus.UNKNOWN;
        lastUserIntent = lastUserIntent != null ? lastUserIntent : "";
    }

    /**
     * Renders the context block that heads a compaction summary.
     */
    public String format() {
        List<String> lines = new ArrayList<>();
        lines.add("Active files: " + joinOrNone(activeFiles, ", "));
        lines.add("Goals: " + joinOrNone(currentGoals, "; "));
        lines.add("Build: " + buildStatus.displayName());
        if (!errorStates.isEmpty()) {
            lines.add("Errors: " + String.join("; ", errorStates));
        }
        if (!lastUserIntent.isBlank()) {
            lines.add("Last intent: " + lastUserIntent);
        }
        return String.join("\n", lines);
    }

    private static String joinOrNone(List<String> values, String separator) {
        return values.isEmpty() ? NONE : String.join(separator, values);
    }
}
