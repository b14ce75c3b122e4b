package me.golemcore.agent.domain.service;

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

import me.golemcore.agent.domain.model.ConversationTurn;
import me.golemcore.agent.domain.model.TurnToolCall;
import me.golemcore.agent.domain.model.TurnToolResult;

import java.util.Locale;
import java.util.Set;

/**
 * Tool names and result wording recognized by anchor detection and context
 * extraction. Tool names compare case-insensitively.
 */
final class ToolVocabulary {

    static final Set<String> FILE_MODIFYING_TOOLS = Set.of("edit", "write", "multiedit", "notebookedit",
            "write_file", "edit_file");
    static final Set<String> SEARCH_TOOLS = Set.of("websearch", "webfetch", "web_search", "grep", "glob",
            "search");
    static final Set<String> SHELL_TOOLS = Set.of("bash", "shell");

    /** Parameter keys that hold a file reference, in lookup order. */
    static final String[] FILE_PARAMETER_KEYS = { "file_path", "path", "filePath", "notebook_path" };

    private ToolVocabulary() {
    }

    static boolean isFileModifying(TurnToolCall call) {
        return FILE_MODIFYING_TOOLS.contains(normalize(call.tool()));
    }

    static boolean isSearch(TurnToolCall call) {
        return SEARCH_TOOLS.contains(normalize(call.tool()));
    }

    static boolean isShell(TurnToolCall call) {
        return SHELL_TOOLS.contains(normalize(call.tool()));
    }

    static boolean modifiesFiles(ConversationTurn turn) {
        return turn.toolCalls().stream().anyMatch(ToolVocabulary::isFileModifying);
    }

    /**
     * A successful result whose output mentions tests together with a pass or
     * success term.
     */
    static boolean isTestSuccess(TurnToolResult result) {
        if (!result.success()) {
            return false;
        }
        String output = result.output().toLowerCase(Locale.ROOT);
        return output.contains("test") && (output.contains("pass") || output.contains("success"));
    }

    static boolean hasTestSuccess(ConversationTurn turn) {
        return turn.toolResults().stream().anyMatch(ToolVocabulary::isTestSuccess);
    }

    /**
     * File name referenced by a tool call, without its directories.
     */
    static String fileName(TurnToolCall call) {
        String path = call.stringParameter(FILE_PARAMETER_KEYS);
        if (path == null) {
            return null;
        }
        String trimmed = path.strip();
        int slash = Math.max(trimmed.lastIndexOf('/'), trimmed.lastIndexOf('\\'));
        String name = slash >= 0 ? trimmed.substring(slash + 1) : trimmed;
        return name.isEmpty() ? null : name;
    }

    private static String normalize(String toolName) {
        return toolName == null ? "" : toolName.toLowerCase(Locale.ROOT);
    }
}
