package me.golemcore.scheduler.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Identifies potentially destructive tool calls (shell commands, file writes,
 * in-place edits, deletions) and builds human-readable action descriptions for
 * confirmation prompts.
 */
@Component
@Slf4j
public class ToolConfirmationPolicy {

    static final String SHELL = "run_shell_command";
    static final String WRITE_FILE = "write_file";
    static final String REPLACE = "replace";
    static final String DELETE_FILE = "delete_file";

    private static final String UNKNOWN = "unknown";
    private static final String FILE_PATH = "file_path";
    private static final int COMMAND_LENGTH_THRESHOLD = 80;

    /**
     * Check if a tool call is a notable/dangerous action that should be confirmed
     * when no explicit rule covers it.
     */
    public boolean isNotableAction(String toolName, Map<String, Object> args) {
        if (toolName == null) {
            return false;
        }
        return switch (toolName) {
        case SHELL, DELETE_FILE -> true;
        case WRITE_FILE, REPLACE -> args != null && args.get(FILE_PATH) != null;
        default -> false;
        };
    }

    /**
     * Build a human-readable description of the action for the confirmation prompt.
     */
    public String describeAction(String toolName, Map<String, Object> args) {
        if (toolName == null) {
            return UNKNOWN;
        }
        return switch (toolName) {
        case SHELL -> describeShellAction(args);
        case WRITE_FILE -> "Write file: " + stringArg(args, FILE_PATH);
        case REPLACE -> "Edit file: " + stringArg(args, FILE_PATH);
        case DELETE_FILE -> "Delete file: " + stringArg(args, FILE_PATH);
        default -> toolName + ": " + args;
        };
    }

    private String describeShellAction(Map<String, Object> args) {
        String command = stringArg(args, "command");
        if (command.length() > COMMAND_LENGTH_THRESHOLD) {
            command = command.substring(0, COMMAND_LENGTH_THRESHOLD) + "...";
        }
        return "Run command: " + command;
    }

    private static String stringArg(Map<String, Object> args, String name) {
        Object value = args != null ? args.get(name) : null;
        return value != null ? value.toString() : UNKNOWN;
    }
}
