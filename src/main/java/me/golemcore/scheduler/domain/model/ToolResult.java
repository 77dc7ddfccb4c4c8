package me.golemcore.scheduler.domain.model;

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
import lombok.Data;

import java.util.Map;

/**
 * Payload produced by a tool capability.
 *
 * <p>
 * {@code output} is the text shown to the model. A failed result carries an
 * {@code error} and may still carry the output captured before the failure
 * (a shell command's stderr, for instance). {@code data} holds structured
 * details for the UI, never sent to the model.
 */
@Data
@Builder
public class ToolResult {

    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    private boolean success;
    private String output;
    @Builder.Default
    private Map<String, Object> data = Map.of();
    private String error;
    private boolean truncated;

    public static ToolResult success(String output) {
        return success(output, Map.of());
    }

    public static ToolResult success(String output, Map<String, Object> data) {
        return ToolResult.builder()
                .success(true)
                .output(output)
                .data(data)
                .build();
    }

    public static ToolResult failure(String error) {
        return ToolResult.builder()
                .success(false)
                .error(error)
                .build();
    }

    /**
     * Failure that keeps the output the tool produced before failing.
     */
    public static ToolResult failure(String error, String output, Map<String, Object> data) {
        return ToolResult.builder()
                .success(false)
                .error(error)
                .output(output)
                .data(data)
                .build();
    }

    /**
     * Copy with its output replaced by a shortened version.
     */
    public ToolResult withTruncatedOutput(String shortened) {
        return ToolResult.builder()
                .success(success)
                .output(shortened)
                .data(data)
                .error(error)
                .truncated(true)
                .build();
    }
}
