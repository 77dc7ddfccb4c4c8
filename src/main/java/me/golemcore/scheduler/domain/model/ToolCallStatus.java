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

/**
 * Lifecycle of a single tool call.
 *
 * <pre>
 * SCHEDULED → VALIDATING → [AWAITING_APPROVAL] → EXECUTING → SUCCESS | ERROR | CANCELLED
 * </pre>
 *
 * Any non-terminal status may also move straight to {@link #ERROR} or
 * {@link #CANCELLED}. Terminal statuses never change.
 */
public enum ToolCallStatus {

    SCHEDULED, VALIDATING, AWAITING_APPROVAL, EXECUTING, SUCCESS, ERROR, CANCELLED;

    public boolean isTerminal() {
        return switch (this) {
        case SUCCESS, ERROR, CANCELLED -> true;
        case SCHEDULED, VALIDATING, AWAITING_APPROVAL, EXECUTING -> false;
        };
    }

    /**
     * Whether a call in this status may move to {@code next}.
     */
    public boolean canTransitionTo(ToolCallStatus next) {
        return switch (this) {
        case SCHEDULED -> next == VALIDATING || next == ERROR || next == CANCELLED;
        case VALIDATING -> next == AWAITING_APPROVAL || next == EXECUTING || next == ERROR || next == CANCELLED;
        case AWAITING_APPROVAL -> next == EXECUTING || next == ERROR || next == CANCELLED;
        case EXECUTING -> next == SUCCESS || next == ERROR || next == CANCELLED;
        case SUCCESS, ERROR, CANCELLED -> false;
        };
    }
}
