package me.golemcore.scheduler.port.outbound;

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

import me.golemcore.scheduler.domain.model.ConfirmationRequest;
import me.golemcore.scheduler.domain.model.ToolConfirmationOutcome;

import java.util.concurrent.CompletableFuture;

/**
 * Port for asking the user whether a tool call may run. Used by the approval
 * service when the policy answers "ask".
 */
public interface ConfirmationPort {

    /**
     * Request confirmation from the user.
     *
     * @param request
     *            the call being confirmed
     * @return future that completes with the user's answer;
     *         {@link ToolConfirmationOutcome#CANCEL} on timeout. Cancelling the
     *         future withdraws the prompt.
     */
    CompletableFuture<ToolConfirmationOutcome> requestConfirmation(ConfirmationRequest request);

    /**
     * Check if a confirmation channel is attached.
     */
    boolean isAvailable();
}
