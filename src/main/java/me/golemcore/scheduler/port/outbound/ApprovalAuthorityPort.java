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

import me.golemcore.scheduler.domain.model.ApprovalDecision;
import me.golemcore.scheduler.domain.model.ApprovalRequest;

import java.util.concurrent.CompletableFuture;

/**
 * Port consulted by the scheduler before a call executes.
 */
public interface ApprovalAuthorityPort {

    /**
     * Decides whether the call may run right away, must be denied, or needs an
     * interactive answer.
     */
    CompletableFuture<ApprovalDecision> decide(ApprovalRequest request);

    /**
     * Asks the user about a call that {@link #decide(ApprovalRequest)} answered
     * with ASK_USER. Completes with ALLOW or DENY. The scheduler cancels the
     * returned future when the batch is cancelled.
     */
    CompletableFuture<ApprovalDecision> requestConfirmation(ApprovalRequest request);
}
