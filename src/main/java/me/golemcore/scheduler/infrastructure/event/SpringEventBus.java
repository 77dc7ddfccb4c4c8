package me.golemcore.scheduler.infrastructure.event;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.scheduler.domain.model.SchedulerEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Publishes {@link SchedulerEvent}s through Spring's
 * {@link ApplicationEventPublisher}.
 *
 * <p>
 * Carries confirmation prompts and tool results to the layers that own user
 * interaction. Listeners run synchronously on the publishing thread, so a
 * listener failure surfaces to the publisher, which decides how to degrade.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SpringEventBus {

    private final ApplicationEventPublisher eventPublisher;

    public void publish(SchedulerEvent event) {
        log.debug("[Events] Publishing {} for session {}", event.getClass().getSimpleName(), event.sessionId());
        eventPublisher.publishEvent(event);
    }
}
