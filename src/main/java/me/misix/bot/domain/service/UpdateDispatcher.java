package me.misix.bot.domain.service;

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
import me.misix.bot.domain.model.PlatformUpdate;
import me.misix.bot.domain.model.UpdateReceivedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Single entry point for updates coming from either delivery mode. Updates
 * without a processable message are acknowledged and dropped here.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UpdateDispatcher {

    private final UserRunCoordinator runCoordinator;

    /**
     * @return {@code true} when the update was queued for processing
     */
    public boolean submit(PlatformUpdate update) {
        if (update == null || !update.hasMessage()) {
            log.debug("[Dispatcher] ignoring update {} without message", update != null ? update.updateId() : null);
            return false;
        }
        runCoordinator.enqueue(update.message());
        return true;
    }

    @EventListener
    public void onUpdateReceived(UpdateReceivedEvent event) {
        submit(event.update());
    }
}
