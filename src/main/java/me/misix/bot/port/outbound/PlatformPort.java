package me.misix.bot.port.outbound;

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

import me.misix.bot.domain.model.PlatformUpdate;
import me.misix.bot.domain.model.WebhookStatus;

import java.util.List;

/**
 * Chat platform API used by the delivery lifecycle. All calls block and are
 * meant for the lifecycle manager and poll loop threads.
 *
 * <p>
 * Errors are reported as
 * {@link me.misix.bot.domain.model.exception.PlatformAuthException} (bad
 * token), {@link me.misix.bot.domain.model.exception.ModeConflictException}
 * (another consumer or a webhook is active) or
 * {@link me.misix.bot.domain.model.exception.TransientNetworkException}.
 */
public interface PlatformPort {

    /**
     * Checks the bot credentials.
     *
     * @return bot username
     */
    String verifyCredentials();

    List<PlatformUpdate> getUpdates(long offset, int limit, int timeoutSeconds);

    void setWebhook(String url, String secretToken, int maxConnections);

    void deleteWebhook(boolean dropPendingUpdates);

    WebhookStatus getWebhookInfo();

    byte[] downloadFile(String fileId);
}
