package me.misix.bot.adapter.outbound.telegram;

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
import me.misix.bot.adapter.inbound.telegram.TelegramUpdateMapper;
import me.misix.bot.domain.model.PlatformUpdate;
import me.misix.bot.domain.model.WebhookStatus;
import me.misix.bot.domain.model.exception.TransientNetworkException;
import me.misix.bot.port.outbound.PlatformPort;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.meta.api.methods.GetFile;
import org.telegram.telegrambots.meta.api.methods.GetMe;
import org.telegram.telegrambots.meta.api.methods.updates.DeleteWebhook;
import org.telegram.telegrambots.meta.api.methods.updates.GetUpdates;
import org.telegram.telegrambots.meta.api.methods.updates.GetWebhookInfo;
import org.telegram.telegrambots.meta.api.methods.updates.SetWebhook;
import org.telegram.telegrambots.meta.api.objects.File;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.User;
import org.telegram.telegrambots.meta.api.objects.WebhookInfo;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.generics.TelegramClient;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * {@link PlatformPort} over the Telegram Bot API.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TelegramPlatformAdapter implements PlatformPort {

    private final TelegramClient telegramClient;
    private final TelegramUpdateMapper updateMapper;

    @Override
    public String verifyCredentials() {
        try {
            User me = telegramClient.execute(new GetMe());
            return me.getUserName();
        } catch (TelegramApiException e) {
            throw TelegramApiErrors.translate("getMe", e);
        }
    }

    @Override
    public List<PlatformUpdate> getUpdates(long offset, int limit, int timeoutSeconds) {
        GetUpdates request = GetUpdates.builder()
                .offset((int) offset)
                .limit(limit)
                .timeout(timeoutSeconds)
                .build();
        try {
            List<Update> updates = telegramClient.execute(request);
            if (updates == null || updates.isEmpty()) {
                return List.of();
            }
            log.debug("[Telegram] getUpdates(offset={}) returned {} update(s)", offset, updates.size());
            return updates.stream().map(updateMapper::map).toList();
        } catch (TelegramApiException e) {
            throw TelegramApiErrors.translate("getUpdates", e);
        }
    }

    @Override
    public void setWebhook(String url, String secretToken, int maxConnections) {
        SetWebhook request = SetWebhook.builder()
                .url(url)
                .secretToken(secretToken)
                .maxConnections(maxConnections)
                .build();
        try {
            Boolean accepted = telegramClient.execute(request);
            if (!Boolean.TRUE.equals(accepted)) {
                throw new TransientNetworkException("setWebhook was not accepted");
            }
        } catch (TelegramApiException e) {
            throw TelegramApiErrors.translate("setWebhook", e);
        }
    }

    @Override
    public void deleteWebhook(boolean dropPendingUpdates) {
        try {
            telegramClient.execute(DeleteWebhook.builder().dropPendingUpdates(dropPendingUpdates).build());
        } catch (TelegramApiException e) {
            throw TelegramApiErrors.translate("deleteWebhook", e);
        }
    }

    @Override
    public WebhookStatus getWebhookInfo() {
        try {
            WebhookInfo info = telegramClient.execute(new GetWebhookInfo());
            return new WebhookStatus(info.getUrl(),
                    info.getPendingUpdatesCount() != null ? info.getPendingUpdatesCount() : 0,
                    info.getLastErrorMessage());
        } catch (TelegramApiException e) {
            throw TelegramApiErrors.translate("getWebhookInfo", e);
        }
    }

    @Override
    public byte[] downloadFile(String fileId) {
        try {
            File file = telegramClient.execute(new GetFile(fileId));
            try (InputStream stream = telegramClient.downloadFileAsStream(file)) {
                return stream.readAllBytes();
            }
        } catch (TelegramApiException e) {
            throw TelegramApiErrors.translate("getFile", e);
        } catch (IOException e) {
            throw new TransientNetworkException("Failed to download file " + fileId, e);
        }
    }
}
