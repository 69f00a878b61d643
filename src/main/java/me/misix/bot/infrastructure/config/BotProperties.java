package me.misix.bot.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Centralized configuration properties for the bot, bound from
 * application.yml.
 *
 * <p>
 * All bot configuration is organized under the {@code bot.*} prefix:
 * <ul>
 * <li>{@link TelegramProperties} - bot token and channel switch</li>
 * <li>{@link LlmProperties} - LLM provider settings</li>
 * <li>{@link PipelineProperties} - thresholds, windows and time budgets</li>
 * <li>{@link DeliveryProperties} - webhook and long polling</li>
 * <li>{@link StorageProperties} - local persistence</li>
 * <li>{@link ReminderProperties} - task deadline reminders</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "bot")
@Data
public class BotProperties {

    private String language = "ru";
    private TelegramProperties telegram = new TelegramProperties();
    private LlmProperties llm = new LlmProperties();
    private PipelineProperties pipeline = new PipelineProperties();
    private DeliveryProperties delivery = new DeliveryProperties();
    private RetryProperties retry = new RetryProperties();
    private StorageProperties storage = new StorageProperties();
    private HttpProperties http = new HttpProperties();
    private VoiceProperties voice = new VoiceProperties();
    private ReminderProperties reminders = new ReminderProperties();

    // ==================== TELEGRAM ====================

    @Data
    public static class TelegramProperties {
        private boolean enabled = false;
        private String token;
    }

    // ==================== LLM ====================

    @Data
    public static class LlmProperties {
        private String provider = "langchain4j";
        private Langchain4jProperties langchain4j = new Langchain4jProperties();
    }

    @Data
    public static class Langchain4jProperties {
        /**
         * Model in {@code provider/name} form, e.g. {@code openai/gpt-4o-mini}.
         */
        private String model = "openai/gpt-4o-mini";
        private long timeoutMs = 30000;
        private double temperature = 0.7;
        private int maxTokens = 500;
        private Map<String, ProviderProperties> providers = new HashMap<>();
    }

    @Data
    public static class ProviderProperties {
        private String apiKey;
        private String baseUrl;
    }

    // ==================== PIPELINE ====================

    @Data
    public static class PipelineProperties {
        private double routingThreshold = 0.7;
        private double extractionThreshold = 0.7;
        private int contextWindow = 6;
        private int dedupWindow = 1000;
        private int maxQueuedUpdatesPerUser = 100;
        private int workerThreads = 8;
        private Duration classifierTimeout = Duration.ofSeconds(5);
        private Duration extractionTimeout = Duration.ofSeconds(10);
        private Duration chatTimeout = Duration.ofSeconds(15);
        private Duration persistenceTimeout = Duration.ofSeconds(5);
        private Duration deliveryTimeout = Duration.ofSeconds(10);
        private Duration updateBudget = Duration.ofSeconds(45);
        private int deliveryDegradedAfter = 3;
    }

    // ==================== DELIVERY ====================

    @Data
    public static class DeliveryProperties {
        private WebhookProperties webhook = new WebhookProperties();
        private PollingProperties polling = new PollingProperties();
        private BacklogProperties backlog = new BacklogProperties();
    }

    @Data
    public static class WebhookProperties {
        /**
         * Public HTTPS URL registered with Telegram. Empty means long polling.
         */
        private String url;
        private String path = "/bot/webhook";
        private String secretToken;
        private int maxConnections = 40;
        private int registrationAttempts = 3;
        private Duration registrationRetryDelay = Duration.ofSeconds(2);
        private boolean deregisterOnShutdown = false;
    }

    @Data
    public static class PollingProperties {
        private int timeoutSeconds = 30;
        private int limit = 100;
        private Duration retryDelay = Duration.ofSeconds(5);
        private Duration stopTimeout = Duration.ofSeconds(45);
    }

    @Data
    public static class BacklogProperties {
        private int limit = 100;
        private int timeoutSeconds = 10;
    }

    // ==================== RETRY ====================

    @Data
    public static class RetryProperties {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(500);
        private double multiplier = 2.0;
        private Duration maxBackoff = Duration.ofSeconds(5);
    }

    // ==================== STORAGE ====================

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.misix/workspace";
    }

    // ==================== HTTP ====================

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    // ==================== VOICE ====================

    @Data
    public static class VoiceProperties {
        private boolean enabled = false;
        private String whisperUrl;
        private String apiKey;
        private String model = "whisper-1";
    }

    // ==================== REMINDERS ====================

    @Data
    public static class ReminderProperties {
        private boolean enabled = true;
        private Duration checkInterval = Duration.ofMinutes(1);
        private Duration leadTime = Duration.ofMinutes(60);
        private Duration gracePeriod = Duration.ofMinutes(5);
    }
}
