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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.misix.bot.domain.delivery.DeliveryLifecycleManager;
import me.misix.bot.port.outbound.LlmPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spring auto-configuration that initializes and starts the bot on application
 * startup.
 *
 * <p>
 * This configuration:
 * <ul>
 * <li>Provides the shared {@link Clock}, {@link ObjectMapper} and pipeline
 * executor beans</li>
 * <li>Logs startup information (model, provider, storage location)</li>
 * <li>Starts update delivery (webhook or long polling) when Telegram is
 * enabled</li>
 * </ul>
 *
 * <p>
 * Invalid Telegram credentials abort startup.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final BotProperties properties;
    private final LlmPort llmPort;
    private final DeliveryLifecycleManager deliveryLifecycleManager;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean(destroyMethod = "shutdownNow")
    public static ExecutorService pipelineExecutor(BotProperties properties) {
        return Executors.newFixedThreadPool(properties.getPipeline().getWorkerThreads(),
                namedThreadFactory("pipeline-worker-"));
    }

    @PostConstruct
    public void init() {
        log.info("MISIX Bot starting...");
        log.info("LLM Provider: {} (model: {}, available: {})",
                llmPort.getProviderId(), llmPort.getCurrentModel(), llmPort.isAvailable());
        log.info("Storage Path: {}", properties.getStorage().getLocal().getBasePath());

        if (properties.getTelegram().isEnabled()) {
            log.info("Starting channel: telegram");
            deliveryLifecycleManager.start();
        } else {
            log.info("Telegram channel disabled, update delivery not started");
        }

        log.info("MISIX Bot started successfully");
    }

    private static ThreadFactory namedThreadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
