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

import lombok.extern.slf4j.Slf4j;
import me.misix.bot.infrastructure.config.BotProperties;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Hot-readable pipeline thresholds.
 *
 * <p>
 * Seeded from {@code bot.pipeline.*} and read on every classification and
 * extraction, so an {@link #update} takes effect on the next update without a
 * restart.
 */
@Service
@Slf4j
public class RuntimeSettings {

    private final AtomicReference<Thresholds> thresholds;

    public RuntimeSettings(BotProperties properties) {
        BotProperties.PipelineProperties pipeline = properties.getPipeline();
        this.thresholds = new AtomicReference<>(
                new Thresholds(pipeline.getRoutingThreshold(), pipeline.getExtractionThreshold()));
    }

    public double getRoutingThreshold() {
        return thresholds.get().routing();
    }

    public double getExtractionThreshold() {
        return thresholds.get().extraction();
    }

    public void update(Thresholds updated) {
        Thresholds previous = thresholds.getAndSet(updated);
        log.info("[Settings] thresholds changed: routing {} -> {}, extraction {} -> {}",
                previous.routing(), updated.routing(), previous.extraction(), updated.extraction());
    }

    public record Thresholds(double routing, double extraction) {

        public Thresholds {
            requireUnitInterval("routing", routing);
            requireUnitInterval("extraction", extraction);
        }

        private static void requireUnitInterval(String name, double value) {
            if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException(name + " threshold must be within [0,1]: " + value);
            }
        }
    }
}
