package me.misix.bot.infrastructure.i18n;

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

import java.text.MessageFormat;
import java.util.Locale;
import java.util.Map;
import java.util.MissingResourceException;
import java.util.ResourceBundle;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Localized bot texts: confirmations, command replies, fallbacks.
 *
 * <p>
 * Bundles are loaded from {@code messages_<lang>.properties}, English lives in
 * the base bundle. The JVM default locale is never consulted. Parametric
 * messages use {@link MessageFormat}; callers pass preformatted strings so
 * numbers are not regrouped. A missing key returns the key itself.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class MessageService {

    public static final String LANG_EN = "en";
    public static final String LANG_RU = "ru";

    private static final Set<String> SUPPORTED_LANGUAGES = Set.of(LANG_EN, LANG_RU);

    private final Map<String, ResourceBundle> bundles = new ConcurrentHashMap<>();
    private final String language;

    public MessageService(BotProperties properties) {
        for (String lang : SUPPORTED_LANGUAGES) {
            loadBundle(lang);
        }
        String configured = properties.getLanguage();
        if (configured != null && SUPPORTED_LANGUAGES.contains(configured)) {
            this.language = configured;
        } else {
            log.warn("Unsupported language: {}, using {}", configured, LANG_RU);
            this.language = LANG_RU;
        }
    }

    private void loadBundle(String lang) {
        try {
            Locale locale = Locale.forLanguageTag(lang);
            ResourceBundle bundle = ResourceBundle.getBundle("messages", locale,
                    ResourceBundle.Control.getNoFallbackControl(ResourceBundle.Control.FORMAT_PROPERTIES));
            bundles.put(lang, bundle);
            log.debug("Loaded message bundle for language: {}", lang);
        } catch (MissingResourceException e) {
            log.warn("Failed to load message bundle for language: {}", lang);
        }
    }

    public String getMessage(String key, Object... args) {
        ResourceBundle bundle = bundles.get(language);
        if (bundle == null) {
            log.warn("No message bundle for language: {}", language);
            return key;
        }

        try {
            String message = bundle.getString(key);
            if (args != null && args.length > 0) {
                return MessageFormat.format(message, args);
            }
            return message;
        } catch (MissingResourceException e) {
            log.warn("Missing message key: {} for language: {}", key, language);
            return key;
        }
    }

    public String getLanguage() {
        return language;
    }
}
