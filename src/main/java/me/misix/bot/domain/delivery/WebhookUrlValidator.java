package me.misix.bot.domain.delivery;

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

import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Decides whether a webhook URL can be reached by Telegram. Only public
 * {@code https} hosts qualify: loopback, wildcard and placeholder hosts are
 * rejected. No DNS lookups are made.
 */
@Component
public class WebhookUrlValidator {

    private static final Pattern LOOPBACK_V4 = Pattern.compile("127(?:\\.\\d{1,3}){3}");

    public Validation validate(String url) {
        if (url == null || url.isBlank()) {
            return Validation.invalid("no URL configured");
        }
        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException e) {
            return Validation.invalid("malformed URL: " + e.getReason());
        }
        if (!"https".equalsIgnoreCase(uri.getScheme())) {
            return Validation.invalid("scheme must be https");
        }
        String host = uri.getHost();
        if (host == null || host.isBlank()) {
            return Validation.invalid("host is missing");
        }
        host = host.toLowerCase(Locale.ROOT);
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }
        if (isLocal(host)) {
            return Validation.invalid("host " + host + " is not reachable from the internet");
        }
        if ("example.com".equals(host) || host.endsWith(".example.com")) {
            return Validation.invalid("host " + host + " is a placeholder");
        }
        return Validation.VALID;
    }

    private static boolean isLocal(String host) {
        return "localhost".equals(host)
                || host.endsWith(".localhost")
                || "0.0.0.0".equals(host)
                || "::1".equals(host)
                || "0:0:0:0:0:0:0:1".equals(host)
                || LOOPBACK_V4.matcher(host).matches();
    }

    public record Validation(boolean valid, String reason) {

        static final Validation VALID = new Validation(true, null);

        static Validation invalid(String reason) {
            return new Validation(false, reason);
        }
    }
}
