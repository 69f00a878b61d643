package me.misix.bot.domain.extraction;

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
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves deadline expressions produced by the task extractor: relative
 * phrases in Russian or English ("завтра", "через 3 дня", "next week") with an
 * optional time, or absolute ISO-like timestamps.
 *
 * <p>
 * Relative phrases without a time keep the current time of day. All
 * arithmetic happens in the zone of the injected {@link Clock}.
 */
@Component
@RequiredArgsConstructor
public class RelativeDateParser {

    private static final Pattern IN_DAYS_RU = Pattern.compile("через\\s+(\\d+)\\s+(?:день|дня|дней)");
    private static final Pattern IN_DAYS_EN = Pattern.compile("in\\s+(\\d+)\\s+days?");
    private static final Pattern TIME_OF_DAY = Pattern.compile("(?<![\\d-])(\\d{1,2}):(\\d{2})(?!\\d)");
    private static final Pattern AT_HOUR_RU = Pattern.compile("(?:^|\\s)в\\s+(\\d{1,2})(?:\\s|$)");

    private static final Pattern LOCAL_DATE = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");
    private static final Pattern LOCAL_DATE_TIME = Pattern.compile("\\d{4}-\\d{2}-\\d{2}[ T]\\d{2}:\\d{2}(:\\d{2}(\\.\\d+)?)?");

    private final Clock clock;

    /**
     * @return the resolved instant, or {@code null} when the expression is blank,
     *         {@code "null"}, not understood or out of range
     */
    public Instant parse(String expression) {
        if (expression == null || expression.isBlank() || "null".equalsIgnoreCase(expression.trim())) {
            return null;
        }
        String normalized = expression.trim().toLowerCase(Locale.ROOT);
        ZoneId zone = clock.getZone();
        ZonedDateTime now = ZonedDateTime.now(clock);

        try {
            Integer days = relativeDays(normalized);
            if (days != null) {
                ZonedDateTime target = now.plusDays(days);
                LocalTime time = timeOfDay(normalized);
                if (time != null) {
                    target = target.with(time);
                }
                return target.toInstant();
            }
        } catch (NumberFormatException | DateTimeException e) {
            // day count beyond int or the supported date range
            return null;
        }

        return parseAbsolute(expression.trim(), zone);
    }

    private Integer relativeDays(String text) {
        if (text.contains("послезавтра") || text.contains("day after tomorrow")) {
            return 2;
        }
        if (text.contains("завтра") || text.contains("tomorrow")) {
            return 1;
        }
        if (text.contains("сегодня") || text.contains("today")) {
            return 0;
        }
        Matcher ruDays = IN_DAYS_RU.matcher(text);
        if (ruDays.find()) {
            return Integer.parseInt(ruDays.group(1));
        }
        Matcher enDays = IN_DAYS_EN.matcher(text);
        if (enDays.find()) {
            return Integer.parseInt(enDays.group(1));
        }
        if (text.contains("через неделю") || text.contains("next week")
                || (text.contains("следующ") && text.contains("недел"))) {
            return 7;
        }
        return null;
    }

    private LocalTime timeOfDay(String text) {
        Matcher hhmm = TIME_OF_DAY.matcher(text);
        if (hhmm.find()) {
            return safeTime(Integer.parseInt(hhmm.group(1)), Integer.parseInt(hhmm.group(2)));
        }
        Matcher atHour = AT_HOUR_RU.matcher(text);
        if (atHour.find()) {
            return safeTime(Integer.parseInt(atHour.group(1)), 0);
        }
        return null;
    }

    private static LocalTime safeTime(int hour, int minute) {
        if (hour > 23 || minute > 59) {
            return null;
        }
        return LocalTime.of(hour, minute);
    }

    private static Instant parseAbsolute(String text, ZoneId zone) {
        try {
            if (LOCAL_DATE.matcher(text).matches()) {
                return LocalDate.parse(text).atStartOfDay(zone).toInstant();
            }
            if (LOCAL_DATE_TIME.matcher(text).matches()) {
                return LocalDateTime.parse(text.replace(' ', 'T')).atZone(zone).toInstant();
            }
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
