package me.misix.bot.domain.extraction;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class RelativeDateParserTest {

    // 13:00 local time in Moscow
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private final RelativeDateParser parser = new RelativeDateParser(
            Clock.fixed(NOW, ZoneId.of("Europe/Moscow")));

    @Test
    void shouldResolveTomorrowWithTime() {
        assertEquals(Instant.parse("2026-03-02T06:00:00Z"), parser.parse("tomorrow 09:00"));
        assertEquals(Instant.parse("2026-03-02T06:00:00Z"), parser.parse("завтра в 9"));
    }

    @Test
    void shouldKeepCurrentTimeWhenNoneGiven() {
        assertEquals(Instant.parse("2026-03-02T10:00:00Z"), parser.parse("завтра"));
        assertEquals(Instant.parse("2026-03-01T10:00:00Z"), parser.parse("today"));
    }

    @Test
    void shouldResolveDayAfterTomorrowBeforeTomorrow() {
        assertEquals(Instant.parse("2026-03-03T10:00:00Z"), parser.parse("послезавтра"));
    }

    @Test
    void shouldResolveInDaysAndWeeks() {
        assertEquals(Instant.parse("2026-03-04T10:00:00Z"), parser.parse("через 3 дня"));
        assertEquals(Instant.parse("2026-03-06T10:00:00Z"), parser.parse("in 5 days"));
        assertEquals(Instant.parse("2026-03-08T10:00:00Z"), parser.parse("через неделю"));
        assertEquals(Instant.parse("2026-03-08T10:00:00Z"), parser.parse("на следующей неделе"));
    }

    @Test
    void shouldParseAbsoluteDatesInClockZone() {
        assertEquals(Instant.parse("2026-03-10T15:30:00Z"), parser.parse("2026-03-10 18:30"));
        assertEquals(Instant.parse("2026-03-09T21:00:00Z"), parser.parse("2026-03-10"));
        assertEquals(Instant.parse("2026-03-10T12:00:00Z"), parser.parse("2026-03-10T12:00:00Z"));
    }

    @Test
    void shouldReturnNullForUnknownOrEmpty() {
        assertNull(parser.parse(null));
        assertNull(parser.parse(" "));
        assertNull(parser.parse("null"));
        assertNull(parser.parse("когда-нибудь"));
        assertNull(parser.parse("2026-13-45"));
    }

    @Test
    void shouldReturnNullForDayCountOutOfRange() {
        assertNull(parser.parse("через 99999999999 дней"));
        assertNull(parser.parse("in 99999999999 days"));
    }
}
