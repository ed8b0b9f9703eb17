package com.proofly.backend.services.normalization;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDateTime;

import org.junit.jupiter.api.Test;

class DateParserTest {

    @Test
    void parse_isoAndSlashFormats() {
        assertThat(DateParser.parse("2024-01-15")).contains(LocalDateTime.of(2024, 1, 15, 0, 0));
        assertThat(DateParser.parse("2024-01-15 13:45:00")).contains(LocalDateTime.of(2024, 1, 15, 13, 45));
        assertThat(DateParser.parse("2024-01-15T08:00:00")).contains(LocalDateTime.of(2024, 1, 15, 8, 0));
        assertThat(DateParser.parse("15-Jan-2024")).contains(LocalDateTime.of(2024, 1, 15, 0, 0));
    }

    @Test
    void parse_ambiguousSlashDate_isMonthFirst() {
        assertThat(DateParser.parse("03/04/2024")).contains(LocalDateTime.of(2024, 3, 4, 0, 0));
    }

    @Test
    void parse_fallsBackToDayFirst_whenMonthIsOutOfRange() {
        assertThat(DateParser.parse("25/12/2024")).contains(LocalDateTime.of(2024, 12, 25, 0, 0));
    }

    @Test
    void parse_rejectsGarbageAndImpossibleDates() {
        assertThat(DateParser.parse("yesterday")).isEmpty();
        assertThat(DateParser.parse("2024-02-30")).isEmpty();
        assertThat(DateParser.parse(null)).isEmpty();
    }
}
