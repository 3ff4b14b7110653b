package com.chicu.homeprice.common.time;

import org.jetbrains.annotations.Contract;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Единая нормализация времени для журнала предсказаний.
 * Каноническое представление: UTC без зоны ({@link LocalDateTime}).
 * <p>
 * Правила:
 * <ul>
 *     <li>значение со смещением / Z / зоной переводится в UTC;</li>
 *     <li>значение без смещения считается уже UTC;</li>
 *     <li>только дата: полночь UTC;</li>
 *     <li>допускается пробел вместо 'T';</li>
 *     <li>всё остальное невалидно ({@link Optional#empty()}).</li>
 * </ul>
 */
public final class UtcTimestamps {

    private static final List<Function<String, LocalDateTime>> PARSERS = List.of(
            s -> normalize(Instant.parse(s)),
            s -> normalize(OffsetDateTime.parse(s).toInstant()),
            s -> normalize(ZonedDateTime.parse(s).toInstant()),
            LocalDateTime::parse,
            s -> LocalDate.parse(s).atStartOfDay()
    );

    private UtcTimestamps() {
    }

    @Contract(value = "null -> null", pure = true)
    public static LocalDateTime normalize(Instant instant) {
        if (instant == null) return null;
        return LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    public static Optional<LocalDateTime> parse(String raw) {
        if (raw == null) return Optional.empty();
        String s = raw.trim();
        if (s.isEmpty()) return Optional.empty();

        // "2024-05-01 10:00:00+00:00" -> ISO
        if (s.length() > 10 && s.charAt(10) == ' ') {
            s = s.substring(0, 10) + 'T' + s.substring(11);
        }

        for (Function<String, LocalDateTime> parser : PARSERS) {
            Optional<LocalDateTime> parsed = tryParse(parser, s);
            if (parsed.isPresent()) return parsed;
        }
        return Optional.empty();
    }

    public static LocalDateTime nowUtc(Clock clock) {
        return normalize(clock.instant());
    }

    private static Optional<LocalDateTime> tryParse(Function<String, LocalDateTime> parser, String s) {
        try {
            return Optional.of(parser.apply(s));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
