package com.chicu.homeprice.ml.registry;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.function.Predicate;
import java.util.regex.Pattern;

@Component
public class RunIdFactory {

    private static final DateTimeFormatter STAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'").withZone(ZoneOffset.UTC);

    private static final Pattern TAG = Pattern.compile("^[A-Za-z0-9._-]{1,40}$");

    /**
     * Пример:
     * 20260103T123000Z_rf
     * 20260103T123000Z_rf_0002   (второй запуск в ту же секунду)
     * <p>
     * Счётчик фиксированной ширины: лексикографический порядок = хронологический (для одного тега).
     */
    public String build(Instant createdAt, String tag, Predicate<String> taken) {
        String base = STAMP.format(createdAt) + "_" + normTag(tag);
        if (!taken.test(base)) return base;

        for (int n = 2; n < 10_000; n++) {
            String candidate = String.format("%s_%04d", base, n);
            if (!taken.test(candidate)) return candidate;
        }
        throw new IllegalStateException("too many runs for " + base);
    }

    public String normTag(String tag) {
        if (tag == null) throw new IllegalArgumentException("tag=null");
        String t = tag.trim();
        if (!TAG.matcher(t).matches()) {
            throw new IllegalArgumentException("tag must match " + TAG.pattern() + ", got '" + tag + "'");
        }
        return t;
    }
}
