package com.color.x.utils.basic;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Locale;


@Slf4j
public final class BasicUtility {
    private static final ObjectMapper om = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS, false);

    private BasicUtility() {
        throw new UnsupportedOperationException("Not supported");
    }

    public static String stringifyObject(Object o) {
        try {
            return om.writeValueAsString(o);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed stringifying object", e);
        }
    }

    public static String formatSeconds(Duration duration) {
        return duration != null ? String.format(Locale.ROOT, "%.2fs", duration.toNanos() / 1_000_000_000.0) : "";
    }
}
