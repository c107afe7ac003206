package com.beyond.webdav.util;

import org.apache.commons.lang3.StringUtils;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

public class HttpDateUtils {

    // weekday name is not checked against the date
    private static final DateTimeFormatter FORMATTER = DateTimeFormatter.ofPattern("dd MMM yyyy HH:mm:ss 'GMT'", Locale.US);

    public static Instant parse(String value) {
        String withoutWeekday = StringUtils.substringAfter(value, ",").trim();
        return LocalDateTime.parse(withoutWeekday, FORMATTER).toInstant(ZoneOffset.UTC);
    }
}
