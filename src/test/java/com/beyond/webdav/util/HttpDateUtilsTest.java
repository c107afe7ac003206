package com.beyond.webdav.util;

import org.junit.Test;

import java.time.Instant;
import java.time.format.DateTimeParseException;

import static org.junit.Assert.assertEquals;

public class HttpDateUtilsTest {

    @Test
    public void parse() {
        assertEquals(Instant.parse("1994-11-15T08:12:31Z"), HttpDateUtils.parse("Tue, 15 Nov 1994 08:12:31 GMT"));
    }

    @Test
    public void parseIgnoresWeekday() {
        assertEquals(Instant.parse("1994-11-15T08:12:31Z"), HttpDateUtils.parse("Mon, 15 Nov 1994 08:12:31 GMT"));
    }

    @Test(expected = DateTimeParseException.class)
    public void parseRejectsOtherFormats() {
        HttpDateUtils.parse("1994-11-15T08:12:31Z");
    }
}
