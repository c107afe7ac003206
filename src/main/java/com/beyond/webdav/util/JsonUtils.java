package com.beyond.webdav.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.File;
import java.io.IOException;

public class JsonUtils {

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public static <T> T readValue(File file, Class<T> tClass) throws IOException {
        return objectMapper.readValue(file, tClass);
    }

    public static <T> T readValue(String s, Class<T> tClass) throws IOException {
        return objectMapper.readValue(s, tClass);
    }

}
