package com.beyond.webdav;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

public enum WebDavOperation {
    MKDIR("MKCOL", 201, 301, 405),
    DELETE("DELETE", 204),
    UPLOAD("PUT", 200, 201, 204),
    DOWNLOAD("GET", 200),
    EXISTS("HEAD", 200, 301, 404),
    SIZE("HEAD", 200, 301),
    MODIFIED_TIME("HEAD", 200, 301, 404);

    public static final int NOT_FOUND_CODE = 404;

    private final String method;
    private final Set<Integer> expectedCodes;

    WebDavOperation(String method, Integer... expectedCodes) {
        this.method = method;
        this.expectedCodes = Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(expectedCodes)));
    }

    public String getMethod() {
        return method;
    }

    public Set<Integer> getExpectedCodes() {
        return expectedCodes;
    }

    public boolean isExpected(int statusCode) {
        return expectedCodes.contains(statusCode);
    }

    public Outcome classify(int statusCode) {
        if (statusCode == NOT_FOUND_CODE) {
            return Outcome.NOT_FOUND;
        }
        return isExpected(statusCode) ? Outcome.EXPECTED : Outcome.UNEXPECTED;
    }

    /**
     * NOT_FOUND is reported as such even where 404 is in the expected set, callers decide what it means.
     */
    public enum Outcome {
        EXPECTED, NOT_FOUND, UNEXPECTED
    }
}
