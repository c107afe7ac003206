package com.beyond.webdav.util;


import okhttp3.HttpUrl;
import org.apache.commons.lang3.StringUtils;

import java.io.File;
import java.nio.file.Paths;

public class PathUtils {

    public static final String SEPARATOR = "/";

    private static final String DEFAULT_SCHEME = "http://";

    /**
     * Joins {@code relativePath} onto {@code basePath}. Leading separators of the relative path are stripped first,
     * so it can never override the base path. A trailing separator is kept.
     */
    public static String resolveFullPath(String basePath, String relativePath) {
        String stripped = StringUtils.stripStart(StringUtils.defaultString(relativePath), SEPARATOR);
        String fullPath = concat(StringUtils.defaultString(basePath), stripped);
        if (stripped.endsWith(SEPARATOR) && !fullPath.endsWith(SEPARATOR)) {
            fullPath += SEPARATOR;
        }
        return fullPath;
    }

    public static String concat(String path, String... otherPaths) {
        String result = Paths.get(path, otherPaths).toString();
        return result.replace(File.separatorChar, '/');
    }

    public static HttpUrl buildUrl(String networkLocation, String path, Integer port) {
        if (StringUtils.isBlank(networkLocation)) {
            throw new IllegalArgumentException("network location is blank");
        }
        String location = networkLocation.contains("://") ? networkLocation : DEFAULT_SCHEME + networkLocation;
        HttpUrl base = HttpUrl.parse(location);
        if (base == null) {
            throw new IllegalArgumentException("invalid network location: " + networkLocation);
        }
        HttpUrl.Builder builder = base.newBuilder();
        if (port != null) {
            builder.port(port);
        }
        String segments = StringUtils.stripStart(StringUtils.defaultString(path), SEPARATOR);
        if (!segments.isEmpty()) {
            builder.addPathSegments(segments);
        }
        return builder.build();
    }

    public static String getName(String path) {
        String trimmed = StringUtils.stripEnd(StringUtils.defaultString(path), SEPARATOR);
        return StringUtils.substringAfterLast(SEPARATOR + trimmed, SEPARATOR);
    }

    public static String getRelativePath(File root, File file) {
        String relative = root.toPath().relativize(file.toPath()).toString();
        return relative.replace(File.separatorChar, '/');
    }

    public static String parent(String path) {
        String trimmed = StringUtils.stripEnd(StringUtils.defaultString(path), SEPARATOR);
        if (!trimmed.contains(SEPARATOR)) {
            return "";
        }
        String parent = StringUtils.substringBeforeLast(trimmed, SEPARATOR);
        return parent.isEmpty() ? SEPARATOR : parent;
    }
}
