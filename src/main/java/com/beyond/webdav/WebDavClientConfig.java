package com.beyond.webdav;

import com.beyond.webdav.util.JsonUtils;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.apache.commons.lang3.StringUtils;

import java.io.File;
import java.io.IOException;


@Data
@NoArgsConstructor
public class WebDavClientConfig {
    private String networkLocation;
    private String basePath = "";
    private Integer port;
    private boolean followRedirects = false;

    private boolean createCollections = false;

    public WebDavClientConfig(String networkLocation, String basePath) {
        this(networkLocation, basePath, null);
    }

    public WebDavClientConfig(String networkLocation, String basePath, Integer port) {
        this.networkLocation = networkLocation;
        this.basePath = basePath;
        this.port = port;
    }

    public static WebDavClientConfig load(File file) throws IOException {
        return JsonUtils.readValue(file, WebDavClientConfig.class);
    }

    public static WebDavClientConfig parse(String json) throws IOException {
        return JsonUtils.readValue(json, WebDavClientConfig.class);
    }

    public WebDavClientConfig copy() {
        WebDavClientConfig copy = new WebDavClientConfig(networkLocation, basePath, port);
        copy.setFollowRedirects(followRedirects);
        copy.setCreateCollections(createCollections);
        return copy;
    }

    public void validate() {
        if (StringUtils.isBlank(networkLocation)) {
            throw new IllegalArgumentException("networkLocation must not be blank");
        }
        if (port != null && (port < 1 || port > 65535)) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        if (basePath == null) {
            basePath = "";
        }
    }
}
