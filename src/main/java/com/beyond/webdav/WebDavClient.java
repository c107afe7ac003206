package com.beyond.webdav;

import com.beyond.webdav.transport.DavTransport;
import com.beyond.webdav.transport.LoggedDavTransport;
import com.beyond.webdav.transport.OkHttpDavTransport;
import com.beyond.webdav.transport.StreamRequestBody;
import com.beyond.webdav.util.FileUtil;
import com.beyond.webdav.util.HttpDateUtils;
import com.beyond.webdav.util.PathUtils;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.commons.io.IOUtils;
import org.apache.commons.lang3.StringUtils;

import java.io.Closeable;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Client for the WebDAV subset used to manage files on a remote endpoint.
 * <p>
 * Every remote path is resolved against the configured base path, a leading {@code /} never escapes it.
 * Each call issues exactly one request (except {@link #uploadDir}) and checks the status code against
 * {@link WebDavOperation}; unexpected codes raise {@link WebDavException}, except for {@link #delete}.
 * Not thread safe.
 */
@Slf4j
public class WebDavClient implements Closeable {

    private static final String CONTENT_LENGTH = "Content-Length";
    private static final String LAST_MODIFIED = "Last-Modified";

    private final WebDavClientConfig config;

    private final DavTransport transport;

    public WebDavClient(String networkLocation, String basePath) {
        this(new WebDavClientConfig(networkLocation, basePath));
    }

    public WebDavClient(String networkLocation, String basePath, Integer port) {
        this(new WebDavClientConfig(networkLocation, basePath, port));
    }

    public WebDavClient(WebDavClientConfig config) {
        this(config, null);
    }

    WebDavClient(WebDavClientConfig config, DavTransport transport) {
        this.config = config.copy();
        this.config.validate();
        this.transport = transport != null ? transport
                : new LoggedDavTransport(new OkHttpDavTransport(this.config.isFollowRedirects()));
        log.debug("webdav client created: {}", this.config);
    }

    public void mkdir(String remotePath) throws IOException {
        send(WebDavOperation.MKDIR, remotePath, null).close();
    }

    /**
     * Deletes the remote resource. Never fails on the status code: a missing resource, or any other answer,
     * leaves the caller with nothing to do. Transport failures still propagate.
     */
    public void delete(String remotePath) throws IOException {
        WebDavOperation operation = WebDavOperation.DELETE;
        try (Response response = execute(operation, remotePath, null)) {
            switch (operation.classify(response.code())) {
                case EXPECTED:
                    break;
                case NOT_FOUND:
                    log.debug("delete:{} not found, nothing to delete", remotePath);
                    break;
                default:
                    log.debug("delete:{} ignored status {} {}", remotePath, response.code(), response.message());
            }
        }
    }

    public String upload(String localPath, String remotePath) throws IOException {
        return upload(new File(localPath), remotePath);
    }

    public String upload(File localFile, String remotePath) throws IOException {
        try (InputStream inputStream = new FileInputStream(localFile)) {
            send(WebDavOperation.UPLOAD, remotePath, new StreamRequestBody(inputStream, localFile.length())).close();
        }
        return remotePath;
    }

    /**
     * Streams {@code inputStream} to {@code remotePath}. The stream is left open.
     */
    public String upload(InputStream inputStream, String remotePath) throws IOException {
        send(WebDavOperation.UPLOAD, remotePath, new StreamRequestBody(inputStream)).close();
        return remotePath;
    }

    public DavContent download(String remotePath) throws IOException {
        try (Response response = send(WebDavOperation.DOWNLOAD, remotePath, null)) {
            ResponseBody body = response.body();
            byte[] bytes = body == null ? new byte[0] : IOUtils.toByteArray(body.byteStream());
            return new DavContent(PathUtils.getName(remotePath), bytes);
        }
    }

    public boolean exists(String remotePath) throws IOException {
        try (Response response = send(WebDavOperation.EXISTS, remotePath, null)) {
            return response.code() != WebDavOperation.NOT_FOUND_CODE;
        }
    }

    public long size(String remotePath) throws IOException {
        try (Response response = send(WebDavOperation.SIZE, remotePath, null)) {
            String contentLength = response.header(CONTENT_LENGTH);
            return StringUtils.isBlank(contentLength) ? 0 : Long.parseLong(contentLength.trim());
        }
    }

    public Optional<Instant> modifiedTime(String remotePath) throws IOException {
        try (Response response = send(WebDavOperation.MODIFIED_TIME, remotePath, null)) {
            String lastModified = response.header(LAST_MODIFIED);
            if (StringUtils.isBlank(lastModified)) {
                return Optional.empty();
            }
            return Optional.of(HttpDateUtils.parse(lastModified));
        }
    }

    public String url(String remotePath) {
        return buildUrl(remotePath).toString();
    }

    /**
     * Uploads every regular file under {@code localPath} to the same relative location under {@code remotePath},
     * one at a time in top-down walk order. The first failure aborts the walk.
     * <p>
     * Remote collections are only created when {@link WebDavClientConfig#isCreateCollections()} is set; otherwise
     * the server must accept nested PUTs or the caller must have created the tree.
     */
    public void uploadDir(String remotePath, String localPath) throws IOException {
        File localRoot = new File(localPath);
        List<File> files = FileUtil.listFilesTopDown(localRoot);
        Set<String> createdDirs = new HashSet<>();
        log.debug("uploadDir:{} -> {}, {} files", localPath, remotePath, files.size());
        for (File file : files) {
            String relativePath = PathUtils.getRelativePath(localRoot, file);
            String targetPath = PathUtils.resolveFullPath(remotePath, relativePath);
            if (config.isCreateCollections()) {
                mkdirs(remotePath, PathUtils.parent(relativePath), createdDirs);
            }
            upload(file, targetPath);
        }
    }

    private void mkdirs(String remoteRoot, String relativeDir, Set<String> createdDirs) throws IOException {
        String dir = StringUtils.isEmpty(relativeDir) ? remoteRoot : PathUtils.resolveFullPath(remoteRoot, relativeDir);
        if (createdDirs.contains(dir)) {
            return;
        }
        if (StringUtils.isNotEmpty(relativeDir)) {
            mkdirs(remoteRoot, PathUtils.parent(relativeDir), createdDirs);
        }
        log.info("create collection:{}", dir);
        mkdir(dir);
        createdDirs.add(dir);
    }

    public String getFullPath(String relativePath) {
        return PathUtils.resolveFullPath(config.getBasePath(), relativePath);
    }

    Response send(WebDavOperation operation, String remotePath, RequestBody body) throws IOException {
        Response response = execute(operation, remotePath, body);
        if (!operation.isExpected(response.code())) {
            response.close();
            throw new WebDavException(operation.getMethod(), response.code(), response.message());
        }
        return response;
    }

    private Response execute(WebDavOperation operation, String remotePath, RequestBody body) throws IOException {
        return transport.execute(operation.getMethod(), buildUrl(remotePath), body);
    }

    private HttpUrl buildUrl(String remotePath) {
        return PathUtils.buildUrl(config.getNetworkLocation(), getFullPath(remotePath), config.getPort());
    }

    @Override
    public void close() {
        transport.close();
    }
}
