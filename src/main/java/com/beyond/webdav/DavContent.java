package com.beyond.webdav;

import lombok.Getter;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.Charset;

/**
 * A downloaded resource held in memory.
 */
public class DavContent {

    @Getter
    private final String name;

    private final byte[] content;

    public DavContent(String name, byte[] content) {
        this.name = name;
        this.content = content;
    }

    public byte[] getContent() {
        return content.clone();
    }

    public long size() {
        return content.length;
    }

    public InputStream openStream() {
        return new ByteArrayInputStream(content);
    }

    public String asString(Charset charset) {
        return new String(content, charset);
    }

    @Override
    public String toString() {
        return "DavContent{name='" + name + "', size=" + content.length + "}";
    }
}
