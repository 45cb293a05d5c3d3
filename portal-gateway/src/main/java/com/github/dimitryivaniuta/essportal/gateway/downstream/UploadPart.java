package com.github.dimitryivaniuta.essportal.gateway.downstream;

/**
 * One file part of an outbound multipart request, fully buffered.
 */
public record UploadPart(String name, String filename, String contentType, byte[] content) {

    @Override
    public String toString() {
        return "UploadPart[name=" + name + ", filename=" + filename + ", contentType=" + contentType
                + ", size=" + (content == null ? 0 : content.length) + "]";
    }
}
