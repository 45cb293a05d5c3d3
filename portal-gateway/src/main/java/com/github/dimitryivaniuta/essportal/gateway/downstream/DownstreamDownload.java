package com.github.dimitryivaniuta.essportal.gateway.downstream;

import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import reactor.core.publisher.Flux;

/**
 * Streamed binary download with the headers forwarded to the portal caller.
 *
 * @param contentType        downstream content type, {@code application/octet-stream} when absent
 * @param contentDisposition downstream disposition, {@code attachment} when absent
 * @param contentLength      downstream length, -1 when unknown
 * @param body               chunks; cancelling the subscription releases the connection
 */
public record DownstreamDownload(
        String contentType,
        String contentDisposition,
        long contentLength,
        Flux<DataBuffer> body
) {

    static final String DEFAULT_DISPOSITION = "attachment";

    static DownstreamDownload of(final HttpHeaders headers, final Flux<DataBuffer> body) {
        MediaType type = headers.getContentType();
        String disposition = headers.getFirst(HttpHeaders.CONTENT_DISPOSITION);
        return new DownstreamDownload(
                type == null ? MediaType.APPLICATION_OCTET_STREAM_VALUE : type.toString(),
                disposition == null || disposition.isBlank() ? DEFAULT_DISPOSITION : disposition,
                headers.getContentLength(),
                body);
    }

    /** Response to hand back to WebFlux as-is. */
    public ResponseEntity<Flux<DataBuffer>> toResponseEntity() {
        ResponseEntity.BodyBuilder builder = ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(contentType))
                .header(HttpHeaders.CONTENT_DISPOSITION, contentDisposition);
        if (contentLength >= 0) {
            builder.contentLength(contentLength);
        }
        return builder.body(body);
    }
}
