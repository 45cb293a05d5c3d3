package com.github.dimitryivaniuta.essportal.gateway.downstream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.github.dimitryivaniuta.essportal.gateway.tenant.DownstreamCredential;
import io.netty.channel.ChannelOption;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

/**
 * Thin client for the ESS API exposed by each tenant's HR backend.
 *
 * <p>One shared connection pool serves every tenant; the base URL and bearer key are
 * supplied per call from a {@link DownstreamCredential}. Every call is bounded by
 * {@link DownstreamProperties#timeout()} and every failure surfaces as a
 * {@link com.github.dimitryivaniuta.essportal.common.error.GatewayException}.</p>
 */
@Slf4j
@Component
public class HrBackendClient {

    private final DownstreamProperties props;
    private final ObjectMapper objectMapper;
    private final WebClient client;
    private final WebClient downloadClient;

    public HrBackendClient(final WebClient.Builder builder,
                           final DownstreamProperties props,
                           final ObjectMapper objectMapper) {
        this.props = props;
        this.objectMapper = objectMapper;

        HttpClient http = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) props.connectTimeout().toMillis())
                .responseTimeout(props.timeout());

        // Turn error statuses into GatewayException carrying the downstream message
        ExchangeFilterFunction errorFilter = ExchangeFilterFunction.ofResponseProcessor(resp -> {
            if (resp.statusCode().isError()) {
                return resp.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .flatMap(body -> {
                            log.error("HR API error status={} body={}",
                                    resp.statusCode().value(), DownstreamErrors.abbreviate(body));
                            return Mono.error(DownstreamErrors.fromStatus(resp.statusCode().value(), body, objectMapper));
                        });
            }
            return Mono.just(resp);
        });

        this.client = builder
                .clientConnector(new ReactorClientHttpConnector(http))
                .filter(errorFilter)
                .build();
        this.downloadClient = client.mutate()
                .filter(ExchangeFilterFunction.ofResponseProcessor(HrBackendClient::sanitizeContentType))
                .build();
    }

    /**
     * JSON request/response exchange.
     *
     * @param body JSON body or null for none
     * @return parsed response; {@link NullNode} for an empty 2xx body
     */
    public Mono<JsonNode> exchange(final DownstreamCredential credential,
                                   final HttpMethod method,
                                   final String path,
                                   final Object body) {
        return exchange(credential, method, path, Map.of(), body);
    }

    /**
     * JSON exchange with query parameters; values are encoded as URI variables.
     */
    public Mono<JsonNode> exchange(final DownstreamCredential credential,
                                   final HttpMethod method,
                                   final String path,
                                   final Map<String, ?> query,
                                   final Object body) {
        String url = url(credential, path);
        log.info("Calling HR API: {} {} {}", method, url, query.keySet());

        WebClient.RequestBodySpec spec = client.method(method)
                .uri(url, b -> {
                    query.keySet().forEach(name -> b.queryParam(name, "{" + name + "}"));
                    return b.build(query);
                })
                .headers(h -> authorize(h, credential))
                .accept(MediaType.APPLICATION_JSON);
        WebClient.RequestHeadersSpec<?> request = body == null
                ? spec
                : spec.contentType(MediaType.APPLICATION_JSON).bodyValue(body);

        return request.retrieve()
                .bodyToMono(JsonNode.class)
                .defaultIfEmpty(NullNode.getInstance())
                .timeout(props.timeout())
                .doOnSuccess(r -> log.debug("HR API {} {} succeeded", method, url))
                .onErrorMap(e -> DownstreamErrors.translate(e, objectMapper));
    }

    /**
     * Multipart POST with plain form fields and buffered file parts.
     */
    public Mono<JsonNode> postMultipart(final DownstreamCredential credential,
                                        final String path,
                                        final Map<String, String> fields,
                                        final List<UploadPart> files) {
        String url = url(credential, path);
        log.info("Calling HR API: POST {} (multipart, {} file(s))", url, files.size());

        MultipartBodyBuilder parts = new MultipartBodyBuilder();
        fields.forEach(parts::part);
        for (UploadPart file : files) {
            parts.part(file.name(), file.content())
                    .filename(file.filename())
                    .contentType(file.contentType() == null
                            ? MediaType.APPLICATION_OCTET_STREAM
                            : MediaType.parseMediaType(file.contentType()));
        }

        return client.post()
                .uri(url)
                .headers(h -> authorize(h, credential))
                .accept(MediaType.APPLICATION_JSON)
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(parts.build()))
                .retrieve()
                .bodyToMono(JsonNode.class)
                .defaultIfEmpty(NullNode.getInstance())
                .timeout(props.timeout())
                .onErrorMap(e -> DownstreamErrors.translate(e, objectMapper));
    }

    /**
     * Streams a binary resource. Only the headers are awaited here; the body is relayed
     * chunk by chunk as the caller consumes it.
     */
    public Mono<DownstreamDownload> download(final DownstreamCredential credential, final String path) {
        String url = url(credential, path);
        log.info("Calling HR API: GET {} (stream)", url);

        return downloadClient.get()
                .uri(url)
                .headers(h -> authorize(h, credential))
                .retrieve()
                .toEntityFlux(DataBuffer.class)
                .timeout(props.timeout())
                .map(entity -> DownstreamDownload.of(entity.getHeaders(),
                        entity.getBody() == null
                                ? Flux.<DataBuffer>empty()
                                : entity.getBody().onErrorMap(e -> DownstreamErrors.translate(e, objectMapper))))
                .onErrorMap(e -> DownstreamErrors.translate(e, objectMapper));
    }

    private static String url(final DownstreamCredential credential, final String path) {
        String base = credential.baseUrl();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + (path.startsWith("/") ? path : "/" + path);
    }

    /** An unparseable Content-Type on a download is relayed as octet-stream. */
    private static Mono<ClientResponse> sanitizeContentType(final ClientResponse response) {
        String raw = response.headers().asHttpHeaders().getFirst(HttpHeaders.CONTENT_TYPE);
        if (raw == null) {
            return Mono.just(response);
        }
        try {
            MediaType.parseMediaType(raw);
            return Mono.just(response);
        } catch (InvalidMediaTypeException e) {
            log.warn("HR API sent invalid Content-Type '{}'; relaying as {}", raw, MediaType.APPLICATION_OCTET_STREAM);
            return Mono.just(response.mutate()
                    .headers(h -> h.setContentType(MediaType.APPLICATION_OCTET_STREAM))
                    .build());
        }
    }

    private static void authorize(final HttpHeaders headers, final DownstreamCredential credential) {
        headers.setBearerAuth(credential.apiKey());
    }

    /** Path prefix of the ESS API. */
    public String apiPrefix() {
        return props.apiPrefix();
    }
}
