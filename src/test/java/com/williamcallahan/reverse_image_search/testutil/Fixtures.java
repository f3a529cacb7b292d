package com.williamcallahan.reverse_image_search.testutil;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Test fixture loading and canned HTTP responses
 */
public final class Fixtures {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private Fixtures() {
    }

    public static String text(String name) {
        try (InputStream in = Fixtures.class.getResourceAsStream("/fixtures/" + name)) {
            if (in == null) {
                throw new IllegalArgumentException("Missing fixture " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static JsonNode json(String name) {
        return parse(text(name));
    }

    public static JsonNode parse(String json) {
        try {
            return OBJECT_MAPPER.readTree(json);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * WebClient answering every request with the same canned response, recording requests
     */
    public static final class StubHttp {
        private final List<ClientRequest> requests = new CopyOnWriteArrayList<>();
        private final HttpStatus status;
        private final MediaType contentType;
        private final String body;

        public StubHttp(HttpStatus status, MediaType contentType, String body) {
            this.status = status;
            this.contentType = contentType;
            this.body = body;
        }

        public WebClient webClient() {
            return WebClient.builder()
                .exchangeFunction(request -> {
                    requests.add(request);
                    return Mono.just(ClientResponse.create(status)
                        .header(HttpHeaders.CONTENT_TYPE, contentType.toString())
                        .body(body)
                        .build());
                })
                .build();
        }

        public List<ClientRequest> requests() {
            return requests;
        }
    }
}
