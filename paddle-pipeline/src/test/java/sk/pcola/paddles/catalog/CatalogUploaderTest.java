package sk.pcola.paddles.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import sk.pcola.paddles.config.CatalogConfig;
import sk.pcola.paddles.dto.Metadata;
import sk.pcola.paddles.dto.Performance;
import sk.pcola.paddles.dto.ProductRecord;
import sk.pcola.paddles.dto.Shape;
import sk.pcola.paddles.dto.Specs;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CatalogUploaderTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final List<String> bodies = Collections.synchronizedList(new ArrayList<>());

    private HttpServer server;
    private CatalogConfig config;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/api/paddles", exchange -> {
            String body;
            try (InputStream in = exchange.getRequestBody()) {
                body = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
            bodies.add(body);
            int status = body.contains("Existing") ? 409 : body.contains("Broken") ? 500 : 201;
            exchange.sendResponseHeaders(status, -1);
            exchange.close();
        });
        server.start();

        config = new CatalogConfig();
        config.setUrl("http://127.0.0.1:" + server.getAddress().getPort() + "/api/paddles");
        config.setTimeoutSeconds(5);
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private static ProductRecord paddle(String model) {
        Specs specs = new Specs(Shape.HYBRID, "Carbon Fiber", 7.9, 16.0, 16.3, 7.6, 5.3, "Feel-Tec", 4.25);
        return ProductRecord.of(new Metadata("Joola", model, "Pickleball Central"), specs,
                new Performance(8.0, null, 9.0, null, null, null));
    }

    @Test
    void shouldCountCreatedDuplicateAndFailed() {
        CatalogUploader uploader = new CatalogUploader(config, objectMapper);

        CatalogUploader.UploadResult result = uploader.upload(List.of(
                paddle("Perseus"), paddle("Existing Hyperion"), paddle("Broken Scorpeus")));

        assertEquals(1, result.created());
        assertEquals(1, result.duplicate());
        assertEquals(1, result.failed());
        assertEquals(3, result.total());
        assertEquals(3, bodies.size());
    }

    @Test
    void shouldSendRecordWithoutIdAndSource() throws IOException {
        new CatalogUploader(config, objectMapper).uploadOne(paddle("Perseus"));

        JsonNode json = objectMapper.readTree(bodies.get(0));
        assertFalse(json.has("id"));
        assertFalse(json.get("metadata").has("source"));
        assertEquals("Joola", json.get("metadata").get("brand").asText());
        assertEquals("Hybrid", json.get("specs").get("shape").asText());
        assertEquals(4.25, json.get("specs").get("grip_circumference").asDouble(), 0.0001);
        assertEquals(9.0, json.get("performance").get("spin").asDouble(), 0.0001);
    }

    @Test
    void shouldSkipUploadWhenDisabled() {
        config.setEnabled(false);

        CatalogUploader.UploadResult result = new CatalogUploader(config, objectMapper)
                .upload(List.of(paddle("Perseus")));

        assertEquals(0, result.total());
        assertTrue(bodies.isEmpty());
    }

    @Test
    void shouldReportErrorWhenCatalogIsUnreachable() {
        server.stop(0);

        assertEquals(CatalogUploader.UploadStatus.ERROR,
                new CatalogUploader(config, objectMapper).uploadOne(paddle("Perseus")));
    }
}
