package com.storylens.controllers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.storylens.DocumentService;
import com.storylens.EntityCatalogStore;
import com.storylens.highlight.HighlightEngine;
import com.storylens.models.HighlightConfig;
import io.javalin.Javalin;
import io.javalin.json.JavalinJackson;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class DocumentControllerTest {

    @TempDir
    Path dataDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final HttpClient client = HttpClient.newHttpClient();
    private HighlightEngine engine;
    private Javalin app;

    @BeforeEach
    void setUp() {
        EntityCatalogStore catalog = new EntityCatalogStore(dataDir);
        engine = new HighlightEngine(catalog, HighlightConfig.defaults());
        DocumentService documents = new DocumentService(engine);
        app = Javalin.create(cfg -> cfg.jsonMapper(new JavalinJackson(objectMapper)));
        new DocumentController(documents, objectMapper).registerRoutes(app);
        new EntityController(catalog, objectMapper).registerRoutes(app);
        app.start(0);
    }

    @AfterEach
    void tearDown() {
        app.stop();
        engine.close();
    }

    private HttpResponse<String> send(String method, String path, String body) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://localhost:" + app.port() + path))
            .header("Content-Type", "application/json")
            .method(method, HttpRequest.BodyPublishers.ofString(body))
            .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void malformedJsonIsBadRequest() throws Exception {
        HttpResponse<String> opened = send("POST", "/api/documents", "{\"title\": \"Draft\", \"text\": \"Aria waits.\"}");
        assertEquals(201, opened.statusCode());
        String id = objectMapper.readTree(opened.body()).get("id").asText();

        assertEquals(400, send("POST", "/api/documents", "{not json").statusCode());
        assertEquals(400, send("PUT", "/api/documents/" + id + "/text", "{\"text\": ").statusCode());
        assertEquals(400, send("PUT", "/api/documents/" + id + "/cursor", "[1,").statusCode());
        assertEquals(400, send("POST", "/api/documents/" + id + "/focus", "focus").statusCode());
        assertEquals(400, send("POST", "/api/entities", "{\"displayName\": ").statusCode());

        HttpResponse<String> rejected = send("PUT", "/api/documents/" + id + "/text", "{oops}");
        JsonNode error = objectMapper.readTree(rejected.body());
        assertTrue(error.has("error"));
    }

    @Test
    void missingDocumentIsNotFound() throws Exception {
        assertEquals(404, send("PUT", "/api/documents/missing/text", "{\"text\": \"Aria\"}").statusCode());
        assertEquals(404, send("PUT", "/api/documents/missing/cursor", "{\"cursor\": 1}").statusCode());
    }
}
