package com.storylens.controllers;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.storylens.AppLogger;
import com.storylens.DocumentService;
import com.storylens.TextDocument;
import com.storylens.highlight.HighlightEngine;
import com.storylens.highlight.HighlightStats;
import com.storylens.highlight.ReferenceBadge;
import com.storylens.highlight.ResolvedMatch;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Open documents and their live story reference highlights.
 */
public class DocumentController implements Controller {

    private final DocumentService documentService;
    private final ObjectMapper objectMapper;
    private final AppLogger logger;

    public DocumentController(DocumentService documentService, ObjectMapper objectMapper) {
        this.documentService = documentService;
        this.objectMapper = objectMapper;
        this.logger = AppLogger.get();
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.get("/api/documents", this::listDocuments);
        app.post("/api/documents", this::openDocument);
        app.get("/api/documents/{id}", this::getDocument);
        app.put("/api/documents/{id}/text", this::updateText);
        app.put("/api/documents/{id}/cursor", this::moveCursor);
        app.get("/api/documents/{id}/highlights", this::getHighlights);
        app.post("/api/documents/{id}/focus", this::setFocus);
        app.post("/api/documents/{id}/rescan", this::rescan);
        app.delete("/api/documents/{id}", this::closeDocument);
    }

    private void listDocuments(Context ctx) {
        try {
            List<Map<String, Object>> summaries = new ArrayList<>();
            for (TextDocument document : documentService.list()) {
                Map<String, Object> summary = new LinkedHashMap<>();
                summary.put("id", document.getId());
                summary.put("title", document.getTitle());
                summary.put("wordCount", document.getWordCount());
                summaries.add(summary);
            }
            ctx.json(summaries);
        } catch (Exception e) {
            logger.error("Error listing documents: " + e.getMessage());
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void openDocument(Context ctx) {
        try {
            JsonNode json = objectMapper.readTree(ctx.body());
            String title = json.has("title") ? json.get("title").asText() : null;
            String text = json.has("text") ? json.get("text").asText() : "";
            TextDocument document = documentService.open(title, text);
            if (json.has("cursor")) {
                document.setCursor(json.get("cursor").asInt());
            }
            ctx.status(201).json(describe(document));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            ctx.status(400).json(Controller.errorBody(e));
        } catch (Exception e) {
            logger.error("Error opening document: " + e.getMessage());
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void getDocument(Context ctx) {
        try {
            ctx.json(describe(documentService.get(ctx.pathParam("id"))));
        } catch (NoSuchElementException e) {
            ctx.status(404).json(Controller.errorBody(e));
        } catch (Exception e) {
            logger.error("Error getting document: " + e.getMessage());
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void updateText(Context ctx) {
        try {
            JsonNode json = objectMapper.readTree(ctx.body());
            if (!json.has("text")) {
                ctx.status(400).json(Map.of("error", "Text is required"));
                return;
            }
            Integer cursor = json.has("cursor") ? json.get("cursor").asInt() : null;
            TextDocument document = documentService.updateText(ctx.pathParam("id"), json.get("text").asText(), cursor);
            ctx.json(describe(document));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            ctx.status(400).json(Controller.errorBody(e));
        } catch (NoSuchElementException e) {
            ctx.status(404).json(Controller.errorBody(e));
        } catch (Exception e) {
            logger.error("Error updating document text: " + e.getMessage());
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void moveCursor(Context ctx) {
        try {
            JsonNode json = objectMapper.readTree(ctx.body());
            if (!json.has("cursor") || !json.get("cursor").canConvertToInt()) {
                ctx.status(400).json(Map.of("error", "Cursor offset is required"));
                return;
            }
            TextDocument document = documentService.moveCursor(ctx.pathParam("id"), json.get("cursor").asInt());
            ctx.json(Map.of("id", document.getId(), "cursor", document.getCursorOffset()));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            ctx.status(400).json(Controller.errorBody(e));
        } catch (NoSuchElementException e) {
            ctx.status(404).json(Controller.errorBody(e));
        } catch (Exception e) {
            logger.error("Error moving cursor: " + e.getMessage());
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void getHighlights(Context ctx) {
        try {
            String id = ctx.pathParam("id");
            TextDocument document = documentService.get(id);
            HighlightEngine engine = documentService.getEngine();
            List<ResolvedMatch> matches = engine.getActiveMatches(id);

            Map<String, String> tooltips = new LinkedHashMap<>();
            for (ResolvedMatch match : matches) {
                if (!tooltips.containsKey(match.getEntityId())) {
                    String tooltip = engine.describeEntity(match.getEntityId());
                    if (tooltip != null) {
                        tooltips.put(match.getEntityId(), tooltip);
                    }
                }
            }

            HighlightStats stats = engine.getStats(id);
            Map<String, Object> statsBody = new LinkedHashMap<>();
            statsBody.put("scans", stats.getScans());
            statsBody.put("applied", stats.getApplied());
            statsBody.put("discarded", stats.getDiscarded());
            statsBody.put("aborted", stats.getAborted());
            statsBody.put("degraded", stats.getDegraded());
            statsBody.put("failed", stats.getFailed());

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("documentId", id);
            body.put("revision", engine.getRevision(id));
            body.put("state", engine.getSchedulerState(id).name());
            body.put("suspended", engine.isSuspended(id));
            body.put("count", matches.size());
            body.put("badge", ReferenceBadge.label(matches.size()));
            body.put("matches", matches);
            body.put("tooltips", tooltips);
            body.put("marks", document.getMarks());
            body.put("stats", statsBody);
            ctx.json(body);
        } catch (NoSuchElementException e) {
            ctx.status(404).json(Controller.errorBody(e));
        } catch (Exception e) {
            logger.error("Error getting highlights: " + e.getMessage());
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void setFocus(Context ctx) {
        try {
            JsonNode json = objectMapper.readTree(ctx.body());
            if (!json.has("focus") || !json.get("focus").isBoolean()) {
                ctx.status(400).json(Map.of("error", "focus must be true or false"));
                return;
            }
            String id = ctx.pathParam("id");
            boolean focus = json.get("focus").asBoolean();
            documentService.setFocusMode(id, focus);
            ctx.json(Map.of("id", id, "focus", focus));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            ctx.status(400).json(Controller.errorBody(e));
        } catch (NoSuchElementException e) {
            ctx.status(404).json(Controller.errorBody(e));
        } catch (Exception e) {
            logger.error("Error toggling focus mode: " + e.getMessage());
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void rescan(Context ctx) {
        try {
            String id = ctx.pathParam("id");
            documentService.get(id);
            documentService.getEngine().rescanNow(id);
            ctx.status(202).json(Map.of("id", id, "scheduled", true));
        } catch (NoSuchElementException e) {
            ctx.status(404).json(Controller.errorBody(e));
        } catch (Exception e) {
            logger.error("Error scheduling rescan: " + e.getMessage());
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void closeDocument(Context ctx) {
        try {
            String id = ctx.pathParam("id");
            if (documentService.close(id)) {
                ctx.json(Map.of("success", true, "id", id));
            } else {
                ctx.status(404).json(Map.of("error", "Document not found: " + id));
            }
        } catch (Exception e) {
            logger.error("Error closing document: " + e.getMessage());
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private Map<String, Object> describe(TextDocument document) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("id", document.getId());
        body.put("title", document.getTitle());
        body.put("text", document.getText());
        body.put("cursor", document.getCursorOffset());
        body.put("wordCount", document.getWordCount());
        return body;
    }
}
