package com.storylens;

import com.storylens.highlight.HighlightEngine;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Open documents of the host process. Each one is attached to the highlight engine for as
 * long as it is open; nothing here is persisted.
 */
public class DocumentService {

    private final HighlightEngine engine;
    private final Map<String, TextDocument> documents = new ConcurrentHashMap<>();
    private final AppLogger logger = AppLogger.get();

    public DocumentService(HighlightEngine engine) {
        this.engine = engine;
    }

    public TextDocument open(String title, String text) {
        String id = UUID.randomUUID().toString();
        TextDocument document = new TextDocument(id, title != null && !title.isBlank() ? title.trim() : "Untitled", text);
        documents.put(id, document);
        engine.attach(id, document, document);
        log("Opened document " + id + " (" + document.getTitle() + ")");
        return document;
    }

    public TextDocument get(String id) {
        TextDocument document = id != null ? documents.get(id) : null;
        if (document == null) {
            throw new NoSuchElementException("Document not found: " + id);
        }
        return document;
    }

    public List<TextDocument> list() {
        return new ArrayList<>(documents.values());
    }

    public TextDocument updateText(String id, String text, Integer cursor) {
        TextDocument document = get(id);
        document.setText(text);
        if (cursor != null) {
            document.setCursor(cursor);
        }
        return document;
    }

    public TextDocument moveCursor(String id, int cursor) {
        TextDocument document = get(id);
        document.setCursor(cursor);
        return document;
    }

    public void setFocusMode(String id, boolean focus) {
        get(id);
        if (focus) {
            engine.suspend(id);
        } else {
            engine.resume(id);
        }
    }

    public boolean close(String id) {
        TextDocument document = id != null ? documents.remove(id) : null;
        if (document == null) {
            return false;
        }
        engine.detach(id);
        log("Closed document " + id);
        return true;
    }

    public void closeAll() {
        for (String id : new ArrayList<>(documents.keySet())) {
            close(id);
        }
    }

    public HighlightEngine getEngine() {
        return engine;
    }

    private void log(String message) {
        if (logger != null) {
            logger.info("[DocumentService] " + message);
        }
    }
}
