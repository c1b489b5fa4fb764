package com.storylens.controllers;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.storylens.AppLogger;
import com.storylens.EntityCatalogStore;
import com.storylens.models.Entity;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Story Bible entries: CRUD plus search.
 */
public class EntityController implements Controller {

    private final EntityCatalogStore catalogStore;
    private final ObjectMapper objectMapper;
    private final AppLogger logger;

    public EntityController(EntityCatalogStore catalogStore, ObjectMapper objectMapper) {
        this.catalogStore = catalogStore;
        this.objectMapper = objectMapper;
        this.logger = AppLogger.get();
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.get("/api/entities", this::getEntities);
        app.get("/api/entities/search", this::searchEntities);
        app.get("/api/entities/{id}", this::getEntity);
        app.post("/api/entities", this::createEntity);
        app.put("/api/entities/{id}", this::updateEntity);
        app.delete("/api/entities/{id}", this::deleteEntity);
    }

    private void getEntities(Context ctx) {
        try {
            ctx.json(catalogStore.getEntities());
        } catch (Exception e) {
            logger.error("Error listing entities: " + e.getMessage());
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void searchEntities(Context ctx) {
        try {
            ctx.json(catalogStore.search(ctx.queryParam("q")));
        } catch (Exception e) {
            logger.error("Error searching entities: " + e.getMessage());
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void getEntity(Context ctx) {
        try {
            ctx.json(catalogStore.get(ctx.pathParam("id")));
        } catch (NoSuchElementException e) {
            ctx.status(404).json(Controller.errorBody(e));
        } catch (Exception e) {
            logger.error("Error getting entity: " + e.getMessage());
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void createEntity(Context ctx) {
        try {
            Entity draft = objectMapper.readValue(ctx.body(), Entity.class);
            Entity created = catalogStore.create(draft);
            ctx.status(201).json(created);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            ctx.status(400).json(Controller.errorBody(e));
        } catch (Exception e) {
            logger.error("Error creating entity: " + e.getMessage());
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void updateEntity(Context ctx) {
        try {
            Entity changes = objectMapper.readValue(ctx.body(), Entity.class);
            ctx.json(catalogStore.update(ctx.pathParam("id"), changes));
        } catch (NoSuchElementException e) {
            ctx.status(404).json(Controller.errorBody(e));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            ctx.status(400).json(Controller.errorBody(e));
        } catch (Exception e) {
            logger.error("Error updating entity: " + e.getMessage());
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void deleteEntity(Context ctx) {
        try {
            String id = ctx.pathParam("id");
            if (catalogStore.delete(id)) {
                ctx.json(Map.of("success", true, "id", id));
            } else {
                ctx.status(404).json(Map.of("error", "Entity not found: " + id));
            }
        } catch (Exception e) {
            logger.error("Error deleting entity: " + e.getMessage());
            ctx.status(500).json(Controller.errorBody(e));
        }
    }
}
