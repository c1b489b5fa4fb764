package com.storylens.storage;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Small helpers for JSON list files. Writes go through a temp file and a move so a crash
 * mid-write never leaves a truncated file behind.
 */
public class JsonStorage {

    private static final ObjectMapper mapper = new ObjectMapper();

    public static <T> List<T> readJsonList(Path path, Class<T[]> clazz) throws IOException {
        if (!Files.exists(path)) {
            return new ArrayList<>();
        }
        T[] items = mapper.readValue(path.toFile(), clazz);
        if (items == null || items.length == 0) {
            return new ArrayList<>();
        }
        return new ArrayList<>(Arrays.asList(items));
    }

    public static void writeJsonList(Path path, List<?> data) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = path.resolveSibling(path.getFileName() + ".tmp");
        mapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), data);
        Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
    }
}
