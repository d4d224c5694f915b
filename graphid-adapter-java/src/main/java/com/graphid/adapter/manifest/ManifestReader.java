package com.graphid.adapter.manifest;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

public class ManifestReader {

    private static final Gson GSON = new Gson();

    /**
     * Reads and deserializes manifest.json from the given path.
     *
     * @throws ManifestReadException if the file is missing or malformed
     */
    public ManifestConfig read(Path manifestPath) {
        if (!Files.exists(manifestPath)) {
            throw new ManifestReadException("Manifest file not found: " + manifestPath);
        }
        try (Reader reader = Files.newBufferedReader(manifestPath, StandardCharsets.UTF_8)) {
            ManifestConfig config = GSON.fromJson(reader, ManifestConfig.class);
            if (config == null) {
                throw new ManifestReadException("Manifest file is empty or invalid JSON: " + manifestPath);
            }
            return config;
        } catch (JsonParseException e) {
            throw new ManifestReadException("Manifest file is not valid JSON: " + manifestPath, e);
        } catch (NoSuchFileException e) {
            throw new ManifestReadException("Manifest file not found: " + manifestPath, e);
        } catch (IOException e) {
            throw new ManifestReadException("Failed to read manifest: " + manifestPath + " (" + e.getMessage() + ")", e);
        }
    }

    public static class ManifestReadException extends RuntimeException {
        public ManifestReadException(String message) { super(message); }
        public ManifestReadException(String message, Throwable cause) { super(message, cause); }
    }
}
