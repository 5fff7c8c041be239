package com.example.familyfeast.storage;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.io.*;
import java.nio.file.*;

public class SettingsStorage {
    private static final Logger log = LoggerFactory.getLogger(SettingsStorage.class);

    private final ObjectMapper mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    private final Path dir;
    private final Path file;

    public SettingsStorage() { this(Path.of(System.getProperty("user.home"), ".familyfeast")); }

    public SettingsStorage(Path dir) {
        this.dir = dir;
        this.file = dir.resolve("voting-settings.json");
    }

    /** User settings if present and valid, defaults otherwise. */
    public VotingSettings load() {
        if (!Files.exists(file)) return VotingSettings.defaults();
        try {
            return load(file);
        } catch (IOException | IllegalArgumentException ex) {
            log.warn("Ignoring unreadable settings at {}: {}", file, ex.getMessage());
            return VotingSettings.defaults();
        }
    }

    public VotingSettings load(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        }
    }

    public VotingSettings load(InputStream in) throws IOException {
        VotingSettings s;
        try {
            s = mapper.readValue(in, VotingSettings.class);
        } catch (IOException ex) {
            throw new IOException("Failed to parse voting settings JSON. Expect an object of VotingSettings fields.", ex);
        }
        return (s == null ? VotingSettings.defaults() : s).validate();
    }

    public void save(VotingSettings s) throws IOException {
        s.validate();
        if (!Files.exists(dir)) Files.createDirectories(dir);
        try (OutputStream out = Files.newOutputStream(file)) {
            mapper.writeValue(out, s);
        }
        log.debug("Saved voting settings to {}", file);
    }
}
