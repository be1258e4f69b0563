package com.example.craftcalc.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.io.*;
import java.nio.file.*;

public class SettingsStorage {
    private static final Logger LOG = LoggerFactory.getLogger(SettingsStorage.class);

    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private final Path dir;
    private final Path file;

    public SettingsStorage() { this(Path.of(System.getProperty("user.home"), ".crafting-calculator")); }

    public SettingsStorage(Path dir) {
        this.dir = dir;
        this.file = dir.resolve("settings.json");
    }

    public Settings load() {
        if (!Files.exists(file)) return new Settings();
        try (InputStream in = Files.newInputStream(file)) {
            Settings s = mapper.readValue(in, Settings.class);
            return s == null ? new Settings() : s;
        } catch (IOException ex) {
            LOG.warn("Ignoring unreadable settings file {}: {}", file, ex.getMessage());
            return new Settings();
        }
    }

    public void save(Settings s) throws IOException {
        if (!Files.exists(dir)) Files.createDirectories(dir);
        try (OutputStream out = Files.newOutputStream(file)) {
            mapper.writeValue(out, s);
        }
    }
}
