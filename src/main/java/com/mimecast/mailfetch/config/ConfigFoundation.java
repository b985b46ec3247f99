package com.mimecast.mailfetch.config;

import com.google.gson.Gson;
import org.apache.commons.io.FileUtils;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

/**
 * File backed configuration foundation.
 *
 * <p>Reads a JSON5 file through Gson.
 * <br>Gson parses leniently so comments, unquoted keys and single quoted strings are accepted.
 */
public class ConfigFoundation extends BasicConfig {

    /**
     * Constructs a new ConfigFoundation instance.
     */
    public ConfigFoundation() {
        super();
    }

    /**
     * Constructs a new ConfigFoundation instance with given map.
     *
     * @param map Configuration map.
     */
    public ConfigFoundation(Map<String, Object> map) {
        super(map);
    }

    /**
     * Constructs a new ConfigFoundation instance with configuration path.
     *
     * @param path Path to configuration file.
     * @throws IOException Unable to read file.
     */
    public ConfigFoundation(String path) throws IOException {
        super(load(path));
    }

    /**
     * Reads and parses a JSON5 file into a map.
     *
     * @param path Path to configuration file.
     * @return Map of String, Object.
     * @throws IOException Unable to read file.
     */
    @SuppressWarnings("unchecked")
    protected static Map<String, Object> load(String path) throws IOException {
        String content = FileUtils.readFileToString(new File(path), StandardCharsets.UTF_8);
        Map<String, Object> parsed = new Gson().fromJson(content, Map.class);
        return parsed != null ? parsed : new HashMap<>();
    }
}
