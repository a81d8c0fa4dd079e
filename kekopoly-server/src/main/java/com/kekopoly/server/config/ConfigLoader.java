package com.kekopoly.server.config;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Builds a {@link ServerConfig} in layers: built-in defaults, the
 * {@code kekopoly.json} classpath resource, an optional external file
 * ({@code -Dkekopoly.config} or {@code KEKOPOLY_CONFIG}), environment
 * variables, and finally the port given as the first CLI argument.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    static final String RESOURCE = "kekopoly.json";

    private final ObjectMapper objectMapper;
    private final Map<String, String> env;

    public ConfigLoader() {
        this(System.getenv());
    }

    public ConfigLoader(Map<String, String> env) {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.setDefaultMergeable(Boolean.TRUE);
        this.env = env;
    }

    public ServerConfig load(String[] args) throws IOException {
        ServerConfig config = new ServerConfig();

        try (InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                objectMapper.readerForUpdating(config).readValue(in);
            } else {
                log.warn("[CONFIG] {} not on classpath, using defaults", RESOURCE);
            }
        }

        String external = System.getProperty("kekopoly.config", env.get("KEKOPOLY_CONFIG"));
        if (external != null && !external.isBlank()) {
            File file = new File(external);
            if (!file.isFile()) {
                throw new IOException("Config file not found: " + external);
            }
            objectMapper.readerForUpdating(config).readValue(file);
            log.info("[CONFIG] loaded overrides from {}", file.getAbsolutePath());
        }

        applyEnv(config);

        if (args != null && args.length > 0) {
            config.getServer().setPort(parsePort(args[0], "argument"));
        }
        return config;
    }

    private void applyEnv(ServerConfig config) {
        String port = env.get("KEKOPOLY_PORT");
        if (port != null) config.getServer().setPort(parsePort(port, "KEKOPOLY_PORT"));

        String redisHost = env.get("KEKOPOLY_REDIS_HOST");
        if (redisHost != null) config.getRedis().setHost(redisHost);

        String redisPort = env.get("KEKOPOLY_REDIS_PORT");
        if (redisPort != null) config.getRedis().setPort(parsePort(redisPort, "KEKOPOLY_REDIS_PORT"));

        String redisEnabled = env.get("KEKOPOLY_REDIS_ENABLED");
        if (redisEnabled != null) config.getRedis().setEnabled(Boolean.parseBoolean(redisEnabled));
    }

    private static int parsePort(String value, String source) {
        try {
            int port = Integer.parseInt(value.trim());
            if (port < 1 || port > 65535) {
                throw new IllegalArgumentException("Port out of range from " + source + ": " + value);
            }
            return port;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port from " + source + ": " + value, e);
        }
    }
}
