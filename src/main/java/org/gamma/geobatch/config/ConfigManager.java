package org.gamma.geobatch.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

public class ConfigManager {
    private static final Logger APP_LOGGER = Logger.getLogger(ConfigManager.class.getName());
    public static final Path DEFAULT_CONFIG_PATH = Path.of("conf", "config.yaml");

    static {
        System.setProperty("java.util.logging.SimpleFormatter.format", "[%1$tF %1$tT] [%4$-7s] %3$s - %5$s %6$s%n");
        ConsoleHandler handler = new ConsoleHandler();
        handler.setFormatter(new SimpleFormatter());
        handler.setLevel(Level.ALL);
        Logger rootLogger = Logger.getLogger("");
        for (Handler h : rootLogger.getHandlers()) {
            if (h instanceof ConsoleHandler) {
                rootLogger.removeHandler(h);
            }
        }
        rootLogger.addHandler(handler);
        rootLogger.setLevel(Level.INFO);
    }

    private ConfigManager() {
    }

    public static AppConfig getConfig() throws IOException {
        return load(DEFAULT_CONFIG_PATH);
    }

    public static AppConfig load(Path configPath) throws IOException {
        if (!Files.isRegularFile(configPath)) {
            throw new IOException("Config file not found: " + configPath.toAbsolutePath());
        }
        ObjectMapper yamlObjectMapper = new ObjectMapper(new YAMLFactory());
        yamlObjectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        AppConfig appConfig = yamlObjectMapper.readValue(configPath.toFile(), AppConfig.class);
        APP_LOGGER.info("Loaded configuration from: " + configPath.toAbsolutePath());
        return appConfig;
    }
}
