package im.arun.outline.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Loads {@link ConverterConfig} from YAML and applies caller overrides.
 * An explicit file path wins over the classpath resource; both fall back to defaults.
 */
public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);
    static final String DEFAULT_RESOURCE = "outline-converter.yaml";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final ConverterConfig defaultConfig;

    public ConfigLoader() {
        this(null);
    }

    public ConfigLoader(String configPath) {
        this.defaultConfig = loadDefaultConfig(configPath);
    }

    private ConverterConfig loadDefaultConfig(String configPath) {
        try {
            if (configPath != null) {
                Path path = Paths.get(configPath);
                if (Files.exists(path)) {
                    logger.debug("Loading configuration from {}", path);
                    return yamlMapper.readValue(path.toFile(), ConverterConfig.class);
                }
                logger.warn("Config file not found: {}", configPath);
            }

            try (InputStream resourceStream = getClass().getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
                if (resourceStream != null) {
                    return yamlMapper.readValue(resourceStream, ConverterConfig.class);
                }
            }

            logger.warn("No {} found, using default configuration", DEFAULT_RESOURCE);
            return new ConverterConfig();
        } catch (IOException e) {
            logger.warn("Failed to load configuration, using defaults: {}", e.getMessage());
            return new ConverterConfig();
        }
    }

    public ConverterConfig load() {
        return load(null);
    }

    public ConverterConfig load(Map<String, Object> userOptions) {
        ConverterConfig config = copyConfig(defaultConfig);

        if (userOptions == null || userOptions.isEmpty()) {
            return config;
        }

        userOptions.forEach((key, value) -> {
            try {
                switch (key) {
                    case "auto_collapse_depth":
                    case "autoCollapseDepth":
                        config.setAutoCollapseDepth(parseInt(value));
                        break;
                    case "auto_collapse_threshold":
                    case "autoCollapseThreshold":
                        config.setAutoCollapseThreshold(parseInt(value));
                        break;
                    case "max_nesting_depth":
                    case "maxNestingDepth":
                        config.setMaxNestingDepth(parseInt(value));
                        break;
                    case "max_tree_depth":
                    case "maxTreeDepth":
                        config.setMaxTreeDepth(parseInt(value));
                        break;
                    case "max_tables_per_note":
                    case "maxTablesPerNote":
                        config.setMaxTablesPerNote(parseInt(value));
                        break;
                    case "new_node_offset":
                    case "newNodeOffset":
                        config.setNewNodeOffset(Double.parseDouble(String.valueOf(value)));
                        break;
                    case "default_font_size":
                    case "defaultFontSize":
                        config.setDefaultFontSize(parseInt(value));
                        break;
                    case "default_font_weight":
                    case "defaultFontWeight":
                        if (value instanceof String) config.setDefaultFontWeight((String) value);
                        break;
                    default:
                        logger.warn("Unknown configuration key: {}", key);
                }
            } catch (NumberFormatException e) {
                logger.error("Error setting config key {}: {}", key, e.getMessage());
            }
        });

        return config;
    }

    private int parseInt(Object value) {
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return Integer.parseInt(String.valueOf(value).trim());
    }

    private ConverterConfig copyConfig(ConverterConfig source) {
        ConverterConfig copy = new ConverterConfig();
        copy.setAutoCollapseDepth(source.getAutoCollapseDepth());
        copy.setAutoCollapseThreshold(source.getAutoCollapseThreshold());
        copy.setMaxNestingDepth(source.getMaxNestingDepth());
        copy.setMaxTreeDepth(source.getMaxTreeDepth());
        copy.setMaxTablesPerNote(source.getMaxTablesPerNote());
        copy.setNewNodeOffset(source.getNewNodeOffset());
        copy.setDefaultFontSize(source.getDefaultFontSize());
        copy.setDefaultFontWeight(source.getDefaultFontWeight());
        return copy;
    }
}
