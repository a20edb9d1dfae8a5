package de.mirkosertic.jsonschema.config;

import de.mirkosertic.jsonschema.ReflectContext;
import de.mirkosertic.jsonschema.ReflectOption;
import de.mirkosertic.jsonschema.ReflectOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Default options of a {@link de.mirkosertic.jsonschema.Reflector}, loaded from YAML files and the
 * environment.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. System properties
 * 2. Environment variables
 * 3. User config file (~/.jsonschema/reflector.yaml, or the path passed to {@link #load(Path)})
 * 4. Defaults (jsonschema-defaults.yaml in classpath)
 */
public class ReflectorConfig {

    private static final Logger logger = LoggerFactory.getLogger(ReflectorConfig.class);

    static final String ENV_DEFINITIONS_PREFIX = "JSONSCHEMA_DEFINITIONS_PREFIX";
    static final String ENV_PROPERTY_NAME_TAG = "JSONSCHEMA_PROPERTY_NAME_TAG";
    static final String PROP_DEFINITIONS_PREFIX = "jsonschema.definitions.prefix";
    static final String PROP_PROPERTY_NAME_TAG = "jsonschema.property.name.tag";
    private static final String CONFIG_DIR = ".jsonschema";
    private static final String USER_CONFIG_FILE = "reflector.yaml";
    private static final String DEFAULT_CONFIG_FILE = "jsonschema-defaults.yaml";

    // Naming
    private String definitionsPrefix = ReflectContext.DEFAULT_DEFINITIONS_PREFIX;
    private String propertyNameTag = "json";
    private List<String> additionalNameTags = new ArrayList<>();
    private List<String> stripDefinitionNamePrefixes = new ArrayList<>();

    // Structure
    private boolean inlineRefs = false;
    private boolean rootRef = false;
    private boolean rootNullable = false;
    private boolean envelopNullability = false;

    // Properties
    private boolean requireNameTags = false;
    private boolean skipUnsupportedProperties = false;
    private boolean skipNonConstraints = false;

    private ReflectorConfig() {
    }

    /**
     * Configuration without any file or environment source.
     */
    public static ReflectorConfig defaults() {
        return new ReflectorConfig();
    }

    /**
     * Load configuration from all sources with proper priority.
     */
    public static ReflectorConfig load() {
        return load(getUserConfigPath());
    }

    /**
     * Load configuration from all sources, reading the user config from the given file.
     */
    public static ReflectorConfig load(final Path userConfigPath) {
        final ReflectorConfig config = new ReflectorConfig();

        // Step 1: Load defaults from classpath
        config.loadFromClasspath();

        // Step 2: Load user config file (may override some settings)
        config.loadFromUserConfig(userConfigPath);

        // Step 3: Apply environment variables and system properties (highest priority)
        config.applyEnvironmentOverrides();

        logger.info("Reflector configuration loaded: definitionsPrefix={}, propertyNameTag={}, inlineRefs={}",
                config.definitionsPrefix, config.propertyNameTag, config.inlineRefs);

        return config;
    }

    private void loadFromClasspath() {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                final Yaml yaml = new Yaml();
                final Map<String, Object> config = yaml.load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded defaults from classpath: {}", DEFAULT_CONFIG_FILE);
                }
            }
        } catch (final IOException e) {
            logger.warn("Failed to load default config from classpath", e);
        }
    }

    private void loadFromUserConfig(final Path userConfigPath) {
        if (Files.exists(userConfigPath)) {
            try (final InputStream is = Files.newInputStream(userConfigPath)) {
                final Yaml yaml = new Yaml();
                final Map<String, Object> config = yaml.load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded user config from: {}", userConfigPath);
                }
            } catch (final IOException e) {
                logger.warn("Failed to load user config from: {}", userConfigPath, e);
            }
        }
    }

    @SuppressWarnings("unchecked")
    private void applyYamlConfig(final Map<String, Object> config) {
        // Navigate to jsonschema section
        final Map<String, Object> jsonschemaConfig = (Map<String, Object>) config.get("jsonschema");
        if (jsonschemaConfig == null) {
            return;
        }

        final Map<String, Object> reflectorConfig = (Map<String, Object>) jsonschemaConfig.get("reflector");
        if (reflectorConfig != null) {
            applyReflectorConfig(reflectorConfig);
        }
    }

    @SuppressWarnings("unchecked")
    private void applyReflectorConfig(final Map<String, Object> reflectorConfig) {
        if (reflectorConfig.containsKey("definitions-prefix")) {
            final Object prefix = reflectorConfig.get("definitions-prefix");
            if (prefix != null) {
                this.definitionsPrefix = resolveVariables(prefix.toString());
            }
        }
        if (reflectorConfig.containsKey("property-name-tag")) {
            final Object tag = reflectorConfig.get("property-name-tag");
            if (tag != null) {
                this.propertyNameTag = resolveVariables(tag.toString());
            }
        }
        if (reflectorConfig.containsKey("additional-name-tags")) {
            final Object tags = reflectorConfig.get("additional-name-tags");
            if (tags instanceof List) {
                this.additionalNameTags = new ArrayList<>((List<String>) tags);
            }
        }
        if (reflectorConfig.containsKey("strip-definition-name-prefixes")) {
            final Object prefixes = reflectorConfig.get("strip-definition-name-prefixes");
            if (prefixes instanceof List) {
                this.stripDefinitionNamePrefixes = new ArrayList<>((List<String>) prefixes);
            }
        }
        if (reflectorConfig.containsKey("inline-refs")) {
            this.inlineRefs = (Boolean) reflectorConfig.get("inline-refs");
        }
        if (reflectorConfig.containsKey("root-ref")) {
            this.rootRef = (Boolean) reflectorConfig.get("root-ref");
        }
        if (reflectorConfig.containsKey("root-nullable")) {
            this.rootNullable = (Boolean) reflectorConfig.get("root-nullable");
        }
        if (reflectorConfig.containsKey("envelop-nullability")) {
            this.envelopNullability = (Boolean) reflectorConfig.get("envelop-nullability");
        }
        if (reflectorConfig.containsKey("require-name-tags")) {
            this.requireNameTags = (Boolean) reflectorConfig.get("require-name-tags");
        }
        if (reflectorConfig.containsKey("skip-unsupported-properties")) {
            this.skipUnsupportedProperties = (Boolean) reflectorConfig.get("skip-unsupported-properties");
        }
        if (reflectorConfig.containsKey("skip-non-constraints")) {
            this.skipNonConstraints = (Boolean) reflectorConfig.get("skip-non-constraints");
        }
    }

    private void applyEnvironmentOverrides() {
        final String envPrefix = System.getenv(ENV_DEFINITIONS_PREFIX);
        if (envPrefix != null && !envPrefix.trim().isEmpty()) {
            this.definitionsPrefix = envPrefix.trim();
            logger.info("Definitions prefix from environment: {}", this.definitionsPrefix);
        }

        final String envTag = System.getenv(ENV_PROPERTY_NAME_TAG);
        if (envTag != null && !envTag.trim().isEmpty()) {
            this.propertyNameTag = envTag.trim();
            logger.info("Property name tag from environment: {}", this.propertyNameTag);
        }

        final String propPrefix = System.getProperty(PROP_DEFINITIONS_PREFIX);
        if (propPrefix != null && !propPrefix.isEmpty()) {
            this.definitionsPrefix = propPrefix;
        }

        final String propTag = System.getProperty(PROP_PROPERTY_NAME_TAG);
        if (propTag != null && !propTag.isEmpty()) {
            this.propertyNameTag = propTag;
        }
    }

    /**
     * Resolve variables in strings like ${VAR:default}
     */
    private String resolveVariables(final String value) {
        if (value == null || !value.contains("${")) {
            return value;
        }

        String result = value;
        int start;
        while ((start = result.indexOf("${")) >= 0) {
            final int end = result.indexOf("}", start);
            if (end < 0) {
                break;
            }

            final String varExpr = result.substring(start + 2, end);
            final String[] parts = varExpr.split(":", 2);
            final String varName = parts[0];
            final String defaultValue = parts.length > 1 ? parts[1] : "";

            // Check environment first, then system properties
            String replacement = System.getenv(varName);
            if (replacement == null || replacement.isEmpty()) {
                replacement = System.getProperty(varName, defaultValue);
            }

            // Handle nested ${user.home} type variables
            if (replacement.contains("${")) {
                replacement = resolveVariables(replacement);
            }

            result = result.substring(0, start) + replacement + result.substring(end + 1);
        }

        return result;
    }

    public static Path getUserConfigPath() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR, USER_CONFIG_FILE);
    }

    /**
     * The options this configuration stands for, in the order they are applied.
     */
    public List<ReflectOption> toOptions() {
        final List<ReflectOption> options = new ArrayList<>();
        options.add(ReflectOptions.definitionsPrefix(definitionsPrefix));
        options.add(ReflectOptions.propertyNameTag(propertyNameTag, additionalNameTags.toArray(new String[0])));
        if (!stripDefinitionNamePrefixes.isEmpty()) {
            options.add(ReflectOptions.stripDefinitionNamePrefix(stripDefinitionNamePrefixes.toArray(new String[0])));
        }
        if (inlineRefs) {
            options.add(ReflectOptions.inlineRefs());
        }
        if (rootRef) {
            options.add(ReflectOptions.rootRef());
        }
        if (rootNullable) {
            options.add(ReflectOptions.rootNullable());
        }
        if (envelopNullability) {
            options.add(ReflectOptions.envelopNullability());
        }
        if (requireNameTags) {
            options.add(ReflectOptions.requireNameTags());
        }
        if (skipUnsupportedProperties) {
            options.add(ReflectOptions.skipUnsupportedProperties());
        }
        if (skipNonConstraints) {
            options.add(ReflectOptions.skipNonConstraints());
        }
        return options;
    }

    // Getters
    public String getDefinitionsPrefix() {
        return definitionsPrefix;
    }

    public String getPropertyNameTag() {
        return propertyNameTag;
    }

    public List<String> getAdditionalNameTags() {
        return additionalNameTags;
    }

    public List<String> getStripDefinitionNamePrefixes() {
        return stripDefinitionNamePrefixes;
    }

    public boolean isInlineRefs() {
        return inlineRefs;
    }

    public boolean isRootRef() {
        return rootRef;
    }

    public boolean isRootNullable() {
        return rootNullable;
    }

    public boolean isEnvelopNullability() {
        return envelopNullability;
    }

    public boolean isRequireNameTags() {
        return requireNameTags;
    }

    public boolean isSkipUnsupportedProperties() {
        return skipUnsupportedProperties;
    }

    public boolean isSkipNonConstraints() {
        return skipNonConstraints;
    }
}
