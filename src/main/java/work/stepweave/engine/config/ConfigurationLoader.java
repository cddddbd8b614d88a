package work.stepweave.engine.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.stepweave.engine.api.LogLevel;
import work.stepweave.engine.error.ConfigurationException;
import work.stepweave.engine.shared.DurationParser;
import work.stepweave.engine.shared.Values;

/**
 * Locates and reads the engine configuration file (YAML or TOML). Lookup order: explicit path,
 * {@code STEPWEAVE_CONFIG}, {@code ./stepweave.yml}, {@code ./stepweave.yaml}, {@code ./stepweave.toml},
 * {@code ~/.config/stepweave/config.yml}. The first file found wins; no file means defaults.
 */
public final class ConfigurationLoader {
    private static final Logger log = LoggerFactory.getLogger(ConfigurationLoader.class);
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final Pattern ENV_REFERENCE = Pattern.compile("\\$\\{([A-Za-z_][A-Za-z0-9_]*)(?::-([^}]*))?}");
    public static final String CONFIG_ENV = "STEPWEAVE_CONFIG";

    private final Function<String, String> environment;
    private final Path workingDirectory;
    private final Path homeDirectory;

    public ConfigurationLoader() {
        this(System::getenv, Path.of("").toAbsolutePath(), Path.of(System.getProperty("user.home")));
    }

    public ConfigurationLoader(Function<String, String> environment, Path workingDirectory, Path homeDirectory) {
        this.environment = environment;
        this.workingDirectory = workingDirectory;
        this.homeDirectory = homeDirectory;
    }

    public EngineConfiguration load(Path explicit) {
        return locate(explicit).map(this::loadFile).orElseGet(() -> {
            log.debug("No configuration file found, using defaults");
            return EngineConfiguration.defaults();
        });
    }

    public Optional<Path> locate(Path explicit) {
        if (explicit != null) {
            if (!Files.isRegularFile(explicit)) {
                throw new ConfigurationException(explicit, "configuration file not found", null);
            }
            return Optional.of(explicit);
        }
        var fromEnv = environment.apply(CONFIG_ENV);
        if (fromEnv != null && !fromEnv.isBlank()) {
            var path = Path.of(fromEnv.trim());
            if (Files.isRegularFile(path)) {
                return Optional.of(path);
            }
            log.warn("{} points to {} which does not exist; ignoring it", CONFIG_ENV, path);
        }
        List<Path> candidates = List.of(
            workingDirectory.resolve("stepweave.yml"),
            workingDirectory.resolve("stepweave.yaml"),
            workingDirectory.resolve("stepweave.toml"),
            homeDirectory.resolve(".config").resolve("stepweave").resolve("config.yml"));
        return candidates.stream().filter(Files::isRegularFile).findFirst();
    }

    public EngineConfiguration loadFile(Path path) {
        log.debug("Loading configuration from {}", path);
        String text;
        try {
            text = Files.readString(path);
        } catch (IOException ex) {
            throw new ConfigurationException(path, "cannot read configuration: " + ex.getMessage(), ex);
        }
        var document = path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".toml")
            ? parseToml(path, text)
            : parseYaml(path, text);
        try {
            return fromMap(document);
        } catch (IllegalArgumentException ex) {
            throw new ConfigurationException(path, ex.getMessage(), ex);
        }
    }

    /**
     * Builds a configuration from an already parsed document. {@code ${VAR}} references are expanded first.
     */
    @SuppressWarnings("unchecked")
    public EngineConfiguration fromMap(Map<String, Object> raw) {
        var document = (Map<String, Object>) expand(raw == null ? Map.of() : raw);
        var builder = EngineConfiguration.builder();
        var model = firstPresent(document, "default_model", "default_provider");
        if (model != null) {
            builder.defaultModel(String.valueOf(model));
        }
        if (document.get("base_url") != null) {
            builder.baseUrl(String.valueOf(document.get("base_url")));
        }
        if (document.get("api_key") != null) {
            builder.apiKey(String.valueOf(document.get("api_key")));
        }
        Optional.ofNullable(Values.asInteger(document.get("max_parallel_ai_calls"))).ifPresent(builder::maxParallelAiCalls);
        DurationParser.fromDocument(document.get("timeout_per_step")).ifPresent(builder::timeoutPerStep);
        Optional.ofNullable(Values.asInteger(document.get("max_auto_retry_attempts"))).ifPresent(builder::maxAutoRetryAttempts);
        Optional.ofNullable(Values.asInteger(document.get("provider_max_retries"))).ifPresent(builder::providerMaxRetries);
        DurationParser.fromDocument(document.get("provider_retry_backoff")).ifPresent(builder::providerRetryBackoff);
        if (document.get("log_level") != null) {
            builder.logLevel(LogLevel.from(String.valueOf(document.get("log_level"))));
        }
        var settings = document.get("provider_settings");
        if (settings != null) {
            if (!(settings instanceof Map<?, ?> settingsMap)) {
                throw new IllegalArgumentException("provider_settings must be a mapping");
            }
            var converted = new LinkedHashMap<String, Map<String, Object>>();
            settingsMap.forEach((provider, values) -> {
                if (!(values instanceof Map<?, ?>)) {
                    throw new IllegalArgumentException("provider_settings." + provider + " must be a mapping");
                }
                converted.put(String.valueOf(provider), (Map<String, Object>) values);
            });
            builder.providerSettings(converted);
        }
        return builder.build();
    }

    Object expand(Object value) {
        if (value instanceof String text) {
            return expandString(text);
        }
        if (value instanceof Map<?, ?> map) {
            var copy = new LinkedHashMap<String, Object>();
            map.forEach((key, item) -> copy.put(String.valueOf(key), expand(item)));
            return copy;
        }
        if (value instanceof List<?> list) {
            var copy = new ArrayList<>(list.size());
            list.forEach(item -> copy.add(expand(item)));
            return copy;
        }
        return value;
    }

    private String expandString(String text) {
        Matcher whole = ENV_REFERENCE.matcher(text);
        if (whole.matches() && whole.group(2) == null && environment.apply(whole.group(1)) == null) {
            return null;
        }
        Matcher matcher = ENV_REFERENCE.matcher(text);
        var expanded = new StringBuilder();
        while (matcher.find()) {
            var resolved = environment.apply(matcher.group(1));
            if (resolved == null || resolved.isEmpty()) {
                resolved = matcher.group(2) == null ? "" : matcher.group(2);
            }
            matcher.appendReplacement(expanded, Matcher.quoteReplacement(resolved));
        }
        matcher.appendTail(expanded);
        return expanded.toString();
    }

    private static Object firstPresent(Map<String, Object> document, String... keys) {
        for (var key : keys) {
            if (document.get(key) != null) {
                return document.get(key);
            }
        }
        return null;
    }

    private static Map<String, Object> parseYaml(Path path, String text) {
        if (text.isBlank()) {
            return Map.of();
        }
        try {
            var parsed = YAML.readValue(text, MAP_TYPE);
            return parsed == null ? Map.of() : parsed;
        } catch (IOException ex) {
            throw new ConfigurationException(path, "invalid YAML: " + ex.getMessage(), ex);
        }
    }

    private static Map<String, Object> parseToml(Path path, String text) {
        TomlParseResult result = Toml.parse(text);
        if (result.hasErrors()) {
            throw new ConfigurationException(path, "invalid TOML: " + result.errors().get(0).toString(), null);
        }
        return convertTomlMap(result.toMap());
    }

    private static Map<String, Object> convertTomlMap(Map<String, Object> source) {
        Map<String, Object> converted = new LinkedHashMap<>();
        for (var entry : source.entrySet()) {
            converted.put(String.valueOf(entry.getKey()), convertTomlValue(entry.getValue()));
        }
        return converted;
    }

    private static Object convertTomlValue(Object value) {
        if (value instanceof TomlTable table) {
            return convertTomlMap(table.toMap());
        }
        if (value instanceof TomlArray array) {
            List<Object> items = new ArrayList<>();
            for (int i = 0; i < array.size(); i++) {
                items.add(convertTomlValue(array.get(i)));
            }
            return items;
        }
        return value;
    }
}
