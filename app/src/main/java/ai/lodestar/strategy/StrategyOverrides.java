package ai.lodestar.strategy;

import ai.lodestar.intent.TaskIntent;
import ai.lodestar.util.Json;
import com.fasterxml.jackson.core.type.TypeReference;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Reads and writes per-intent strategy overrides as JSON, keyed by intent name:
 *
 * <pre>{@code
 * {
 *   "debug":   { "budgetRatios": { "diff": 0.7, "lsp": 0.2, "search": 0.1 } },
 *   "explore": { "providerPriority": ["search", "diff", "lsp"] }
 * }
 * }</pre>
 */
public final class StrategyOverrides {
    private static final Logger logger = LogManager.getLogger(StrategyOverrides.class);

    private static final TypeReference<LinkedHashMap<String, StrategyOverride>> TYPE = new TypeReference<>() {};

    private StrategyOverrides() {}

    /** Unknown intent keys are logged and skipped. Malformed JSON or invalid values fail the whole load. */
    public static Map<TaskIntent, StrategyOverride> load(Path file) throws IOException {
        var json = Files.readString(file, StandardCharsets.UTF_8);
        var overrides = parse(json);
        logger.debug("Loaded {} strategy overrides from {}", overrides.size(), file);
        return overrides;
    }

    public static Map<TaskIntent, StrategyOverride> parse(String json) throws IOException {
        LinkedHashMap<String, StrategyOverride> raw = Json.fromJson(json, TYPE);
        var result = new EnumMap<TaskIntent, StrategyOverride>(TaskIntent.class);
        if (raw == null) {
            return Collections.unmodifiableMap(result);
        }
        for (var entry : raw.entrySet()) {
            var intent = TaskIntent.safeParse(entry.getKey());
            if (intent.isEmpty()) {
                logger.warn("Ignoring strategy override for unknown intent '{}'", entry.getKey());
                continue;
            }
            if (entry.getValue() != null) {
                result.put(intent.get(), entry.getValue());
            }
        }
        return Collections.unmodifiableMap(result);
    }

    public static void save(Path file, Map<TaskIntent, StrategyOverride> overrides) throws IOException {
        var keyed = new LinkedHashMap<String, StrategyOverride>();
        overrides.forEach((intent, override) -> keyed.put(intent.wireName(), override));
        Files.writeString(file, Json.toJson(keyed), StandardCharsets.UTF_8);
    }
}
