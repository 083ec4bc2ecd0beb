package org.kappapathways.pathway.config;

import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.kappapathways.common.IEnvGetter;
import org.kappapathways.common.errorsor.ErrorsOr;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public interface PathwayConfigLoader {

    String DEFAULTS_RESOURCE = "pathway-defaults.json";

    ObjectMapper JSON = JsonMapper.builder()
            // Open to extension: ignore extra fields in JSON
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            // Let the record constructor apply defaults
            .configure(DeserializationFeature.FAIL_ON_MISSING_CREATOR_PROPERTIES, false)
            .configure(DeserializationFeature.FAIL_ON_NULL_CREATOR_PROPERTIES, false)
            .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, false)
            .configure(MapperFeature.ACCEPT_CASE_INSENSITIVE_PROPERTIES, false)
            // "top" and "bottom" read as well as TOP and BOTTOM
            .configure(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS, true)
            // Nice for human-authored JSON files
            .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .build();
    ObjectReader CONFIG_READER = JSON.readerFor(PathwayConfig.class);

    static ErrorsOr<PathwayConfig> fromJson(InputStream in) {
        try {
            PathwayConfig config = CONFIG_READER.readValue(in);
            return config == null ? ErrorsOr.error("Pathway config is empty") : ErrorsOr.lift(config);
        } catch (Exception e) {
            return ErrorsOr.error("Failed to parse pathway config: " + e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    static ErrorsOr<PathwayConfig> fromJson(String json) {
        return fromJson(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
    }

    static ErrorsOr<PathwayConfig> fromJson(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return fromJson(in).addPrefixIfError(path + ": ");
        } catch (Exception e) {
            return ErrorsOr.error("Failed to read pathway config " + path + ": " + e.getMessage());
        }
    }

    /** The packaged defaults. */
    static ErrorsOr<PathwayConfig> defaults() {
        try (InputStream in = PathwayConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) return ErrorsOr.error(DEFAULTS_RESOURCE + " not found on classpath");
            return fromJson(in);
        } catch (Exception e) {
            return ErrorsOr.error("Failed to load " + DEFAULTS_RESOURCE + ": " + e.getMessage());
        }
    }

    /** Packaged defaults with environment overrides applied; a malformed override is an error. */
    static ErrorsOr<PathwayConfig> load(IEnvGetter env) {
        return defaults().flatMap(c -> ErrorsOr.trying(() -> c.withEnvOverrides(env)));
    }
}
