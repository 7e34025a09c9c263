package dev.patchwork.compiler;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Settings that differ between Patchwork dialects: which keyword declares a worker,
 * which session fields workers may read, and where the runtime helpers live.
 *
 * <p>Defaults come from the classpath resource {@code patchwork-defaults.json}; a JSON
 * file passed to {@link #load(Path)} overrides the keys it names.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class CompilerConfig {

    static final String DEFAULTS_RESOURCE = "/patchwork-defaults.json";

    private static final Set<String> KNOWN_WORKER_KEYWORDS = Set.of("worker", "task");
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String runtimeModule;
    private final Set<String> workerKeywords;
    private final Set<String> sessionFields;

    @JsonCreator
    CompilerConfig(@JsonProperty("runtimeModule") String runtimeModule,
                   @JsonProperty("workerKeywords") List<String> workerKeywords,
                   @JsonProperty("sessionFields") List<String> sessionFields) {
        this.runtimeModule = runtimeModule;
        this.workerKeywords = workerKeywords == null ? null : ordered(workerKeywords);
        this.sessionFields = sessionFields == null ? null : ordered(sessionFields);
    }

    private static Set<String> ordered(List<String> values) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(values));
    }

    public static CompilerConfig defaults() {
        try (InputStream in = CompilerConfig.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("missing classpath resource " + DEFAULTS_RESOURCE);
            }
            return MAPPER.readValue(in, CompilerConfig.class).validated();
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read " + DEFAULTS_RESOURCE, e);
        }
    }

    /**
     * Reads a JSON config file; keys it leaves out keep their default values.
     */
    public static CompilerConfig load(Path path) throws IOException {
        CompilerConfig overrides = MAPPER.readValue(Files.readAllBytes(path), CompilerConfig.class);
        CompilerConfig base = defaults();
        return new CompilerConfig(
                overrides.runtimeModule != null ? overrides.runtimeModule : base.runtimeModule,
                new ArrayList<>(overrides.workerKeywords != null ? overrides.workerKeywords : base.workerKeywords),
                new ArrayList<>(overrides.sessionFields != null ? overrides.sessionFields : base.sessionFields))
                .validated();
    }

    private CompilerConfig validated() {
        if (runtimeModule == null || runtimeModule.isBlank()) {
            throw new IllegalArgumentException("runtimeModule must not be empty");
        }
        if (workerKeywords == null || workerKeywords.isEmpty()) {
            throw new IllegalArgumentException("workerKeywords must name at least one keyword");
        }
        for (String keyword : workerKeywords) {
            if (!KNOWN_WORKER_KEYWORDS.contains(keyword)) {
                throw new IllegalArgumentException("unknown worker keyword '" + keyword + "', expected one of "
                        + KNOWN_WORKER_KEYWORDS);
            }
        }
        if (sessionFields == null) {
            throw new IllegalArgumentException("sessionFields must be present");
        }
        return this;
    }

    public static Builder builder() {
        return new Builder(defaults());
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    @JsonProperty("runtimeModule")
    public String runtimeModule() {
        return runtimeModule;
    }

    @JsonProperty("workerKeywords")
    public Set<String> workerKeywords() {
        return workerKeywords;
    }

    @JsonProperty("sessionFields")
    public Set<String> sessionFields() {
        return sessionFields;
    }

    @Override
    public String toString() {
        return "CompilerConfig{runtimeModule=" + runtimeModule
                + ", workerKeywords=" + workerKeywords
                + ", sessionFields=" + sessionFields + '}';
    }

    public static final class Builder {
        private String runtimeModule;
        private List<String> workerKeywords;
        private List<String> sessionFields;

        private Builder(CompilerConfig from) {
            this.runtimeModule = from.runtimeModule;
            this.workerKeywords = new ArrayList<>(from.workerKeywords);
            this.sessionFields = new ArrayList<>(from.sessionFields);
        }

        public Builder runtimeModule(String runtimeModule) {
            this.runtimeModule = runtimeModule;
            return this;
        }

        public Builder workerKeywords(String... keywords) {
            this.workerKeywords = List.of(keywords);
            return this;
        }

        public Builder sessionFields(String... fields) {
            this.sessionFields = List.of(fields);
            return this;
        }

        public CompilerConfig build() {
            return new CompilerConfig(runtimeModule, workerKeywords, sessionFields).validated();
        }
    }
}
