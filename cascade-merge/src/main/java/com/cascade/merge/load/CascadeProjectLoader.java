package com.cascade.merge.load;

import com.cascade.merge.LayerDefinition;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads a cascade project file:
 * <pre>
 * { "layers": [ { "name": "Base", "folderPath": "base" }, { "name": "Site", "folderPath": "site" } ] }
 * </pre>
 * Layer precedence is list order. Relative folder paths resolve against the project file's directory.
 * Comments are allowed.
 */
public final class CascadeProjectLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(JsonParser.Feature.ALLOW_COMMENTS);

    private CascadeProjectLoader() {
    }

    /**
     * @throws IOException when the file is missing, malformed, or declares an unusable layer
     */
    public static List<LayerDefinition> load(Path projectFile) throws IOException {
        Objects.requireNonNull(projectFile, "projectFile");
        ProjectFile project = MAPPER.readValue(projectFile.toFile(), ProjectFile.class);
        if (project == null || project.layers() == null) {
            throw new IOException("Project file " + projectFile + " declares no layers");
        }
        Path baseDir = projectFile.toAbsolutePath().getParent();
        List<LayerDefinition> definitions = new ArrayList<>();
        for (int i = 0; i < project.layers().size(); i++) {
            LayerEntry entry = project.layers().get(i);
            if (entry == null || entry.name() == null || entry.name().isBlank()) {
                throw new IOException("Layer #" + i + " in " + projectFile + " has no name");
            }
            String folder = entry.folderPath() != null ? entry.folderPath() : entry.name();
            definitions.add(new LayerDefinition(entry.name(), i, baseDir.resolve(folder).normalize().toString()));
        }
        return definitions;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ProjectFile(List<LayerEntry> layers) {
        @JsonCreator
        ProjectFile(@JsonProperty("layers") List<LayerEntry> layers) {
            this.layers = layers;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record LayerEntry(String name, String folderPath) {
        @JsonCreator
        LayerEntry(@JsonProperty("name") String name, @JsonProperty("folderPath") String folderPath) {
            this.name = name;
            this.folderPath = folderPath;
        }
    }
}
