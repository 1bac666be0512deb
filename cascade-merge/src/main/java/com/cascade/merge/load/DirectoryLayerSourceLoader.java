package com.cascade.merge.load;

import com.cascade.merge.LayerDefinition;
import com.cascade.merge.SourceUnit;
import com.cascade.merge.SourceUnitPaths;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Loads every {@code *.json} file below the layer folder, recursively, sorted by relative path. The unit id is the
 * relative path with {@code /} separators.
 */
public final class DirectoryLayerSourceLoader implements LayerSourceLoader {

    @Override
    public List<SourceUnit> load(LayerDefinition layer) throws IOException {
        if (layer.sourceLocator() == null || layer.sourceLocator().isBlank()) {
            throw new IOException("Layer " + layer.name() + " has no folder path");
        }
        Path folder = Paths.get(layer.sourceLocator());
        if (!Files.isDirectory(folder)) {
            throw new NoSuchFileException(folder.toString(), null, "layer folder not found");
        }
        List<Path> files;
        try (Stream<Path> walk = Files.walk(folder)) {
            files = walk.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT)
                            .endsWith(SourceUnitPaths.EXTENSION))
                    .sorted()
                    .collect(Collectors.toList());
        }
        List<SourceUnit> units = new ArrayList<>(files.size());
        for (Path file : files) {
            String id = folder.relativize(file).toString().replace('\\', '/');
            units.add(new SourceUnit(id, Files.readString(file, StandardCharsets.UTF_8)));
        }
        return units;
    }
}
