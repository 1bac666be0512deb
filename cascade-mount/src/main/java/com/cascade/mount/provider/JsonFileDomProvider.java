package com.cascade.mount.provider;

import com.cascade.dom.DomNode;
import com.cascade.dom.json.DomJson;
import com.cascade.mount.DomProvider;
import com.cascade.mount.ProviderSnapshot;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/** Reads one JSON file per load. */
public final class JsonFileDomProvider implements DomProvider {

    private final Path file;

    public JsonFileDomProvider(Path file) {
        this.file = Objects.requireNonNull(file, "file");
    }

    @Override
    public ProviderSnapshot load() throws IOException {
        String json = Files.readString(file, StandardCharsets.UTF_8);
        DomNode root;
        try {
            root = DomJson.parse(json);
        } catch (UncheckedIOException e) {
            throw new IOException("Failed to parse " + file + ": " + e.getCause().getMessage(), e.getCause());
        }
        return ProviderSnapshot.of(root);
    }

    public Path getFile() {
        return file;
    }
}
