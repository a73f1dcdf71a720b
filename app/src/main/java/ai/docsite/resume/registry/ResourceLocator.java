package ai.docsite.resume.registry;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only text resource lookup relative to a store root such as {@code types/project/type.yaml}.
 */
public interface ResourceLocator {

    Optional<String> read(String relativePath);

    String describe();

    /**
     * Resources bundled under {@code base} on the classpath.
     */
    static ResourceLocator classpath(String base) {
        String prefix = base.endsWith("/") ? base : base + "/";
        ClassLoader loader = ResourceLocator.class.getClassLoader();
        return new ResourceLocator() {
            @Override
            public Optional<String> read(String relativePath) {
                try (InputStream stream = loader.getResourceAsStream(prefix + relativePath)) {
                    if (stream == null) {
                        return Optional.empty();
                    }
                    return Optional.of(new String(stream.readAllBytes(), StandardCharsets.UTF_8));
                } catch (IOException ex) {
                    throw new UncheckedIOException("Failed to read classpath resource " + prefix + relativePath, ex);
                }
            }

            @Override
            public String describe() {
                return "classpath:" + prefix;
            }
        };
    }

    /**
     * Resources stored as files below {@code root}.
     */
    static ResourceLocator directory(Path root) {
        Objects.requireNonNull(root, "root");
        return new ResourceLocator() {
            @Override
            public Optional<String> read(String relativePath) {
                Path file = root.resolve(relativePath).normalize();
                if (!file.startsWith(root.normalize()) || !Files.isRegularFile(file)) {
                    return Optional.empty();
                }
                try {
                    return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
                } catch (IOException ex) {
                    throw new UncheckedIOException("Failed to read " + file, ex);
                }
            }

            @Override
            public String describe() {
                return root.toString();
            }
        };
    }

    /**
     * Looks in this locator first and in {@code fallback} for anything it lacks.
     */
    default ResourceLocator orElse(ResourceLocator fallback) {
        ResourceLocator primary = this;
        return new ResourceLocator() {
            @Override
            public Optional<String> read(String relativePath) {
                Optional<String> found = primary.read(relativePath);
                return found.isPresent() ? found : fallback.read(relativePath);
            }

            @Override
            public String describe() {
                return primary.describe() + " -> " + fallback.describe();
            }
        };
    }
}
