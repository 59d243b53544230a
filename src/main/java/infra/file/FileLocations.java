package infra.file;

import domain.error.CatalogAccessException;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Opens offline inputs.
 * <ol>
 *   <li>{@code file:/...} URI or an existing file system path</li>
 *   <li>otherwise a classpath resource (handy for bundled samples and tests)</li>
 * </ol>
 */
final class FileLocations {

    private FileLocations() {
    }

    static InputStream open(String location, String label) {
        if (location == null || location.isBlank()) {
            throw new CatalogAccessException(label + " location is blank");
        }
        String loc = location.trim();

        try {
            if (loc.startsWith("file:")) {
                Path p = Path.of(URI.create(loc));
                if (!Files.exists(p)) {
                    throw new CatalogAccessException(label + " not found: " + p);
                }
                return Files.newInputStream(p);
            }

            Path p = Path.of(loc);
            if (Files.exists(p)) {
                return Files.newInputStream(p);
            }
        } catch (IOException e) {
            throw new CatalogAccessException("Failed to open " + label + ": " + loc, e);
        }

        InputStream is = Thread.currentThread()
                .getContextClassLoader()
                .getResourceAsStream(loc);
        if (is == null) {
            throw new CatalogAccessException(label + " not found: " + loc + " (classpath or filesystem)");
        }
        return is;
    }
}
