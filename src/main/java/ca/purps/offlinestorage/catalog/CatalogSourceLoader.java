package ca.purps.offlinestorage.catalog;

import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;

import ca.purps.offlinestorage.config.DownloadOptions;
import ca.purps.offlinestorage.exception.CatalogException;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

/**
 * Finds the {@link CatalogSourceProvider} for the worker, looking inside the extension jar (or
 * directory) when one is configured and on the worker's own classpath otherwise.
 */
@Slf4j
@UtilityClass
public class CatalogSourceLoader {

    public CatalogSource load(String extensionPath, String extensionId, DownloadOptions options) {
        ClassLoader classLoader = classLoaderFor(extensionPath);

        List<CatalogSourceProvider> providers = new ArrayList<>();
        ServiceLoader.load(CatalogSourceProvider.class, classLoader).forEach(providers::add);

        if (providers.isEmpty()) {
            throw new CatalogException(String.format("No catalog source provider found (extension path: %s)", extensionPath));
        }

        CatalogSourceProvider provider = providers.stream()
                .filter(candidate -> candidate.id().equals(extensionId))
                .findFirst()
                .orElseGet(() -> {
                    CatalogSourceLoader.log.warn("No provider with id {}, falling back to {}", extensionId, providers.get(0).id());
                    return providers.get(0);
                });

        CatalogSourceLoader.log.info("Using catalog source provider: {}", provider.id());
        return provider.create(options);
    }

    private ClassLoader classLoaderFor(String extensionPath) {
        ClassLoader parent = CatalogSourceLoader.class.getClassLoader();
        if (extensionPath == null || extensionPath.isBlank()) {
            return parent;
        }

        Path path = Path.of(extensionPath);
        if (!Files.exists(path)) {
            throw new CatalogException("Extension not found: " + extensionPath);
        }

        try {
            return new URLClassLoader(new URL[] { path.toUri().toURL() }, parent);
        } catch (MalformedURLException e) {
            throw new CatalogException("Invalid extension path: " + extensionPath, e);
        }
    }

}
