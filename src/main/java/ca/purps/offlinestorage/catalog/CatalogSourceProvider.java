package ca.purps.offlinestorage.catalog;

import ca.purps.offlinestorage.config.DownloadOptions;

/**
 * Service-provider entry point of an extension, registered under
 * {@code META-INF/services/ca.purps.offlinestorage.catalog.CatalogSourceProvider}.
 */
public interface CatalogSourceProvider {

    String id();

    CatalogSource create(DownloadOptions options);

}
