package ca.purps.offlinestorage.catalog;

import java.util.List;

/**
 * Read access to the remote catalog an extension exposes.
 */
public interface CatalogSource {

    MangaDetails fetchManga(String extensionId, String mangaId);

    List<PageInfo> fetchChapterPages(String extensionId, String mangaId, String chapterId);

}
