package ca.purps.offlinestorage.protocol;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.type.TypeFactory;

import ca.purps.offlinestorage.cleanup.CleanupResult;
import ca.purps.offlinestorage.cleanup.StorageSettings;
import ca.purps.offlinestorage.exception.ProtocolException;
import ca.purps.offlinestorage.metrics.PerformanceMetrics;
import ca.purps.offlinestorage.model.ChapterCountValidation;
import ca.purps.offlinestorage.model.DownloadHistoryItem;
import ca.purps.offlinestorage.model.DownloadProgress;
import ca.purps.offlinestorage.model.OfflineChapterMetadata;
import ca.purps.offlinestorage.model.OfflineChapterPages;
import ca.purps.offlinestorage.model.OfflineMangaMetadata;
import ca.purps.offlinestorage.model.QueuedDownload;
import ca.purps.offlinestorage.model.StorageStats;
import ca.purps.offlinestorage.protocol.payload.BackgroundSyncPayload;
import ca.purps.offlinestorage.protocol.payload.ChapterRef;
import ca.purps.offlinestorage.protocol.payload.HistoryIdPayload;
import ca.purps.offlinestorage.protocol.payload.HistoryQuery;
import ca.purps.offlinestorage.protocol.payload.MangaRef;
import ca.purps.offlinestorage.protocol.payload.PagePathPayload;
import ca.purps.offlinestorage.protocol.payload.PingResult;
import ca.purps.offlinestorage.protocol.payload.QueueChapterPayload;
import ca.purps.offlinestorage.protocol.payload.QueueIdPayload;
import ca.purps.offlinestorage.protocol.payload.QueueMangaPayload;
import lombok.Getter;

/**
 * Every command the host can send, with the one payload shape and the one result shape that
 * belong to it. {@code Void} means no payload or no result.
 */
@Getter
public enum CommandType {
    START("start", Void.class, type(Void.class)),
    STOP("stop", Void.class, type(Void.class)),
    QUEUE_CHAPTER("queue-chapter", QueueChapterPayload.class, type(Long.class)),
    QUEUE_MANGA("queue-manga", QueueMangaPayload.class, listOf(Long.class)),
    CANCEL_DOWNLOAD("cancel-download", QueueIdPayload.class, type(Void.class)),
    RETRY_DOWNLOAD("retry-download", QueueIdPayload.class, type(Void.class)),
    RETRY_FROZEN_DOWNLOADS("retry-frozen-downloads", Void.class, listOf(Long.class)),
    GET_QUEUED_DOWNLOADS("get-queued-downloads", Void.class, listOf(QueuedDownload.class)),
    GET_DOWNLOAD_PROGRESS("get-download-progress", QueueIdPayload.class, type(DownloadProgress.class)),
    GET_STORAGE_STATS("get-storage-stats", Void.class, type(StorageStats.class)),
    GET_DOWNLOADED_MANGA("get-downloaded-manga", Void.class, listOf(OfflineMangaMetadata.class)),
    GET_MANGA_METADATA("get-manga-metadata", MangaRef.class, type(OfflineMangaMetadata.class)),
    GET_DOWNLOADED_CHAPTERS("get-downloaded-chapters", MangaRef.class, listOf(OfflineChapterMetadata.class)),
    GET_CHAPTER_PAGES("get-chapter-pages", ChapterRef.class, type(OfflineChapterPages.class)),
    IS_CHAPTER_DOWNLOADED("is-chapter-downloaded", ChapterRef.class, type(Boolean.class)),
    DELETE_CHAPTER("delete-chapter", ChapterRef.class, type(Void.class)),
    DELETE_MANGA("delete-manga", MangaRef.class, type(Void.class)),
    NUKE_OFFLINE_DATA("nuke-offline-data", Void.class, type(Void.class)),
    GET_DOWNLOAD_HISTORY("get-download-history", HistoryQuery.class, listOf(DownloadHistoryItem.class)),
    DELETE_HISTORY_ITEM("delete-history-item", HistoryIdPayload.class, type(Void.class)),
    CLEAR_DOWNLOAD_HISTORY("clear-download-history", Void.class, type(Void.class)),
    VALIDATE_MANGA_CHAPTER_COUNT("validate-manga-chapter-count", MangaRef.class, type(ChapterCountValidation.class)),
    START_BACKGROUND_SYNC("start-background-sync", BackgroundSyncPayload.class, type(Void.class)),
    GET_PAGE_PATH("get-page-path", PagePathPayload.class, type(String.class)),
    GET_METRICS("get-metrics", Void.class, type(PerformanceMetrics.class)),
    RESET_METRICS("reset-metrics", Void.class, type(Void.class)),
    IS_ACTIVE("is-active", Void.class, type(Boolean.class)),
    GET_ACTIVE_DOWNLOADS("get-active-downloads", Void.class, listOf(Long.class)),
    PERFORM_CLEANUP("perform-cleanup", StorageSettings.class, type(CleanupResult.class)),
    PING("ping", Void.class, type(PingResult.class));

    private static final Map<String, CommandType> BY_WIRE_NAME = Arrays.stream(values())
            .collect(Collectors.toMap(CommandType::getWireName, Function.identity()));

    @JsonValue
    private final String wireName;
    private final Class<?> payloadType;
    private final JavaType resultType;

    CommandType(String wireName, Class<?> payloadType, JavaType resultType) {
        this.wireName = wireName;
        this.payloadType = payloadType;
        this.resultType = resultType;
    }

    public boolean hasPayload() {
        return payloadType != Void.class;
    }

    @JsonCreator
    public static CommandType fromWireName(String value) {
        CommandType type = BY_WIRE_NAME.get(value);
        if (type == null) {
            throw new ProtocolException("Unknown command: " + value);
        }
        return type;
    }

    public static boolean isCommand(String value) {
        return BY_WIRE_NAME.containsKey(value);
    }

    private static JavaType type(Class<?> type) {
        return TypeFactory.defaultInstance().constructType(type);
    }

    private static JavaType listOf(Class<?> elementType) {
        return TypeFactory.defaultInstance().constructCollectionType(List.class, elementType);
    }
}
