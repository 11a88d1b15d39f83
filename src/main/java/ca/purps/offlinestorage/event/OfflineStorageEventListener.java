package ca.purps.offlinestorage.event;

@FunctionalInterface
public interface OfflineStorageEventListener {

    void onEvent(OfflineStorageEvent event);

}
