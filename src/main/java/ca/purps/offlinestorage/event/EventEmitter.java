package ca.purps.offlinestorage.event;

import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;

import lombok.extern.slf4j.Slf4j;

/**
 * Listener registry shared by the worker-side components and the host. A listener that throws
 * is logged and skipped; delivery to the remaining listeners continues.
 */
@Slf4j
public class EventEmitter {

    private final Set<OfflineStorageEventListener> listeners = new CopyOnWriteArraySet<>();

    /**
     * @return handle that unregisters the listener
     */
    public Runnable on(OfflineStorageEventListener listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public void emit(OfflineStorageEvent event) {
        for (OfflineStorageEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                EventEmitter.log.error("Error in event listener for {}", event.getType(), e);
            }
        }
    }

    public void clear() {
        listeners.clear();
    }

    public int size() {
        return listeners.size();
    }

}
