package ca.purps.offlinestorage.worker;

import java.io.IOException;

/**
 * Line-oriented, bidirectional link to one running worker.
 */
public interface WorkerChannel {

    /**
     * Callbacks of one channel. Lines arrive in the order the worker wrote them, and
     * {@link #onExit(Integer)} is the last call made.
     */
    interface Listener {

        void onLine(String line);

        /**
         * @param exitCode null when the exit code is unknown
         */
        void onExit(Integer exitCode);

    }

    public void send(String line) throws IOException;

    public boolean isAlive();

    /**
     * Graceful terminate, escalated to a hard kill after {@code graceMs}. Blocks until the worker
     * is gone or the kill was issued.
     */
    public void terminate(long graceMs);

}
