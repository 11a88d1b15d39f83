package ca.purps.offlinestorage.worker;

import java.io.IOException;

@FunctionalInterface
public interface WorkerLauncher {

    WorkerChannel launch(WorkerChannel.Listener listener) throws IOException;

}
