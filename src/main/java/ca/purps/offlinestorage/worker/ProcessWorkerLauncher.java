package ca.purps.offlinestorage.worker;

import java.io.IOException;

import ca.purps.offlinestorage.config.SupervisorOptions;
import ca.purps.offlinestorage.utility.ProcessHelper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RequiredArgsConstructor
public class ProcessWorkerLauncher implements WorkerLauncher {

    private final SupervisorOptions options;

    @Override
    public WorkerChannel launch(WorkerChannel.Listener listener) throws IOException {
        Process process = ProcessHelper.start(ProcessHelper.workerCommand(options));
        ProcessWorkerLauncher.log.info("Spawned worker process {}", process.pid());
        return new ProcessWorkerChannel(process, listener);
    }

}
