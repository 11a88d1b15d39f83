package ca.purps.offlinestorage.downloader;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import ca.purps.offlinestorage.model.ProgressUpdate;

public class ProgressBatcherTest {

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> scheduledFlush;
    private List<ProgressUpdate> delivered;

    @BeforeMethod
    public void beforeMethod() {
        scheduler = Mockito.mock(ScheduledExecutorService.class);
        scheduledFlush = Mockito.mock(ScheduledFuture.class);
        Mockito.doReturn(scheduledFlush).when(scheduler).schedule(Mockito.any(Runnable.class), Mockito.anyLong(), Mockito.any(TimeUnit.class));
        delivered = new ArrayList<>();
    }

    private static ProgressUpdate progress(long queueId, int current, int total) {
        return ProgressUpdate.builder()
                .queueId(queueId)
                .mangaId("m1")
                .chapterId("c" + queueId)
                .progressCurrent(current)
                .progressTotal(total)
                .build();
    }

    private Runnable scheduledTask() {
        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        Mockito.verify(scheduler).schedule(task.capture(), Mockito.eq(1500L), Mockito.eq(TimeUnit.MILLISECONDS));
        return task.getValue();
    }

    @Test
    public void coalescesUpdatesWithinInterval() {
        ProgressBatcher batcher = new ProgressBatcher(delivered::add, 1500, true, scheduler);

        for (int page = 1; page <= 5; page++) {
            batcher.update(progress(1, page, 10));
        }

        assert delivered.isEmpty() : "Nothing should be delivered before the flush";
        assert batcher.pendingCount() == 1;

        scheduledTask().run();

        assert delivered.size() == 1 : "Expected exactly one callback, got " + delivered.size();
        assert delivered.get(0).getProgressCurrent() == 5 : "Latest values should win";
        assert batcher.pendingCount() == 0;
    }

    @Test
    public void onlyOneTimerPerInterval() {
        ProgressBatcher batcher = new ProgressBatcher(delivered::add, 1500, true, scheduler);

        batcher.update(progress(1, 1, 10));
        batcher.update(progress(2, 1, 10));
        batcher.update(progress(1, 2, 10));

        scheduledTask().run();

        assert delivered.size() == 2 : "One callback per queue item expected";
    }

    @Test
    public void completionFlushesImmediately() {
        ProgressBatcher batcher = new ProgressBatcher(delivered::add, 1500, true, scheduler);

        batcher.update(progress(1, 3, 10));
        batcher.update(progress(1, 10, 10));

        assert delivered.size() == 1 : "Completing update should flush right away";
        assert delivered.get(0).getProgressCurrent() == 10;
        Mockito.verify(scheduledFlush).cancel(false);
    }

    @Test
    public void completionWaitsWhenFlushOnCompleteDisabled() {
        ProgressBatcher batcher = new ProgressBatcher(delivered::add, 1500, false, scheduler);

        batcher.update(progress(1, 10, 10));

        assert delivered.isEmpty();
        scheduledTask().run();
        assert delivered.size() == 1;
    }

    @Test
    public void failingCallbackDoesNotStopOthers() {
        List<Long> seen = new ArrayList<>();
        ProgressBatcher batcher = new ProgressBatcher(update -> {
            seen.add(update.getQueueId());
            if (update.getQueueId() == 1) {
                throw new IllegalStateException("boom");
            }
        }, 1500, true, scheduler);

        batcher.update(progress(1, 1, 10));
        batcher.update(progress(2, 1, 10));
        batcher.flush();

        assert seen.equals(List.of(1L, 2L)) : "Both updates should be delivered, got " + seen;
    }

    @Test
    public void removeDropsBufferedUpdate() {
        ProgressBatcher batcher = new ProgressBatcher(delivered::add, 1500, true, scheduler);

        batcher.update(progress(1, 1, 10));
        batcher.remove(1);
        batcher.flush();

        assert delivered.isEmpty();
    }

}
