package ca.purps.offlinestorage.worker;

import org.testng.annotations.Test;

import ca.purps.offlinestorage.MutableClock;

public class RestartTrackerTest {

    @Test
    public void allowsUpToTheCapInsideTheWindow() {
        MutableClock clock = new MutableClock(0);
        RestartTracker tracker = new RestartTracker(3, 60_000, clock);

        assert tracker.tryAcquire();
        clock.advance(1000);
        assert tracker.tryAcquire();
        clock.advance(1000);
        assert tracker.tryAcquire();
        clock.advance(1000);

        assert !tracker.tryAcquire() : "Fourth attempt inside the window must be denied";
        assert tracker.attemptsInWindow() == 3;
    }

    @Test
    public void oldAttemptsLeaveTheWindow() {
        MutableClock clock = new MutableClock(0);
        RestartTracker tracker = new RestartTracker(2, 10_000, clock);
        tracker.tryAcquire();
        clock.advance(5000);
        tracker.tryAcquire();

        clock.set(10_000);
        assert tracker.attemptsInWindow() == 1 : "First attempt should have expired";
        assert tracker.tryAcquire();
        assert !tracker.tryAcquire();

        clock.set(100_000);
        assert tracker.attemptsInWindow() == 0;
    }

    @Test
    public void zeroCapNeverAllows() {
        RestartTracker tracker = new RestartTracker(0, 60_000, new MutableClock(0));

        assert !tracker.tryAcquire();
        assert tracker.attemptsInWindow() == 0;
    }

    @Test
    public void resetRestoresTheBudget() {
        RestartTracker tracker = new RestartTracker(1, 60_000, new MutableClock(0));
        assert tracker.tryAcquire();
        assert !tracker.tryAcquire();

        tracker.reset();

        assert tracker.tryAcquire();
    }

}
