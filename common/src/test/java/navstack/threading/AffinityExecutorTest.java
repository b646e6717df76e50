package navstack.threading;

import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class AffinityExecutorTest {
    @Test
    public void asapShortCircuitsOnTheBackingThread() throws Exception {
        AffinityExecutor.Gate gate = new AffinityExecutor.Gate();
        List<String> ran = new ArrayList<>();
        assertTrue(gate.isOnThread());
        gate.checkOnThread();
        gate.asap().execute(() -> ran.add("now"));
        assertEquals(1, ran.size());

        Thread thread = new Thread(() -> gate.asap().execute(() -> ran.add("later")));
        thread.start();
        thread.join();
        assertEquals(1, ran.size());
        assertEquals(1, gate.getTaskQueueSize());
        gate.waitAndRun();
        assertEquals("later", ran.get(1));
    }

    @Test
    public void queueingGateDefersEverything() throws Exception {
        AffinityExecutor.Gate gate = new AffinityExecutor.Gate(true);
        List<String> ran = new ArrayList<>();
        gate.asap().execute(() -> ran.add("queued"));
        assertTrue(ran.isEmpty());
        assertEquals(1, gate.getTaskQueueSize());
        gate.waitAndRun();
        assertEquals(1, ran.size());
        try {
            gate.checkOnThread();
            fail();
        } catch (IllegalStateException e) {
            // Expected.
        }
    }

    @Test
    public void sameThreadRunsEverythingInline() throws Exception {
        List<String> ran = new ArrayList<>();
        Thread thread = new Thread(() -> {
            AffinityExecutor.SAME_THREAD.checkOnThread();
            AffinityExecutor.SAME_THREAD.asap().execute(() -> ran.add("inline"));
        });
        thread.start();
        thread.join();
        assertEquals(1, ran.size());
    }
}
