package navstack.threading;

import com.google.common.util.concurrent.*;

import java.util.concurrent.*;

import static com.google.common.base.Preconditions.*;

/**
 * An extended executor interface that supports thread affinity assertions and short circuiting. A navigator is
 * pinned to one of these: every stack mutation checks it is running on the executor's thread.
 */
public interface AffinityExecutor extends Executor {
    /** Returns true if the current thread is equal to the thread this executor is backed by. */
    boolean isOnThread();
    /** Throws an IllegalStateException if the current thread is not the thread this executor is backed by. */
    void checkOnThread();

    /**
     * An executor that runs commands immediately when already on the backing thread and queues them otherwise. Used
     * for completion callbacks that may fire on arbitrary threads but must touch navigator state.
     */
    default Executor asap() {
        return command -> {
            if (isOnThread())
                command.run();
            else
                execute(command);
        };
    }

    abstract class BaseAffinityExecutor implements AffinityExecutor {
        @Override
        public abstract boolean isOnThread();

        @Override
        public void checkOnThread() {
            checkState(isOnThread(), "On wrong thread: %s", Thread.currentThread());
        }

        // Must comply with the Executor definition w.r.t. exceptions here.
        @Override
        public abstract void execute(Runnable command);
    }

    AffinityExecutor SAME_THREAD = new BaseAffinityExecutor() {
        @Override
        public boolean isOnThread() {
            return true;
        }

        @Override
        public void execute(Runnable command) {
            command.run();
        }
    };

    /**
     * An executor useful for unit tests: it is backed by the thread that created it, and commands arriving from other
     * threads stack up until that thread runs them with {@link #waitAndRun()}.
     */
    class Gate extends BaseAffinityExecutor {
        private final Thread thisThread = Thread.currentThread();
        private final LinkedBlockingQueue<Runnable> commandQ = new LinkedBlockingQueue<>();
        private final boolean alwaysQueue;

        public Gate() {
            this(false);
        }

        /** If alwaysQueue is true, no thread counts as the backing one, so everything queues. */
        public Gate(boolean alwaysQueue) {
            this.alwaysQueue = alwaysQueue;
        }

        @Override
        public boolean isOnThread() {
            return !alwaysQueue && Thread.currentThread() == thisThread;
        }

        @Override
        public void execute(Runnable command) {
            Uninterruptibles.putUninterruptibly(commandQ, command);
        }

        public void waitAndRun() {
            final Runnable runnable = Uninterruptibles.takeUninterruptibly(commandQ);
            runnable.run();
        }

        public int getTaskQueueSize() {
            return commandQ.size();
        }
    }
}
