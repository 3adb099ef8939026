package blitz.engine.service.process;

import blitz.engine.model.ProcessOutput;

import java.util.List;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Output stream of one supervised command. Lines arrive in the order they were
 * read per stream, and the stream always ends with exactly one terminal element.
 */
public class ProcessRun {
    private final List<String> command;
    private final LinkedBlockingQueue<ProcessOutput> queue = new LinkedBlockingQueue<>();
    private final AtomicBoolean terminated = new AtomicBoolean();
    private volatile boolean drained;

    public ProcessRun(List<String> command) {
        this.command = List.copyOf(command);
    }

    public List<String> getCommand() {
        return command;
    }

    /**
     * Queues a line. Ignored once the run has terminated.
     */
    public void emit(ProcessOutput output) {
        if (output.isTerminal()) {
            terminate(output);
        } else if (!terminated.get()) {
            queue.add(output);
        }
    }

    /**
     * Ends the stream. Only the first terminal element is kept.
     */
    public boolean terminate(ProcessOutput terminal) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal output: " + terminal);
        }
        if (terminated.compareAndSet(false, true)) {
            queue.add(terminal);
            return true;
        }
        return false;
    }

    /**
     * Blocks for the next element.
     *
     * @return the next element, or {@code null} once the terminal element has been consumed
     */
    public ProcessOutput next() throws InterruptedException {
        if (drained) {
            return null;
        }
        ProcessOutput output = queue.take();
        if (output.isTerminal()) {
            drained = true;
        }
        return output;
    }

    /**
     * Drains the stream and returns its terminal element.
     */
    public ProcessOutput await() throws InterruptedException {
        ProcessOutput last = null;
        ProcessOutput output;
        while ((output = next()) != null) {
            last = output;
        }
        return last;
    }
}
