package org.neuralchilli.qrun.worker;

import java.io.PrintStream;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Console shared by concurrently running tasks.
 * One lock guards every write so that a chunk or a grouped block is never
 * interleaved with another task's output. It does not serialize task execution.
 */
public class ConsoleSink {

    private final PrintStream out;
    private final PrintStream err;
    private final Lock lock = new ReentrantLock();

    public ConsoleSink(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static ConsoleSink system() {
        return new ConsoleSink(System.out, System.err);
    }

    public void writeStdout(byte[] buffer, int offset, int length) {
        write(out, buffer, offset, length);
    }

    public void writeStderr(byte[] buffer, int offset, int length) {
        write(err, buffer, offset, length);
    }

    /**
     * Print a finished task's captured output as one uninterrupted block.
     */
    public void printGroup(String taskId, byte[] stdout, byte[] stderr) {
        if (stdout.length == 0 && stderr.length == 0) {
            return;
        }

        lock.lock();
        try {
            out.println("--- " + taskId + " ---");
            if (stdout.length > 0) {
                out.write(stdout, 0, stdout.length);
                if (stdout[stdout.length - 1] != '\n') {
                    out.println();
                }
            }
            out.flush();
            if (stderr.length > 0) {
                err.write(stderr, 0, stderr.length);
                if (stderr[stderr.length - 1] != '\n') {
                    err.println();
                }
                err.flush();
            }
        } finally {
            lock.unlock();
        }
    }

    public void println(String line) {
        lock.lock();
        try {
            out.println(line);
            out.flush();
        } finally {
            lock.unlock();
        }
    }

    private void write(PrintStream stream, byte[] buffer, int offset, int length) {
        lock.lock();
        try {
            stream.write(buffer, offset, length);
            stream.flush();
        } finally {
            lock.unlock();
        }
    }
}
