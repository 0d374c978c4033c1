package com.github.bnbjava.search;

import com.google.errorprone.annotations.concurrent.GuardedBy;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;

/**
 * A fixed pool of worker threads shared by the {@link Job} instances of one solver. Each thread repeatedly takes one
 * node from the job that has used the least time so far, processes it outside any lock, and reports completion.
 * Threads with nothing to do wait until nodes are queued.
 */
class Scheduler implements AutoCloseable {
    private static final AtomicInteger POOL_NUMBER = new AtomicInteger();

    @GuardedBy("jobs")
    private boolean shuttingDown = false;
    private final List<Job> jobs = new ArrayList<>();
    private final List<Thread> threads;

    Scheduler(int threadCount) {
        var prefix = "bnbSolver-" + POOL_NUMBER.incrementAndGet() + "-";

        threads = IntStream.range(0, threadCount).mapToObj(i -> {
            var thread = new Thread(this::runWorker, prefix + (i + 1));
            thread.setDaemon(true);
            return thread;
        }).toList();

        threads.forEach(Thread::start);
    }

    private void runWorker() {
        while (true) {
            Job job;
            Node node;

            synchronized (jobs) {
                var optional = jobs.stream().filter(Job::hasWork).min(Comparator.comparing(Job::totalTime));
                if (optional.isEmpty()) {
                    if (shuttingDown && jobs.isEmpty()) {
                        return;
                    }
                    try {
                        jobs.wait();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return;
                    }
                    continue;
                }
                job = optional.get();
                node = job.nextNode();
                if (node == null) {
                    continue;
                }
            }

            var start = System.nanoTime();
            try {
                job.getWorker().process(job, node);
            } catch (RuntimeException | Error e) {
                job.fail(e);
            } finally {
                job.nodeComplete(System.nanoTime() - start);
            }
        }
    }

    void register(Job job) {
        synchronized (jobs) {
            if (shuttingDown) {
                throw new RejectedExecutionException();
            }
            jobs.add(job);
            jobs.forEach(Job::resetTime);
            jobs.notifyAll();
        }
    }

    void deregister(Job job) {
        synchronized (jobs) {
            jobs.remove(job);
            if (shuttingDown && jobs.isEmpty()) {
                jobs.notifyAll();
            }
        }
    }

    /**
     * Initiate an orderly shutdown in which no new {@link Job} instances can be registered, but existing jobs will be
     * allowed to run to completion.
     */
    @Override
    public void close() {
        synchronized (jobs) {
            shuttingDown = true;
            jobs.notifyAll();
        }
        for (var t : threads) {
            try {
                t.join();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    void queueNodes(Job job, List<Node> nodes) {
        synchronized (jobs) {
            job.insertNodes(nodes);
            jobs.notifyAll();
        }
    }
}
