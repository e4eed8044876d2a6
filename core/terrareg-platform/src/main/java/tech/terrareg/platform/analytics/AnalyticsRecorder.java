package tech.terrareg.platform.analytics;

import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.terrareg.platform.shared.TsidGenerator;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Best-effort download recording.
 *
 * Downloads enqueue into a bounded queue and return immediately; a single worker
 * thread writes events to the repository in small batches. When the queue stays
 * full for longer than the offer timeout the event is dropped and counted.
 * Recording is at-most-once.
 */
@ApplicationScoped
public class AnalyticsRecorder {

    private static final Logger LOG = Logger.getLogger(AnalyticsRecorder.class);

    static final int QUEUE_CAPACITY = 10_000;
    static final long OFFER_TIMEOUT_MILLIS = 50;
    private static final int BATCH_SIZE = 100;

    private final BlockingQueue<AnalyticsEvent> queue = new ArrayBlockingQueue<>(QUEUE_CAPACITY);
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong dropped = new AtomicLong();

    private Thread worker;

    @Inject
    AnalyticsEventRepository analyticsEventRepository;

    void onStart(@Observes StartupEvent event) {
        start();
    }

    void onShutdown(@Observes ShutdownEvent event) {
        stop();
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            worker = new Thread(this::processLoop, "analytics-recorder");
            worker.setDaemon(true);
            worker.start();
            LOG.info("Analytics recorder started");
        }
    }

    public void stop() {
        if (running.compareAndSet(true, false)) {
            worker.interrupt();
            try {
                worker.join(TimeUnit.SECONDS.toMillis(5));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            int flushed = drainPending();
            LOG.infof("Analytics recorder stopped (flushed %d, dropped %d)", flushed, dropped.get());
        }
    }

    /**
     * Enqueue an event, waiting at most {@link #OFFER_TIMEOUT_MILLIS}.
     *
     * @return false if the event was dropped
     */
    public boolean record(AnalyticsEvent event) {
        try {
            if (queue.offer(event, OFFER_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS)) {
                return true;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        long total = dropped.incrementAndGet();
        LOG.warnf("Analytics queue full, dropped download event for module version %d (%d dropped so far)",
            event.moduleVersionId, total);
        return false;
    }

    /**
     * Write every queued event on the calling thread.
     *
     * @return number of events written
     */
    public int drainPending() {
        int written = 0;
        List<AnalyticsEvent> batch = new ArrayList<>(BATCH_SIZE);
        while (queue.drainTo(batch, BATCH_SIZE) > 0) {
            written += write(batch);
            batch.clear();
        }
        return written;
    }

    public int pendingCount() {
        return queue.size();
    }

    public long droppedCount() {
        return dropped.get();
    }

    private void processLoop() {
        List<AnalyticsEvent> batch = new ArrayList<>(BATCH_SIZE);
        while (running.get()) {
            try {
                AnalyticsEvent first = queue.poll(1, TimeUnit.SECONDS);
                if (first == null) {
                    continue;
                }
                batch.add(first);
                queue.drainTo(batch, BATCH_SIZE - 1);
                write(batch);
                batch.clear();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private int write(List<AnalyticsEvent> batch) {
        int written = 0;
        for (AnalyticsEvent event : batch) {
            try {
                if (event.id == null) {
                    event.id = TsidGenerator.generate();
                }
                analyticsEventRepository.persist(event);
                written++;
            } catch (RuntimeException e) {
                LOG.errorf(e, "Failed to record download of module version %d", event.moduleVersionId);
            }
        }
        if (written > 0) {
            LOG.debugf("Recorded %d download events", written);
        }
        return written;
    }
}
