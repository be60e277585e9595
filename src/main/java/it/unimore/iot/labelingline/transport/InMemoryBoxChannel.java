package it.unimore.iot.labelingline.transport;

import it.unimore.iot.labelingline.exception.TransportException;
import it.unimore.iot.labelingline.model.Box;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Canale ordinato in memoria fra generatore e motore di coordinamento, per
 * l'esecuzione nello stesso processo.
 */
public class InMemoryBoxChannel implements BoxSource, BoxSink {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryBoxChannel.class);
    private static final long DEFAULT_POLL_MILLIS = 200;

    private final BlockingQueue<Box> queue;
    private final long pollMillis;
    private volatile boolean completed;

    public InMemoryBoxChannel() {
        this(Integer.MAX_VALUE, DEFAULT_POLL_MILLIS);
    }

    public InMemoryBoxChannel(int capacity, long pollMillis) {
        this.queue = new LinkedBlockingQueue<>(capacity);
        this.pollMillis = pollMillis;
    }

    @Override
    public void send(Box box) throws TransportException {
        if (completed) {
            throw new TransportException("Channel already completed", box.getId(), null);
        }
        if (!queue.offer(box)) {
            throw new TransportException("Channel full, box dropped", box.getId(), null);
        }
        logger.debug("Box {} queued ({} pending)", box.getId(), queue.size());
    }

    @Override
    public void complete() {
        this.completed = true;
        logger.info("Box stream completed, {} box(es) still pending", queue.size());
    }

    @Override
    public Optional<Box> receiveNextBox(boolean blocking) throws InterruptedException {
        Box box = blocking ? queue.poll(pollMillis, TimeUnit.MILLISECONDS) : queue.poll();
        return Optional.ofNullable(box);
    }

    @Override
    public boolean isExhausted() {
        return completed && queue.isEmpty();
    }

    public int pending() {
        return queue.size();
    }
}
