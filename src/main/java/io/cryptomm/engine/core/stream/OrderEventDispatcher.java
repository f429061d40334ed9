package io.cryptomm.engine.core.stream;

import io.cryptomm.engine.config.EngineProperties;
import io.cryptomm.engine.core.event.OrderFillEvent;
import io.cryptomm.engine.core.event.OrderUpdateEvent;
import io.cryptomm.engine.core.order.OrderManager;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Event ingestion thread. Order events from the exchange stream are queued and
 * applied to the {@link OrderManager} one at a time, in arrival order.
 * The worker's {@link Future} is the cancellation token used by {@link #stop()}.
 */
@Slf4j
@Component
public class OrderEventDispatcher {
    private final OrderManager orderManager;
    private final BlockingQueue<Object> queue;
    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    private ExecutorService worker;
    private Future<?> running;

    public OrderEventDispatcher(OrderManager orderManager, EngineProperties properties) {
        this.orderManager = orderManager;
        this.queue = new ArrayBlockingQueue<>(properties.getEvents().getQueueCapacity());
    }

    @PostConstruct
    public synchronized void start() {
        if (running != null && !running.isDone()) {
            return;
        }
        worker = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "order-events");
            t.setDaemon(true);
            return t;
        });
        running = worker.submit(this::drain);
        log.info("Order event dispatcher started (capacity {})", queue.remainingCapacity() + queue.size());
    }

    @PreDestroy
    public synchronized void stop() {
        if (running == null) {
            return;
        }
        running.cancel(true);
        worker.shutdownNow();
        try {
            if (!worker.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Order event worker did not stop in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        running = null;
        log.info("Order event dispatcher stopped: processed={}, failed={}, dropped={}",
                processed.get(), failed.get(), queue.size());
        queue.clear();
    }

    public boolean isRunning() {
        Future<?> current = running;
        return current != null && !current.isDone();
    }

    @EventListener
    public void onOrderUpdate(OrderUpdateEvent event) {
        submit(event);
    }

    @EventListener
    public void onOrderFill(OrderFillEvent event) {
        submit(event);
    }

    public void submit(OrderUpdateEvent event) {
        enqueue(event);
    }

    public void submit(OrderFillEvent event) {
        enqueue(event);
    }

    public long getProcessedCount() {
        return processed.get();
    }

    public long getFailedCount() {
        return failed.get();
    }

    public int getQueueSize() {
        return queue.size();
    }

    private void enqueue(Object event) {
        try {
            queue.put(event);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while queueing {}", event);
        }
    }

    private void drain() {
        while (!Thread.currentThread().isInterrupted()) {
            Object event;
            try {
                event = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            dispatch(event);
        }
        log.debug("Order event worker exiting");
    }

    private void dispatch(Object event) {
        try {
            if (event instanceof OrderFillEvent fill) {
                orderManager.handleOrderFill(fill);
            } else if (event instanceof OrderUpdateEvent update) {
                orderManager.handleOrderUpdate(update);
            }
            processed.incrementAndGet();
        } catch (RuntimeException e) {
            failed.incrementAndGet();
            log.error("Failed to apply {}", event, e);
        }
    }
}
