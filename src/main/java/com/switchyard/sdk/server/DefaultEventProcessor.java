package com.switchyard.sdk.server;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.launchdarkly.logging.LDLogger;
import com.launchdarkly.logging.LogValues;
import com.switchyard.sdk.ArrayBuilder;
import com.switchyard.sdk.ConfigValue;
import com.switchyard.sdk.server.interfaces.Event;
import com.switchyard.sdk.server.subsystems.EventProcessor;
import com.switchyard.sdk.server.subsystems.EventSender;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Buffers events in memory and delivers them in batches on a single dispatcher thread.
 * <p>
 * A batch is sent when the buffer reaches capacity, when the flush interval elapses, when
 * {@link #flush()} is called, and once more synchronously during {@link #close()}. Pending
 * diagnostics markers ride along with each batch.
 */
final class DefaultEventProcessor implements EventProcessor {
  static final int DEFAULT_CAPACITY = 1000;
  static final Duration DEFAULT_FLUSH_INTERVAL = Duration.ofSeconds(60);
  
  private static final int MESSAGE_BATCH_SIZE = 50;

  private final BlockingQueue<EventProcessorMessage> inbox;
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private final ScheduledFuture<?> flushTask;
  private volatile boolean inputCapacityExceeded = false;
  private final LDLogger logger;

  DefaultEventProcessor(
      EventSender eventSender,
      URI eventsBaseUri,
      int capacity,
      Duration flushInterval,
      ConfigValue sdkMetadata,
      Diagnostics diagnostics,
      ErrorBoundary errorBoundary,
      ScheduledExecutorService sharedExecutor,
      LDLogger logger
      ) {
    int bufferCapacity = capacity <= 0 ? DEFAULT_CAPACITY : capacity;
    this.inbox = new ArrayBlockingQueue<>(bufferCapacity * 2);
    this.logger = logger;
    
    EventDispatcher dispatcher = new EventDispatcher(eventSender, eventsBaseUri, bufferCapacity, sdkMetadata,
        diagnostics, errorBoundary, inbox, closed, logger);
    ThreadFactory threadFactory = new ThreadFactoryBuilder()
        .setDaemon(true)
        .setNameFormat("Switchyard-event-dispatcher-%d")
        .setUncaughtExceptionHandler(dispatcher::onUncaughtException)
        .build();
    threadFactory.newThread(dispatcher::runMainLoop).start();
    
    long intervalMillis = (flushInterval == null ? DEFAULT_FLUSH_INTERVAL : flushInterval).toMillis();
    this.flushTask = sharedExecutor.scheduleAtFixedRate(this::flush, intervalMillis, intervalMillis,
        TimeUnit.MILLISECONDS);
  }

  @Override
  public void sendEvent(Event e) {
    if (!closed.get()) {
      postToChannel(new EventProcessorMessage(MessageType.EVENT, e, false));
    }
  }

  @Override
  public void flush() {
    if (!closed.get()) {
      postToChannel(new EventProcessorMessage(MessageType.FLUSH, null, false));
    }
  }

  @Override
  public void close() throws IOException {
    if (closed.compareAndSet(false, true)) {
      flushTask.cancel(false);
      postMessageAndWait(MessageType.SHUTDOWN);
    }
  }

  @VisibleForTesting
  void waitUntilInactive() {
    postMessageAndWait(MessageType.SYNC);
  }

  private void postMessageAndWait(MessageType type) {
    EventProcessorMessage message = new EventProcessorMessage(type, null, true);
    if (postToChannel(message)) {
      message.waitForCompletion();
    }
  }
  
  private boolean postToChannel(EventProcessorMessage message) {
    if (inbox.offer(message)) {
      return true;
    }
    // The dispatcher is badly backed up. Blocking here would slow down every evaluating thread of the
    // application, so the message is dropped instead, and the warning is only logged once.
    boolean alreadyLogged = inputCapacityExceeded;
    inputCapacityExceeded = true;
    if (!alreadyLogged) {
      logger.warn("Events are being produced faster than they can be processed; some events will be dropped");
    }
    return false;
  }

  private static enum MessageType {
    EVENT,
    FLUSH,
    SYNC,
    SHUTDOWN
  }

  private static final class EventProcessorMessage {
    private final MessageType type;
    private final Event event;
    private final Semaphore reply;

    private EventProcessorMessage(MessageType type, Event event, boolean sync) {
      this.type = type;
      this.event = event;
      reply = sync ? new Semaphore(0) : null;
    }

    void completed() {
      if (reply != null) {
        reply.release();
      }
    }

    void waitForCompletion() {
      if (reply == null) {
        return;
      }
      reply.acquireUninterruptibly();
    }
  }

  /**
   * Owns the event buffer. Everything here runs on the dispatcher thread, so the buffer needs no
   * synchronization.
   */
  static final class EventDispatcher {
    private final EventSender eventSender;
    private final URI eventsBaseUri;
    private final int capacity;
    private final ConfigValue sdkMetadata;
    private final Diagnostics diagnostics;
    private final ErrorBoundary errorBoundary;
    private final BlockingQueue<EventProcessorMessage> inbox;
    private final AtomicBoolean closed;
    private final LDLogger logger;
    private final List<Event> buffer = new ArrayList<>();
    private boolean disabled = false;
    
    EventDispatcher(
        EventSender eventSender,
        URI eventsBaseUri,
        int capacity,
        ConfigValue sdkMetadata,
        Diagnostics diagnostics,
        ErrorBoundary errorBoundary,
        BlockingQueue<EventProcessorMessage> inbox,
        AtomicBoolean closed,
        LDLogger logger
        ) {
      this.eventSender = eventSender;
      this.eventsBaseUri = eventsBaseUri;
      this.capacity = capacity;
      this.sdkMetadata = sdkMetadata;
      this.diagnostics = diagnostics;
      this.errorBoundary = errorBoundary;
      this.inbox = inbox;
      this.closed = closed;
      this.logger = logger;
    }
    
    private void runMainLoop() {
      List<EventProcessorMessage> batch = new ArrayList<>(MESSAGE_BATCH_SIZE);
      while (true) {
        try {
          batch.clear();
          batch.add(inbox.take());
          inbox.drainTo(batch, MESSAGE_BATCH_SIZE - 1);
          for (EventProcessorMessage message: batch) {
            switch (message.type) {
            case EVENT:
              processEvent(message.event);
              break;
            case FLUSH:
              sendBuffered();
              break;
            case SYNC:
              break;
            case SHUTDOWN:
              sendBuffered();
              doShutdown();
              message.completed();
              return;
            }
            message.completed();
          }
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          logger.warn("Event dispatcher was interrupted; pending events are discarded");
          closed.set(true);
          releaseWaiters();
          return;
        } catch (Exception e) {
          logger.error("Unexpected error in event processor: {}", LogValues.exceptionSummary(e));
          logger.debug(LogValues.exceptionTrace(e));
        }
      }
    }
    
    private void onUncaughtException(Thread thread, Throwable e) {
      // The main loop catches all exceptions, so only an Error gets here. Shut down in an orderly way so
      // that no caller blocks on a queue that is no longer consumed.
      logger.error("Event dispatcher thread was terminated by an unrecoverable error. No more events will be sent. {} {}",
          LogValues.exceptionSummary(e), LogValues.exceptionTrace(e));
      closed.set(true);
      releaseWaiters();
    }
    
    private void releaseWaiters() {
      List<EventProcessorMessage> messages = new ArrayList<>();
      inbox.drainTo(messages);
      for (EventProcessorMessage m: messages) {
        m.completed();
      }
    }
    
    private void processEvent(Event e) {
      if (disabled || e == null) {
        return;
      }
      buffer.add(e);
      if (buffer.size() >= capacity) {
        sendBuffered();
      }
    }
    
    private void sendBuffered() {
      if (disabled) {
        buffer.clear();
        return;
      }
      if (diagnostics != null) {
        buffer.addAll(diagnostics.drainEvents());
      }
      if (buffer.isEmpty()) {
        return;
      }
      List<Event> events = new ArrayList<>(buffer);
      buffer.clear();
      
      ArrayBuilder eventsArray = ConfigValue.buildArray();
      for (Event e: events) {
        eventsArray.add(e.toValue());
      }
      String payload = ConfigValue.buildObject()
          .put("events", eventsArray.build())
          .put("switchyardMetadata", sdkMetadata)
          .build()
          .toJsonString();
      
      EventSender.Result result = eventSender.sendEventData(payload, events.size(), eventsBaseUri);
      switch (result) {
      case SUCCESS:
        break;
      case STOP:
        logger.error("Event delivery was rejected permanently; no more events will be sent");
        disabled = true;
        break;
      default:
        errorBoundary.logException("flushEvents",
            new IOException("Failed to log " + events.size() + " events"), false);
        break;
      }
    }
    
    private void doShutdown() {
      disabled = true;
      try {
        eventSender.close();
      } catch (IOException e) {
        logger.error("Unexpected error when closing event sender: {}", LogValues.exceptionSummary(e));
        logger.debug(LogValues.exceptionTrace(e));
      }
    }
  }
}
