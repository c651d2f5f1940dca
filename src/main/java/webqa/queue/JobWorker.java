package webqa.queue;

import webqa.WorkerConfig;
import webqa.model.JobCodec;
import webqa.model.MalformedJobException;
import webqa.model.TestCaseJob;

import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.WakeupException;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.function.Supplier;

/**
 * Blocking consume loop for one job topic.
 *
 * <p>Delivery is at-least-once with one job in flight: the consumer fetches a
 * single record per poll and commits its offset only after the job has been
 * handled. Every handled job is acknowledged, including malformed ones and
 * jobs whose handler threw. When the commit fails the consumer seeks back to
 * the record so it is delivered again.
 *
 * <p>Broker failures outside job handling close the consumer; a new one is
 * created after a fixed backoff, indefinitely, until {@link #stop()}.
 */
public class JobWorker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(JobWorker.class);

    /** Final state of one delivered message. */
    public enum Acknowledgement { ACKED, NACKED }

    private final Supplier<Consumer<String, String>> consumerFactory;
    private final String topic;
    private final JobHandler handler;
    private final long reconnectBackoffMs;
    private final Duration pollTimeout;

    private volatile boolean running = true;
    private volatile boolean connected;
    private volatile Consumer<String, String> consumer;

    public JobWorker(Supplier<Consumer<String, String>> consumerFactory,
                     String topic,
                     JobHandler handler,
                     long reconnectBackoffMs,
                     Duration pollTimeout) {
        this.consumerFactory    = consumerFactory;
        this.topic              = topic;
        this.handler            = handler;
        this.reconnectBackoffMs = reconnectBackoffMs;
        this.pollTimeout        = pollTimeout;
    }

    /** Consumer settings for one-at-a-time, manually committed delivery. */
    public static Properties consumerProperties(WorkerConfig config) {
        Properties props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getBootstrapServers());
        props.put(ConsumerConfig.GROUP_ID_CONFIG, config.getGroupId());
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");
        props.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, "1");
        props.put(ConsumerConfig.MAX_POLL_INTERVAL_MS_CONFIG, String.valueOf(config.getMaxPollIntervalMs()));
        return props;
    }

    // ── Loop ──────────────────────────────────────────────────────────────

    @Override
    public void run() {
        log.info("JobWorker: consuming '{}'", topic);
        try {
            while (running) {
                try {
                    if (consumer == null) {
                        connect();
                    }
                    ConsumerRecords<String, String> records = consumer.poll(pollTimeout);
                    connected = true;
                    for (ConsumerRecord<String, String> record : records) {
                        process(record);
                    }
                } catch (WakeupException e) {
                    if (running) {
                        log.debug("JobWorker: spurious wakeup, continuing");
                    }
                } catch (KafkaException e) {
                    if (!running) break;
                    log.error("JobWorker: broker error on '{}', reconnecting in {}ms: {}",
                            topic, reconnectBackoffMs, e.getMessage());
                    disconnect();
                    sleepBackoff();
                }
            }
        } finally {
            disconnect();
            log.info("JobWorker: stopped consuming '{}'", topic);
        }
    }

    /** Ends the loop once the in-flight job, if any, has been handled. */
    public void stop() {
        running = false;
        Consumer<String, String> c = consumer;
        if (c != null) {
            c.wakeup();
        }
    }

    public boolean isConnected() {
        return connected;
    }

    // ── Per message ───────────────────────────────────────────────────────

    /**
     * Handles one delivered record and acknowledges it.
     *
     * @return {@link Acknowledgement#NACKED} only when the offset commit failed
     */
    Acknowledgement process(ConsumerRecord<String, String> record) {
        String deliveryId = deliveryId(record);
        log.info("JobWorker: received {}", deliveryId);
        try {
            TestCaseJob job = JobCodec.decode(record.value());
            handler.handle(job, deliveryId);
        } catch (MalformedJobException e) {
            log.error("JobWorker: discarding malformed job at {}-{}@{}: {}",
                    record.topic(), record.partition(), record.offset(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("JobWorker: job at {}-{}@{} failed unexpectedly, acknowledging anyway",
                    record.topic(), record.partition(), record.offset(), e);
        }
        return acknowledge(record);
    }

    static String deliveryId(ConsumerRecord<?, ?> record) {
        return record.topic() + "-" + record.partition() + "@" + record.offset();
    }

    private Acknowledgement acknowledge(ConsumerRecord<String, String> record) {
        TopicPartition tp = new TopicPartition(record.topic(), record.partition());
        Map<TopicPartition, OffsetAndMetadata> offsets = Map.of(tp, new OffsetAndMetadata(record.offset() + 1));
        try {
            try {
                consumer.commitSync(offsets);
            } catch (WakeupException e) {
                // stop() raced with the commit; the wakeup is consumed, so retry once
                consumer.commitSync(offsets);
            }
            log.debug("JobWorker: acked {}-{}@{}", record.topic(), record.partition(), record.offset());
            return Acknowledgement.ACKED;
        } catch (KafkaException e) {
            log.warn("JobWorker: commit failed for {}-{}@{}, requeueing: {}",
                    record.topic(), record.partition(), record.offset(), e.getMessage());
            requeue(tp, record.offset());
            return Acknowledgement.NACKED;
        }
    }

    private void requeue(TopicPartition tp, long offset) {
        try {
            consumer.seek(tp, offset);
        } catch (RuntimeException e) {
            // Partition no longer assigned: its new owner resumes from the last committed offset.
            log.warn("JobWorker: could not seek {} to {}: {}", tp, offset, e.getMessage());
        }
    }

    // ── Connection ────────────────────────────────────────────────────────

    private void connect() {
        Consumer<String, String> c = consumerFactory.get();
        consumer = c;
        c.subscribe(List.of(topic));
        log.info("JobWorker: subscribed to '{}'", topic);
    }

    private void disconnect() {
        connected = false;
        Consumer<String, String> c = consumer;
        consumer = null;
        if (c == null) return;
        try {
            c.close();
        } catch (RuntimeException e) {
            log.warn("JobWorker: error closing consumer: {}", e.getMessage());
        }
    }

    private void sleepBackoff() {
        try {
            Thread.sleep(reconnectBackoffMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running = false;
        }
    }
}
