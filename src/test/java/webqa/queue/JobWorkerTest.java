package webqa.queue;

import webqa.WorkerConfig;
import webqa.model.TestCaseJob;

import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link JobWorker} driven by Kafka's {@link MockConsumer}.
 * Each test schedules poll tasks that assign the partition, deliver records
 * and finally stop the worker, so {@link JobWorker#run()} returns on the test thread.
 */
public class JobWorkerTest {

    private static final String TOPIC = "execution_queue";
    private static final TopicPartition TP = new TopicPartition(TOPIC, 0);

    private static final String VALID_JOB = """
            {"test_case_id": "TC_HOME", "target_url": "https://example.com",
             "steps": [{"step_number": 1, "action": "CLICK", "target_element": "Login_Button"}]}
            """;

    private List<TestCaseJob> handled;
    private List<String> deliveries;
    private Map<TopicPartition, OffsetAndMetadata> committedAtStop;

    @BeforeMethod
    public void setup() {
        handled = new ArrayList<>();
        deliveries = new ArrayList<>();
        committedAtStop = new HashMap<>();
    }

    private void record(TestCaseJob job, String deliveryId) {
        handled.add(job);
        deliveries.add(deliveryId);
    }

    private static MockConsumer<String, String> newConsumer() {
        MockConsumer<String, String> consumer = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
        consumer.updateBeginningOffsets(Map.of(TP, 0L));
        return consumer;
    }

    private static void deliver(MockConsumer<String, String> consumer, String... values) {
        consumer.schedulePollTask(() -> {
            consumer.rebalance(List.of(TP));
            for (int i = 0; i < values.length; i++) {
                consumer.addRecord(new ConsumerRecord<>(TOPIC, 0, i, null, values[i]));
            }
        });
    }

    private void stopAfterNextPoll(MockConsumer<String, String> consumer, JobWorker worker) {
        consumer.schedulePollTask(() -> {
            committedAtStop.putAll(consumer.committed(Set.of(TP)));
            worker.stop();
        });
    }

    private JobWorker worker(MockConsumer<String, String> consumer, JobHandler handler) {
        return new JobWorker(() -> consumer, TOPIC, handler, 10, Duration.ofMillis(10));
    }

    // ── Delivery and acknowledgement ──────────────────────────────────────

    @Test
    public void validJob_isHandledThenCommitted() {
        MockConsumer<String, String> consumer = newConsumer();
        JobWorker worker = worker(consumer, this::record);
        deliver(consumer, VALID_JOB);
        stopAfterNextPoll(consumer, worker);

        worker.run();

        assertThat(handled).extracting(TestCaseJob::getTestCaseId).containsExactly("TC_HOME");
        assertThat(deliveries).containsExactly("execution_queue-0@0");
        assertThat(committedAtStop.get(TP).offset()).isEqualTo(1L);
        assertThat(consumer.closed()).isTrue();
        assertThat(worker.isConnected()).isFalse();
    }

    @Test(description = "a malformed message is discarded and acknowledged so it is never redelivered")
    public void malformedJob_isAckedWithoutHandling() {
        MockConsumer<String, String> consumer = newConsumer();
        JobWorker worker = worker(consumer, this::record);
        deliver(consumer, "{not json", VALID_JOB);
        stopAfterNextPoll(consumer, worker);

        worker.run();

        assertThat(handled).hasSize(1);
        assertThat(deliveries).containsExactly("execution_queue-0@1");
        assertThat(committedAtStop.get(TP).offset()).isEqualTo(2L);
    }

    @Test
    public void handlerException_isStillAcked() {
        MockConsumer<String, String> consumer = newConsumer();
        JobWorker worker = worker(consumer, (job, deliveryId) -> {
            throw new IllegalStateException("browser crashed");
        });
        deliver(consumer, VALID_JOB);
        stopAfterNextPoll(consumer, worker);

        worker.run();

        assertThat(committedAtStop.get(TP).offset()).isEqualTo(1L);
    }

    @Test
    public void commitFailure_nacksAndSeeksBack() {
        List<Long> seeks = new ArrayList<>();
        MockConsumer<String, String> consumer = new MockConsumer<>(OffsetResetStrategy.EARLIEST) {
            @Override
            public synchronized void commitSync(Map<TopicPartition, OffsetAndMetadata> offsets) {
                throw new KafkaException("coordinator unavailable");
            }

            @Override
            public synchronized void seek(TopicPartition partition, long offset) {
                seeks.add(offset);
                super.seek(partition, offset);
            }
        };
        consumer.updateBeginningOffsets(Map.of(TP, 0L));
        JobWorker worker = worker(consumer, this::record);
        deliver(consumer, VALID_JOB);
        stopAfterNextPoll(consumer, worker);

        worker.run();

        assertThat(handled).hasSize(1);
        assertThat(seeks).containsExactly(0L);
        assertThat(committedAtStop).isEmpty();
    }

    @Test(description = "two submissions of the same job are distinct deliveries")
    public void sameJobTwice_getsDistinctDeliveryIds() {
        MockConsumer<String, String> consumer = newConsumer();
        JobWorker worker = worker(consumer, this::record);
        deliver(consumer, VALID_JOB, VALID_JOB);
        stopAfterNextPoll(consumer, worker);

        worker.run();

        assertThat(handled).hasSize(2);
        assertThat(deliveries).containsExactly("execution_queue-0@0", "execution_queue-0@1");
    }

    @Test
    public void deliveryId_isTopicPartitionAndOffset() {
        assertThat(JobWorker.deliveryId(new ConsumerRecord<>("live_view_queue", 3, 42L, null, "{}")))
                .isEqualTo("live_view_queue-3@42");
    }

    // ── Connection handling ───────────────────────────────────────────────

    @Test(description = "a broker error closes the consumer and a fresh one resumes consumption")
    public void brokerError_reconnectsWithNewConsumer() {
        MockConsumer<String, String> broken = newConsumer();
        MockConsumer<String, String> healthy = newConsumer();
        Iterator<MockConsumer<String, String>> consumers = List.of(broken, healthy).iterator();
        JobWorker worker = new JobWorker(consumers::next, TOPIC, this::record, 10, Duration.ofMillis(10));

        broken.schedulePollTask(() -> broken.setPollException(new KafkaException("broker down")));
        deliver(healthy, VALID_JOB);
        stopAfterNextPoll(healthy, worker);

        worker.run();

        assertThat(broken.closed()).isTrue();
        assertThat(healthy.closed()).isTrue();
        assertThat(handled).hasSize(1);
        assertThat(consumers.hasNext()).isFalse();
    }

    @Test
    public void stopBeforeRun_endsWithoutConsuming() {
        MockConsumer<String, String> consumer = newConsumer();
        JobWorker worker = worker(consumer, this::record);
        worker.stop();

        worker.run();

        assertThat(handled).isEmpty();
        assertThat(consumer.subscription()).isEmpty();
    }

    // ── Consumer settings ─────────────────────────────────────────────────

    @Test
    public void consumerProperties_oneRecordManualCommit() {
        Properties p = new Properties();
        p.setProperty(WorkerConfig.KEY_BOOTSTRAP_SERVERS, "broker-1:9092");
        Properties props = JobWorker.consumerProperties(WorkerConfig.of(p));

        assertThat(props.get(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG)).isEqualTo("broker-1:9092");
        assertThat(props.get(ConsumerConfig.GROUP_ID_CONFIG)).isEqualTo("execution-agents");
        assertThat(props.get(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG)).isEqualTo("false");
        assertThat(props.get(ConsumerConfig.MAX_POLL_RECORDS_CONFIG)).isEqualTo("1");
        assertThat(props.get(ConsumerConfig.MAX_POLL_INTERVAL_MS_CONFIG)).isEqualTo("1800000");
    }
}
