package webqa.queue;

import webqa.model.TestCaseJob;

/** Receives each decoded job; returns once the job's runs have been reported. */
@FunctionalInterface
public interface JobHandler {

    /**
     * @param deliveryId the record's {@code topic-partition@offset}; a redelivery
     *                   of the same record carries the same id
     */
    void handle(TestCaseJob job, String deliveryId);
}
