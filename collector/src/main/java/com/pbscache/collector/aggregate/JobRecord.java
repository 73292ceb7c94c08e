package com.pbscache.collector.aggregate;

import com.fasterxml.jackson.databind.JsonNode;
import com.pbscache.core.model.ResourcePair;
import lombok.Builder;
import lombok.Value;

/**
 * Typed view of one {@code qstat -f} job record.
 */
@Value
@Builder
public class JobRecord {

    public enum State {
        RUNNING,
        QUEUED,
        /**
         * Held, exiting, finished, array parents and everything else; not counted.
         */
        OTHER;

        static State of(String jobState) {
            if ("R".equals(jobState)) {
                return RUNNING;
            }
            if ("Q".equals(jobState)) {
                return QUEUED;
            }
            return OTHER;
        }
    }

    String id;
    String queue;
    State state;
    String rawState;
    ResourcePair requested;
    String owner;

    public static JobRecord from(String id, JsonNode record) {
        String rawState = PbsAttributes.text(record, null, "job_state");
        return JobRecord.builder()
            .id(id)
            .queue(PbsAttributes.text(record, null, "queue"))
            .state(State.of(rawState))
            .rawState(rawState)
            .requested(ResourcePair.of(
                PbsAttributes.intValue(record, "Resource_List", "ncpus"),
                PbsAttributes.intValue(record, "Resource_List", "ngpus")))
            .owner(owner(record))
            .build();
    }

    /**
     * Execution user, falling back to the user part of {@code Job_Owner} ({@code user@host}).
     */
    private static String owner(JsonNode record) {
        String euser = PbsAttributes.text(record, null, "euser");
        if (euser != null) {
            return euser;
        }
        String jobOwner = PbsAttributes.text(record, null, "Job_Owner");
        if (jobOwner == null) {
            return null;
        }
        int at = jobOwner.indexOf('@');
        return at < 0 ? jobOwner : jobOwner.substring(0, at);
    }
}
