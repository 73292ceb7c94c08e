package com.pbscache.collector.publish;

import com.pbscache.core.error.PublicationException;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Per-destination outcome of one publication, in destination order.
 */
@Value
public class PublicationReport {

    List<DestinationResult> results;

    /**
     * Publication policy: a document counts as published when the first (primary) destination accepted it.
     */
    public boolean isPublished() {
        return !results.isEmpty() && results.get(0).isSuccess();
    }

    public List<PublicationException> failures() {
        return results.stream()
            .filter(r -> !r.isSuccess())
            .map(DestinationResult::getError)
            .collect(Collectors.toList());
    }

    @Value
    public static class DestinationResult {
        String destination;
        PublicationException error;

        public boolean isSuccess() {
            return error == null;
        }

        static DestinationResult ok(String destination) {
            return new DestinationResult(destination, null);
        }

        static DestinationResult failed(PublicationException error) {
            return new DestinationResult(error.getDestination(), error);
        }
    }
}
