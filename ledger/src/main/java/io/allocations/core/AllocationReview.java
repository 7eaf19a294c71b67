package io.allocations.core;

import java.time.Instant;

public record AllocationReview(
        long id,
        long requestId,
        String reviewer,
        AllocationRequest.Status status,
        String publicComments,
        String privateComments,
        Instant dateModified
) {
}
