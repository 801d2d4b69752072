package com.z254.butterfly.sentinel.enrichment;

import lombok.Builder;
import lombok.Value;

/**
 * Raw answer from an {@link EnrichmentSource}.
 */
@Value
@Builder
public class SourceLookup {

    Object data;

    int resultCount;

    String summary;
}
