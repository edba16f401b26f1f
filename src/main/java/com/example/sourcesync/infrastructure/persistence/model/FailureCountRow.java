package com.example.sourcesync.infrastructure.persistence.model;

import lombok.Data;

/**
 * One GROUP BY bucket of the failure statistics queries.
 */
@Data
public class FailureCountRow {

    private String groupKey;

    private Long total;
}
