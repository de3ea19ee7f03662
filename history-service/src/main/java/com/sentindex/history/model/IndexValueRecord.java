package com.sentindex.history.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One computed index value, appended once and never updated.
 *
 * Column mapping (R2DBC snake_case convention):
 *   indexName     → index_name
 *   indexValue    → index_value
 *   coverageRatio → coverage_ratio
 *   savedAt       → saved_at
 *
 * (time, index_name) is unique; {@code id} is a surrogate key for Spring Data.
 * payload: JSON-serialised {@code ProvenanceRecord}
 */
@Data
@NoArgsConstructor
@Table("index_values")
public class IndexValueRecord {

    @Id
    private Long id;

    private Instant time;

    private String indexName;

    private BigDecimal indexValue;

    /** Wire name of the calculation method, e.g. {@code level_normalized}. */
    private String method;

    private BigDecimal coverageRatio;

    /** JSON-serialised {@code ProvenanceRecord} */
    private String payload;

    private Instant savedAt;
}
