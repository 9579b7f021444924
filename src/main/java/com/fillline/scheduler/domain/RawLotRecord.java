package com.fillline.scheduler.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One row as handed over by a tabular lot source. Fields are kept as text; the preflight
 * validator decides what they mean.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RawLotRecord {
    private String id;
    private String type;
    private String vialCount;
}
