package com.funnelanalytics.domain.journey;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One distinct ordered sequence of event labels and the number of sessions that followed it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EventPath {

    private List<String> path;
    private long count;
}
