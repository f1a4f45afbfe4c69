package com.venuevibe.orchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A single customer or reference review attached to a venue.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Review {

    private String author;

    /**
     * 1 to 5.
     */
    private double rating;

    private String text;

    /**
     * Epoch seconds.
     */
    private long time;
}
