package com.eyelevel.videosynthesis.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * The two remote service families, distinguished by how they authenticate and shape responses.
 * {@code outputDirectory} is the sub-directory artifacts of the family are written to.
 */
@Getter
@AllArgsConstructor
public enum ServiceFamily {
    OMNIHUMAN("omnihuman"),
    SEEDANCE("seedance");

    private final String outputDirectory;
}
