package com.eyelevel.videosynthesis.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Kinds of generation job. {@code reqKey} is the request key the signed family expects on both
 * submission and status requests; it is null for the token family.
 */
@Getter
@AllArgsConstructor
public enum GenerationJobType {
    OMNIHUMAN_SUBJECT(ServiceFamily.OMNIHUMAN, "realman_avatar_picture_create_role_omni", false),
    OMNIHUMAN_VIDEO(ServiceFamily.OMNIHUMAN, "realman_avatar_picture_omni_v2", true),
    SEEDANCE_VIDEO(ServiceFamily.SEEDANCE, null, true);

    private final ServiceFamily family;
    private final String reqKey;
    /**
     * Whether the result is a URL to download, as opposed to an identifier returned as is.
     */
    private final boolean producesArtifact;
}
