package com.eyelevel.videosynthesis.common.apiclient.authentication;

import com.eyelevel.videosynthesis.common.signing.SignableRequest;

/**
 * Defines the contract for applying authentication to an API request.
 *
 * <p>Implementations receive the fully resolved request (absolute URI, final headers, exact body
 * bytes) so that schemes which sign the request content can be applied alongside schemes that
 * only add a static header.
 */
public interface Authentication {

    /**
     * Applies the authentication scheme to the request by adding or replacing headers.
     *
     * @param request the outgoing request. Its headers are mutated in place.
     * @throws com.eyelevel.videosynthesis.exception.ConfigurationException if the credentials the
     *                                                                       scheme needs are missing
     */
    void applyAuthentication(SignableRequest request);
}
