package com.eyelevel.videosynthesis.common.signing;

/**
 * Binds a derived signing key to a single day, region and service.
 *
 * @param date    UTC day in {@code yyyyMMdd} form
 * @param region  service region, e.g. {@code cn-north-1}
 * @param service service name, e.g. {@code cv}
 */
public record SigningScope(String date, String region, String service) {

    public static final String TERMINATOR = "request";

    /**
     * @return {@code date/region/service/request}, as it appears in the string to sign and in the
     * Credential part of the Authorization header
     */
    public String credentialScope() {
        return date + "/" + region + "/" + service + "/" + TERMINATOR;
    }
}
