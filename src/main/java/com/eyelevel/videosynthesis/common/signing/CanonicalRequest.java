package com.eyelevel.videosynthesis.common.signing;

/**
 * Byte-exact serialization of a request used as signing input. Built once and hashed once.
 *
 * @param value         the newline-delimited canonical request
 * @param signedHeaders sorted, semicolon-joined lower-case header names
 * @param payloadHash   hex SHA-256 of the body
 */
public record CanonicalRequest(String value, String signedHeaders, String payloadHash) {
}
