package com.skillq.spi;

/**
 * Cleans user- or provider-controlled text before it is persisted on a job row.
 */
@FunctionalInterface
public interface ContentSanitizer {

    String sanitize(String value);
}
