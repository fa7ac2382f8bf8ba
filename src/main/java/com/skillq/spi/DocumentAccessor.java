package com.skillq.spi;

import java.io.IOException;

/**
 * Reads uploaded documents from wherever the host application stores them.
 */
@FunctionalInterface
public interface DocumentAccessor {

    byte[] read(String storagePath) throws IOException;
}
