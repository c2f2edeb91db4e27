package com.example.partstream.part;

/**
 * Computes the value of a part. The returned value must be JSON-serializable.
 */
@FunctionalInterface
public interface PartProducer {

    Object produce(PartContext context) throws Exception;
}
