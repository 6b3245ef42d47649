package com.polyspike.hft.engine.supervisor;

/**
 * A long-running engine loop. {@link #run()} is expected to return only once shutdown has been requested; any earlier
 * return or exception makes the supervisor restart it.
 */
public interface SupervisedTask {

    String name();

    void run() throws Exception;
}
