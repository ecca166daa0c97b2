package com.questrail.fasttest.api;

/**
 * A deferred, zero-argument unit of test logic.
 * <p>
 * Procedures may throw anything. The executing test case classifies what
 * escapes: an assertion failure marks the case failed, anything else marks it
 * errored.
 */
@FunctionalInterface
public interface TestProcedure
{
    void run() throws Exception;
}
