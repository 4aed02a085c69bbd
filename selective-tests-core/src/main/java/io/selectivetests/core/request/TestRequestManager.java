package io.selectivetests.core.request;

/**
 * Discovery and run engine used by the selection pipeline.
 */
public interface TestRequestManager extends TestDiscoverer {

    /**
     * Runs exactly the test cases in the payload. No callbacks are consumed by the caller.
     */
    void runTests(TestRunRequestPayload payload, ProtocolConfig protocolConfig);
}
