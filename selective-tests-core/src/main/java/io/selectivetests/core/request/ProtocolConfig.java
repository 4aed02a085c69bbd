package io.selectivetests.core.request;

/**
 * Version of the request protocol spoken with the discovery and run engines.
 */
public record ProtocolConfig(int version) {

    public static final ProtocolConfig DEFAULT = new ProtocolConfig(1);
}
