package com.astlens.protocol;

/**
 * One-way channel carrying {@link HostMessage}s to the host.
 */
@FunctionalInterface
public interface HostChannel {

    void post(HostMessage message);
}
