package com.spicenet.core.error;

/**
 * Base class for failures raised while assembling a netlist.
 *
 * <p>All netlist failures are synchronous and local to the call that triggered them.
 * Nothing is retried internally: every input is in memory and deterministic.
 */
public class NetlistException extends RuntimeException {

    public NetlistException(String message) {
        super(message);
    }

    public NetlistException(String message, Throwable cause) {
        super(message, cause);
    }
}
