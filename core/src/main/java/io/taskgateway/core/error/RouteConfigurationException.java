package io.taskgateway.core.error;

/**
 * Thrown when the rewrite table is inconsistent or a call omits a parameter
 * its route template requires. Signals a programming error in the caller or
 * the table, never bad end-user input.
 */
public class RouteConfigurationException extends GatewayException {

    private static final long serialVersionUID = 1L;

    public RouteConfigurationException(String message) {
        super(message);
    }
}
