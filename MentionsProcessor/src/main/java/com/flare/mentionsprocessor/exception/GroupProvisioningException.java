package com.flare.mentionsprocessor.exception;

/**
 * The consumer group could not be created for a reason other than
 * it already existing. The consumer must not start without a group.
 */
public class GroupProvisioningException extends RuntimeException {

    public GroupProvisioningException(String message) {
        super(message);
    }

    public GroupProvisioningException(String message, Throwable cause) {
        super(message, cause);
    }

}
