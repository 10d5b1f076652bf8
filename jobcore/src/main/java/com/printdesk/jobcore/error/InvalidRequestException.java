package com.printdesk.jobcore.error;

public class InvalidRequestException extends JobCoreException {

    public InvalidRequestException(String message) {
        super(Kind.INVALID_REQUEST, message);
    }
}
