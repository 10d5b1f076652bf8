package com.printdesk.jobcore.error;

/**
 * A referenced job or change order does not exist.
 */
public class NotFoundException extends JobCoreException {

    public NotFoundException(String resource, Object id) {
        super(Kind.NOT_FOUND, resource + " not found: " + id);
    }
}
