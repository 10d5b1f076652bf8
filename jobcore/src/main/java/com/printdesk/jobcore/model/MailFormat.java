package com.printdesk.jobcore.model;

public enum MailFormat {
    SELF_MAILER,
    POSTCARD,
    ENVELOPE
}
