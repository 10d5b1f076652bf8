package com.printdesk.jobcore.api.dto;

/** Request body for POST /change-orders/{id}/approve. */
public record ApproveRequest(String approvedBy) {}
