package com.printdesk.jobcore.api.dto;

/** Request body for POST /change-orders/{id}/reject. The reason is optional. */
public record RejectRequest(String reason) {}
