package com.printdesk.jobcore.api;

import com.printdesk.jobcore.api.dto.ApprovalResponse;
import com.printdesk.jobcore.api.dto.ApproveRequest;
import com.printdesk.jobcore.api.dto.ChangeOrderResponse;
import com.printdesk.jobcore.api.dto.CreateChangeOrderRequest;
import com.printdesk.jobcore.api.dto.RejectRequest;
import com.printdesk.jobcore.api.dto.UpdateChangeOrderRequest;
import com.printdesk.jobcore.changeorder.ChangeOrderService;
import com.printdesk.jobcore.model.ChangeOrder;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST API for change orders.
 *
 * GET    /jobs/{jobId}/change-orders             history of a job, newest first
 * POST   /jobs/{jobId}/change-orders             create a DRAFT with the next version
 * GET    /change-orders/{id}
 * GET    /change-orders/by-number/{changeOrderNo}
 * PATCH  /change-orders/{id}                     edit a DRAFT
 * DELETE /change-orders/{id}                     delete the latest DRAFT
 * POST   /change-orders/{id}/submit              DRAFT → PENDING_APPROVAL
 * POST   /change-orders/{id}/withdraw            PENDING_APPROVAL → DRAFT
 * POST   /change-orders/{id}/approve             → APPROVED, moves the job's effective version
 * POST   /change-orders/{id}/reject              PENDING_APPROVAL → REJECTED
 *
 * Error mapping lives in ApiExceptionHandler.
 */
@RestController
public class ChangeOrderController {

    private final ChangeOrderService changeOrderService;

    public ChangeOrderController(ChangeOrderService changeOrderService) {
        this.changeOrderService = changeOrderService;
    }

    @GetMapping("/jobs/{jobId}/change-orders")
    public List<ChangeOrderResponse> list(@PathVariable UUID jobId) {
        return changeOrderService.listForJob(jobId).stream()
                .map(ChangeOrderResponse::from)
                .toList();
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/jobs/{jobId}/change-orders \
     *     -H "Content-Type: application/json" \
     *     -d '{"summary":"Qty 5000 -> 7500","changes":{"quantity":7500},"requiresReprice":true}'
     */
    @PostMapping("/jobs/{jobId}/change-orders")
    public ResponseEntity<ChangeOrderResponse> create(@PathVariable UUID jobId,
                                                      @RequestBody CreateChangeOrderRequest req) {
        ChangeOrder co = changeOrderService.create(jobId, req.toDraft());
        return ResponseEntity.status(HttpStatus.CREATED).body(ChangeOrderResponse.from(co));
    }

    @GetMapping("/change-orders/{id}")
    public ChangeOrderResponse get(@PathVariable UUID id) {
        return ChangeOrderResponse.from(changeOrderService.findById(id));
    }

    @GetMapping("/change-orders/by-number/{changeOrderNo}")
    public ChangeOrderResponse getByNumber(@PathVariable String changeOrderNo) {
        return ChangeOrderResponse.from(changeOrderService.findByNumber(changeOrderNo));
    }

    @PatchMapping("/change-orders/{id}")
    public ChangeOrderResponse update(@PathVariable UUID id, @RequestBody UpdateChangeOrderRequest req) {
        return ChangeOrderResponse.from(changeOrderService.updateDraft(id, req.toEdit()));
    }

    @DeleteMapping("/change-orders/{id}")
    public ResponseEntity<Void> delete(@PathVariable UUID id) {
        changeOrderService.deleteDraft(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/change-orders/{id}/submit")
    public ChangeOrderResponse submit(@PathVariable UUID id) {
        return ChangeOrderResponse.from(changeOrderService.submitForApproval(id));
    }

    @PostMapping("/change-orders/{id}/withdraw")
    public ChangeOrderResponse withdraw(@PathVariable UUID id) {
        return ChangeOrderResponse.from(changeOrderService.withdraw(id));
    }

    @PostMapping("/change-orders/{id}/approve")
    public ApprovalResponse approve(@PathVariable UUID id, @RequestBody ApproveRequest req) {
        return ApprovalResponse.from(changeOrderService.approve(id, req.approvedBy()));
    }

    @PostMapping("/change-orders/{id}/reject")
    public ChangeOrderResponse reject(@PathVariable UUID id,
                                      @RequestBody(required = false) RejectRequest req) {
        return ChangeOrderResponse.from(changeOrderService.reject(id, req == null ? null : req.reason()));
    }
}
