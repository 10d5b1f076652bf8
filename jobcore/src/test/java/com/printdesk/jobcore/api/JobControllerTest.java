package com.printdesk.jobcore.api;

import com.printdesk.jobcore.TestEntities;
import com.printdesk.jobcore.changeorder.ChangeOrderService;
import com.printdesk.jobcore.changeorder.EffectiveJobState;
import com.printdesk.jobcore.component.ValidationIssue;
import com.printdesk.jobcore.error.InvalidRequestException;
import com.printdesk.jobcore.error.InvalidTransitionException;
import com.printdesk.jobcore.error.JobNotReadyException;
import com.printdesk.jobcore.model.ChangeOrder;
import com.printdesk.jobcore.model.ChangeOrderStatus;
import com.printdesk.jobcore.model.ComponentType;
import com.printdesk.jobcore.model.Job;
import com.printdesk.jobcore.model.JobComponent;
import com.printdesk.jobcore.model.JobStatus;
import com.printdesk.jobcore.model.SpecFields;
import com.printdesk.jobcore.service.JobService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Slice test for JobController.
 *
 * @WebMvcTest spins up only the web layer (controllers plus ApiExceptionHandler);
 * both services are mocks.
 */
@WebMvcTest(JobController.class)
class JobControllerTest {

    @Autowired MockMvc                 mockMvc;
    @MockitoBean JobService            jobService;
    @MockitoBean ChangeOrderService    changeOrderService;

    // ------------------------------------------------------------------
    // POST /jobs
    // ------------------------------------------------------------------

    @Test
    void create_validRequest_returns201WithBaseJobId() throws Exception {
        Job job = TestEntities.job("BK000001");
        when(jobService.createJob(any())).thenReturn(job);

        mockMvc.perform(post("/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"title":"Spring catalog","jobTypeCode":"BK",
                                 "jobMetaType":"JOB","jobType":"BOOKLET_PLUS_COVER",
                                 "specs":{"quantity":5000}}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.baseJobId").value("BK000001"))
                .andExpect(jsonPath("$.status").value("DRAFT"))
                .andExpect(jsonPath("$.effectiveCoVersion").isEmpty());

        verify(jobService).createJob(argThat(cmd -> "BK".equals(cmd.jobTypeCode())
                && cmd.specs().values().get("quantity").equals(5000)
                && cmd.components() == null));
    }

    @Test
    void create_invalidTypeCode_returns400WithErrorEnvelope() throws Exception {
        when(jobService.createJob(any())).thenThrow(new InvalidRequestException("bad code"));

        mockMvc.perform(post("/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"title":"x","jobTypeCode":"b-k"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Bad Request"))
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST"))
                .andExpect(jsonPath("$.message").value("bad code"));
    }

    @Test
    void create_nestedSpecValue_returns400() throws Exception {
        mockMvc.perform(post("/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"title":"x","specs":{"inks":{"front":4}}}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST"));
    }

    // ------------------------------------------------------------------
    // GET /jobs/{id}
    // ------------------------------------------------------------------

    @Test
    void getJob_existingId_returns200() throws Exception {
        Job job = TestEntities.job("BK000001");
        when(jobService.findById(job.getId())).thenReturn(Optional.of(job));

        mockMvc.perform(get("/jobs/{id}", job.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.baseJobId").value("BK000001"));
    }

    @Test
    void getJob_unknownId_returns404() throws Exception {
        UUID unknown = UUID.randomUUID();
        when(jobService.findById(unknown)).thenReturn(Optional.empty());

        mockMvc.perform(get("/jobs/{id}", unknown))
                .andExpect(status().isNotFound());
    }

    // ------------------------------------------------------------------
    // POST /jobs/{id}/activate
    // ------------------------------------------------------------------

    @Test
    void activate_completeJob_returns200Active() throws Exception {
        Job job = TestEntities.job("BK000001");
        job.setStatus(JobStatus.ACTIVE);
        when(jobService.activate(job.getId())).thenReturn(job);

        mockMvc.perform(post("/jobs/{id}/activate", job.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ACTIVE"));
    }

    @Test
    void activate_missingComponents_returns422WithIssues() throws Exception {
        UUID id = UUID.randomUUID();
        when(jobService.activate(id)).thenThrow(new JobNotReadyException("BK000001", List.of(
                new ValidationIssue(ValidationIssue.Code.MISSING_PROOF,
                        "Missing PROOF component (required for all jobs)", null))));

        mockMvc.perform(post("/jobs/{id}/activate", id))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("NOT_READY"))
                .andExpect(jsonPath("$.issues[0].code").value("MISSING_PROOF"));
    }

    @Test
    void activate_notDraft_returns409() throws Exception {
        UUID id = UUID.randomUUID();
        when(jobService.activate(id)).thenThrow(
                InvalidTransitionException.of("activate", "BK000001", JobStatus.ACTIVE));

        mockMvc.perform(post("/jobs/{id}/activate", id))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("INVALID_TRANSITION"))
                .andExpect(jsonPath("$.issues").doesNotExist());
    }

    // ------------------------------------------------------------------
    // GET /jobs/{id}/components, /effective-state
    // ------------------------------------------------------------------

    @Test
    void getComponents_existingJob_returnsInSortOrder() throws Exception {
        Job job = TestEntities.job("BK000001");
        when(jobService.findById(job.getId())).thenReturn(Optional.of(job));
        when(jobService.getComponents(job.getId())).thenReturn(List.of(
                new JobComponent(job, ComponentType.PRINT, "Print Production", 0),
                new JobComponent(job, ComponentType.PROOF, "Proof", 1)));

        mockMvc.perform(get("/jobs/{id}/components", job.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].type").value("PRINT"))
                .andExpect(jsonPath("$[1].name").value("Proof"))
                .andExpect(jsonPath("$[1].status").value("PENDING"));
    }

    @Test
    void getComponents_unknownJob_returns404() throws Exception {
        UUID unknown = UUID.randomUUID();
        when(jobService.findById(unknown)).thenReturn(Optional.empty());

        mockMvc.perform(get("/jobs/{id}/components", unknown))
                .andExpect(status().isNotFound());
    }

    @Test
    void getEffectiveState_returnsMergedSpecs() throws Exception {
        Job job = TestEntities.job("BK000001");
        job.setEffectiveCoVersion(1);
        ChangeOrder co1 = TestEntities.changeOrder(job, 1, ChangeOrderStatus.APPROVED);
        when(changeOrderService.effectiveState(job.getId())).thenReturn(new EffectiveJobState(job,
                SpecFields.of(Map.of("quantity", 5000)), SpecFields.of(Map.of("quantity", 7500)), co1, 1));

        mockMvc.perform(get("/jobs/{id}/effective-state", job.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.effectiveSpecs.quantity").value(7500))
                .andExpect(jsonPath("$.baseSpecs.quantity").value(5000))
                .andExpect(jsonPath("$.latestChangeOrderNo").value("BK000001-CO1"))
                .andExpect(jsonPath("$.appliedCount").value(1));
    }
}
