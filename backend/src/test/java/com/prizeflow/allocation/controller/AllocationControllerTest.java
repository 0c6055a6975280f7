package com.prizeflow.allocation.controller;

import com.prizeflow.allocation.dto.AllocationRequests;
import com.prizeflow.allocation.dto.AllocationResponses;
import com.prizeflow.allocation.model.ConflictStatus;
import com.prizeflow.allocation.model.ConflictType;
import com.prizeflow.allocation.model.CategoryType;
import com.prizeflow.allocation.model.Gender;
import com.prizeflow.allocation.model.MultiPrizePolicy;
import com.prizeflow.allocation.service.AllocationCommitService;
import com.prizeflow.allocation.service.AllocationConflictService;
import com.prizeflow.allocation.service.AllocationPreviewService;
import com.prizeflow.allocation.service.AllocationRcaService;
import com.prizeflow.allocation.service.InstitutionPrizeService;
import com.prizeflow.allocation.web.ActorIdentityInterceptor;
import com.prizeflow.allocation.web.AllocationRequestException;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.server.ResponseStatusException;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AllocationController.class)
class AllocationControllerTest {

    private static final UUID TOURNAMENT_ID = UUID.fromString("00000000-0000-0000-0000-000000000701");
    private static final UUID ACTOR_ID = UUID.fromString("00000000-0000-0000-0000-000000000702");
    private static final UUID PRIZE_ID = UUID.fromString("00000000-0000-0000-0000-000000000703");
    private static final UUID COMPETITOR_ID = UUID.fromString("00000000-0000-0000-0000-000000000704");

    private static final String DECISIONS_BODY = """
            {
              "decisions": [
                {
                  "prizeId": "00000000-0000-0000-0000-000000000703",
                  "competitorId": "00000000-0000-0000-0000-000000000704",
                  "reasonCodes": ["manual_override"],
                  "manual": true
                }
              ]
            }
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private AllocationPreviewService allocationPreviewService;

    @MockitoBean
    private AllocationCommitService allocationCommitService;

    @MockitoBean
    private AllocationConflictService allocationConflictService;

    @MockitoBean
    private AllocationRcaService allocationRcaService;

    @MockitoBean
    private InstitutionPrizeService institutionPrizeService;

    @Test
    void previewReturnsTotalsAndCoverage() throws Exception {
        when(allocationPreviewService.preview(TOURNAMENT_ID)).thenReturn(samplePreview());

        mockMvc.perform(get("/api/tournaments/{tournamentId}/allocation/preview", TOURNAMENT_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totals.prizes").value(1))
                .andExpect(jsonPath("$.totals.unfilled").value(1))
                .andExpect(jsonPath("$.coverage[0].reasonCode").value("TOO_STRICT_CRITERIA_RATING"))
                .andExpect(jsonPath("$.coverage[0].failHistogram.rating_above_max").value(3))
                .andExpect(jsonPath("$.coverage[0].prizeLabel").value("Below 1000 #1"));
    }

    @Test
    void previewOfUnknownTournamentReturnsNotFound() throws Exception {
        when(allocationPreviewService.preview(TOURNAMENT_ID))
                .thenThrow(new ResponseStatusException(HttpStatus.NOT_FOUND, "Tournament not found: " + TOURNAMENT_ID));

        mockMvc.perform(get("/api/tournaments/{tournamentId}/allocation/preview", TOURNAMENT_ID))
                .andExpect(status().isNotFound());
    }

    @Test
    void whatIfPreviewPassesOverridesAndRuleSwitches() throws Exception {
        when(allocationPreviewService.whatIf(eq(TOURNAMENT_ID), any(AllocationRequests.WhatIfPreviewRequest.class),
                eq(ACTOR_ID))).thenReturn(samplePreview());

        mockMvc.perform(post("/api/tournaments/{tournamentId}/allocation/preview", TOURNAMENT_ID)
                        .header(ActorIdentityInterceptor.ACTOR_HEADER, ACTOR_ID.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "overrides": [
                                    {
                                      "prizeId": "00000000-0000-0000-0000-000000000703",
                                      "competitorId": "00000000-0000-0000-0000-000000000704"
                                    }
                                  ],
                                  "rules": {"multiPrizePolicy": "UNLIMITED", "allowUnratedInRating": true}
                                }
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totals.prizes").value(1));

        ArgumentCaptor<AllocationRequests.WhatIfPreviewRequest> captor =
                ArgumentCaptor.forClass(AllocationRequests.WhatIfPreviewRequest.class);
        verify(allocationPreviewService).whatIf(eq(TOURNAMENT_ID), captor.capture(), eq(ACTOR_ID));
        AllocationRequests.WhatIfPreviewRequest request = captor.getValue();
        assertEquals(PRIZE_ID, request.overrides().get(0).prizeId());
        assertEquals(COMPETITOR_ID, request.overrides().get(0).competitorId());
        assertEquals(MultiPrizePolicy.UNLIMITED, request.rules().multiPrizePolicy());
        assertEquals(Boolean.TRUE, request.rules().allowUnratedInRating());
    }

    @Test
    void whatIfPreviewRejectsOverrideWithoutCompetitor() throws Exception {
        mockMvc.perform(post("/api/tournaments/{tournamentId}/allocation/preview", TOURNAMENT_ID)
                        .header(ActorIdentityInterceptor.ACTOR_HEADER, ACTOR_ID.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"overrides": [{"prizeId": "00000000-0000-0000-0000-000000000703"}]}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("validation_failed"))
                .andExpect(jsonPath("$.fieldErrors['overrides[0].competitorId']").value("competitorId is required"));

        verify(allocationPreviewService, never()).whatIf(any(), any(), any());
    }

    @Test
    void finalizeReturnsCreatedVersion() throws Exception {
        OffsetDateTime committedAt = OffsetDateTime.parse("2026-03-14T10:15:30Z");
        when(allocationCommitService.commit(eq(TOURNAMENT_ID), anyList(), eq(ACTOR_ID)))
                .thenReturn(new AllocationResponses.CommitResult(3, 1, 0, committedAt));

        mockMvc.perform(post("/api/tournaments/{tournamentId}/allocation/finalize", TOURNAMENT_ID)
                        .header(ActorIdentityInterceptor.ACTOR_HEADER, ACTOR_ID.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(DECISIONS_BODY))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.version").value(3))
                .andExpect(jsonPath("$.count").value(1));
    }

    @Test
    void finalizeWithoutActorHeaderIsUnauthorized() throws Exception {
        mockMvc.perform(post("/api/tournaments/{tournamentId}/allocation/finalize", TOURNAMENT_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(DECISIONS_BODY))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("actor_required"));

        verify(allocationCommitService, never()).commit(any(), any(), any());
    }

    @Test
    void finalizeWithMalformedActorHeaderIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/tournaments/{tournamentId}/allocation/finalize", TOURNAMENT_ID)
                        .header(ActorIdentityInterceptor.ACTOR_HEADER, "organizer-7")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(DECISIONS_BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("invalid_actor_id"));

        verify(allocationCommitService, never()).commit(any(), any(), any());
    }

    @Test
    void finalizeWithoutDecisionListFailsValidation() throws Exception {
        mockMvc.perform(post("/api/tournaments/{tournamentId}/allocation/finalize", TOURNAMENT_ID)
                        .header(ActorIdentityInterceptor.ACTOR_HEADER, ACTOR_ID.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("validation_failed"))
                .andExpect(jsonPath("$.message").value("Validation failed: decisions is required"))
                .andExpect(jsonPath("$.retryable").value(false))
                .andExpect(jsonPath("$.fieldErrors.decisions").value("decisions is required"));

        verify(allocationCommitService, never()).commit(any(), any(), any());
    }

    @Test
    void finalizeWithUnreadableBodyUsesTheSameErrorEnvelope() throws Exception {
        mockMvc.perform(post("/api/tournaments/{tournamentId}/allocation/finalize", TOURNAMENT_ID)
                        .header(ActorIdentityInterceptor.ACTOR_HEADER, ACTOR_ID.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"decisions\": [oops"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("malformed_request"))
                .andExpect(jsonPath("$.retryable").value(false))
                .andExpect(jsonPath("$.fieldErrors").isEmpty());

        verify(allocationCommitService, never()).commit(any(), any(), any());
    }

    @Test
    void finalizeVersionConflictIsRetryable() throws Exception {
        when(allocationCommitService.commit(eq(TOURNAMENT_ID), anyList(), eq(ACTOR_ID)))
                .thenThrow(AllocationRequestException.versionConflict("Allocation version 2 was committed concurrently"));

        mockMvc.perform(post("/api/tournaments/{tournamentId}/allocation/finalize", TOURNAMENT_ID)
                        .header(ActorIdentityInterceptor.ACTOR_HEADER, ACTOR_ID.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(DECISIONS_BODY))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("version_conflict"))
                .andExpect(jsonPath("$.message").value("Allocation version 2 was committed concurrently"))
                .andExpect(jsonPath("$.retryable").value(true))
                .andExpect(jsonPath("$.fieldErrors").isEmpty());
    }

    @Test
    void reviewByForeignActorIsForbidden() throws Exception {
        when(allocationConflictService.reviewManualEdits(eq(TOURNAMENT_ID), anyList(), eq(ACTOR_ID)))
                .thenThrow(AllocationRequestException.actorNotAuthorized("Actor may not change allocations"));

        mockMvc.perform(post("/api/tournaments/{tournamentId}/allocation/review", TOURNAMENT_ID)
                        .header(ActorIdentityInterceptor.ACTOR_HEADER, ACTOR_ID.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(DECISIONS_BODY))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("actor_not_authorized"));
    }

    @Test
    void currentWithoutCommittedVersionIsNotFound() throws Exception {
        when(allocationCommitService.getCurrentAllocation(TOURNAMENT_ID))
                .thenThrow(new ResponseStatusException(HttpStatus.NOT_FOUND, "No committed allocation"));

        mockMvc.perform(get("/api/tournaments/{tournamentId}/allocation/current", TOURNAMENT_ID))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("not_found"))
                .andExpect(jsonPath("$.message").value("No committed allocation"))
                .andExpect(jsonPath("$.retryable").value(false));
    }

    @Test
    void conflictsCanBeFilteredByStatus() throws Exception {
        when(allocationConflictService.listConflicts(TOURNAMENT_ID, ConflictStatus.OPEN))
                .thenReturn(List.of(sampleConflict(ConflictStatus.OPEN, null)));

        mockMvc.perform(get("/api/tournaments/{tournamentId}/allocation/conflicts", TOURNAMENT_ID)
                        .param("status", "OPEN"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].type").value("DUPLICATE_AWARD"))
                .andExpect(jsonPath("$[0].status").value("OPEN"));
    }

    @Test
    void institutionPrizesNeedNoActorHeader() throws Exception {
        UUID groupId = UUID.fromString("00000000-0000-0000-0000-000000000706");
        when(institutionPrizeService.allocate(TOURNAMENT_ID)).thenReturn(new AllocationResponses.InstitutionPrizesResponse(
                TOURNAMENT_ID,
                12,
                12,
                List.of(new AllocationResponses.InstitutionGroup(
                        groupId,
                        "Best School",
                        new AllocationResponses.InstitutionGroupConfig("club", 2, 1, 0, "by_top_k_score"),
                        List.of(
                                new AllocationResponses.InstitutionPrizeResult(
                                        PRIZE_ID, 1, new BigDecimal("3000.00"), true, false,
                                        new AllocationResponses.InstitutionWinner(
                                                "Pune Chess Club", "Pune Chess Club", 21, 5, 1,
                                                List.of(
                                                        new AllocationResponses.TeamMember(
                                                                COMPETITOR_ID, "Asha", 4, 9, Gender.F),
                                                        new AllocationResponses.TeamMember(
                                                                UUID.fromString("00000000-0000-0000-0000-000000000707"),
                                                                "Dev", 1, 12, Gender.M)
                                                )
                                        )
                                ),
                                new AllocationResponses.InstitutionPrizeResult(
                                        UUID.fromString("00000000-0000-0000-0000-000000000708"),
                                        2, null, false, true, null
                                )
                        ),
                        1,
                        1,
                        List.of("Mumbai Knights: needs 1 females, has 0")
                ))
        ));

        mockMvc.perform(get("/api/tournaments/{tournamentId}/allocation/institution-prizes", TOURNAMENT_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.groups[0].config.groupBy").value("club"))
                .andExpect(jsonPath("$.groups[0].prizes[0].winner.key").value("Pune Chess Club"))
                .andExpect(jsonPath("$.groups[0].prizes[0].winner.players[0].gender").value("F"))
                .andExpect(jsonPath("$.groups[0].prizes[1].winner").doesNotExist())
                .andExpect(jsonPath("$.groups[0].ineligibleReasons[0]").value("Mumbai Knights: needs 1 females, has 0"));
    }

    @Test
    void resolveConflictWithoutBodyUsesDefaultNote() throws Exception {
        UUID conflictId = UUID.fromString("00000000-0000-0000-0000-000000000705");
        when(allocationConflictService.resolve(eq(TOURNAMENT_ID), eq(conflictId), eq(ACTOR_ID), isNull()))
                .thenReturn(sampleConflict(ConflictStatus.RESOLVED, "resolved_by_organizer"));

        mockMvc.perform(post("/api/tournaments/{tournamentId}/allocation/conflicts/{conflictId}/resolve",
                        TOURNAMENT_ID, conflictId)
                        .header(ActorIdentityInterceptor.ACTOR_HEADER, ACTOR_ID.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("RESOLVED"))
                .andExpect(jsonPath("$.resolutionNote").value("resolved_by_organizer"));
    }

    private static AllocationResponses.PreviewResponse samplePreview() {
        UUID categoryId = UUID.fromString("00000000-0000-0000-0000-000000000706");
        AllocationResponses.Coverage coverage = new AllocationResponses.Coverage(
                categoryId,
                "Below 1000",
                CategoryType.CRITERIA,
                false,
                PRIZE_ID,
                1,
                "Below 1000 #1",
                new BigDecimal("500.00"),
                true,
                false,
                null,
                null,
                null,
                null,
                0,
                0,
                "TOO_STRICT_CRITERIA_RATING",
                "No eligible winner (rating criteria)",
                Map.of("rating_above_max", 3),
                "0 of 3 competitors eligible. Top blockers: Rating above maximum (3)",
                true,
                false,
                List.of()
        );
        return new AllocationResponses.PreviewResponse(
                TOURNAMENT_ID,
                new AllocationResponses.PreviewTotals(3, 1, 0, 1, 0, 0),
                List.of(),
                List.of(coverage),
                false
        );
    }

    private static AllocationResponses.Conflict sampleConflict(ConflictStatus status, String note) {
        return new AllocationResponses.Conflict(
                UUID.fromString("00000000-0000-0000-0000-000000000705"),
                TOURNAMENT_ID,
                ConflictType.DUPLICATE_AWARD,
                List.of(COMPETITOR_ID),
                List.of(PRIZE_ID),
                List.of("duplicate_award", "multi_prize_policy_single"),
                null,
                null,
                status,
                note,
                ACTOR_ID,
                status == ConflictStatus.RESOLVED ? ACTOR_ID : null,
                OffsetDateTime.parse("2026-03-14T10:00:00Z"),
                status == ConflictStatus.RESOLVED ? OffsetDateTime.parse("2026-03-14T10:05:00Z") : null
        );
    }
}
