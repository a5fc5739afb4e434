package com.nosota.lingodesk.tests;

import com.nosota.lingodesk.TestBase;
import com.nosota.lingodesk.api.model.CreditTransactionType;
import com.nosota.lingodesk.api.model.OrderStatus;
import com.nosota.lingodesk.api.model.Priority;
import com.nosota.lingodesk.api.model.UpdateType;
import com.nosota.lingodesk.api.model.UserRole;
import com.nosota.lingodesk.api.model.Workflow;
import com.nosota.lingodesk.api.request.CreateProjectUpdateRequest;
import com.nosota.lingodesk.api.request.CreateTranslationRequest;
import com.nosota.lingodesk.api.request.UpdateTranslationRequest;
import com.nosota.lingodesk.api.response.TranslationRequestResponse;
import com.nosota.lingodesk.model.User;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockHttpSession;
import org.springframework.test.web.servlet.MvcResult;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Integration tests for order submission, status changes and project updates via the session API.
 */
public class TranslationRequestControllerTest extends TestBase {

    private User owner;
    private MockHttpSession ownerSession;

    @BeforeEach
    public void setupOwner() throws Exception {
        owner = createVerifiedUser(UserRole.USER);
        ownerSession = login(owner);
    }

    private static CreateTranslationRequest order(String fileName, Workflow workflow, String... targetLanguages) {
        return new CreateTranslationRequest(fileName, null, 10_000L, 1000L, 1000L, 1, null, "English",
                List.of(targetLanguages), workflow, null, null);
    }

    private TranslationRequestResponse submit(MockHttpSession session, CreateTranslationRequest request) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/translation-requests")
                        .session(session)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(request)))
                .andExpect(status().isCreated())
                .andReturn();
        return read(result, TranslationRequestResponse.class);
    }

    // ==================== Submission ====================

    @Test
    public void create_ShouldComputeCostServerSide() throws Exception {
        mockMvc.perform(post("/api/translation-requests")
                        .session(ownerSession)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(order("guide.docx", Workflow.AI_TRANSLATION_QC, "French", "German"))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.userId").value(owner.getId()))
                .andExpect(jsonPath("$.fileFormat").value("DOCX"))
                .andExpect(jsonPath("$.creditsRequired").value(4000))
                .andExpect(jsonPath("$.totalCost").value("£4.00"))
                .andExpect(jsonPath("$.status").value("pending"))
                .andExpect(jsonPath("$.priority").value("medium"))
                .andExpect(jsonPath("$.completionPercentage").value(0))
                .andExpect(jsonPath("$.subjectMatter").value("General Content"))
                .andExpect(jsonPath("$.targetLanguages", hasSize(2)));
    }

    @Test
    public void create_ShouldNotDeductCredits() throws Exception {
        creditService.addAccountCredits(owner.getAccountId(), 100L,
                CreditTransactionType.ADMIN_ADJUSTMENT, "Seed", null);

        submit(ownerSession, order("big.pdf", Workflow.AI_TRANSLATION_HUMAN, "French"));

        assertThat(accountRepository.findById(owner.getAccountId()).orElseThrow().getCredits()).isEqualTo(100L);
    }

    @Test
    public void create_WithoutTargetLanguages_ShouldReturn400() throws Exception {
        mockMvc.perform(post("/api/translation-requests")
                        .session(ownerSession)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(order("guide.docx", Workflow.AI_NEURAL))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Validation Error"));
    }

    @Test
    public void create_WithUnknownWorkflow_ShouldReturn400() throws Exception {
        Map<String, Object> body = Map.of(
                "fileName", "guide.docx",
                "characterCount", 100,
                "sourceLanguage", "English",
                "targetLanguages", List.of("French"),
                "workflow", "ai-poetry");

        mockMvc.perform(post("/api/translation-requests")
                        .session(ownerSession)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(body)))
                .andExpect(status().isBadRequest());
    }

    @Test
    public void create_Unauthenticated_ShouldReturn401() throws Exception {
        mockMvc.perform(post("/api/translation-requests")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(order("guide.docx", Workflow.AI_NEURAL, "French"))))
                .andExpect(status().isUnauthorized());
    }

    // ==================== Visibility ====================

    @Test
    public void list_ShouldShowOwnOrdersToUsersAndAccountOrdersToAdmins() throws Exception {
        User colleague = createVerifiedUser(owner.getAccountId(), UserRole.USER);
        User admin = createVerifiedUser(owner.getAccountId(), UserRole.ADMIN);
        User stranger = createVerifiedUser(UserRole.USER);

        TranslationRequestResponse mine = submit(ownerSession, order("mine.txt", Workflow.AI_NEURAL, "French"));
        submit(login(colleague), order("theirs.txt", Workflow.AI_NEURAL, "Spanish"));

        mockMvc.perform(get("/api/translation-requests").session(ownerSession))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].id").value(mine.id()));

        mockMvc.perform(get("/api/translation-requests").session(login(admin)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)));

        mockMvc.perform(get("/api/translation-requests/{id}", mine.id()).session(login(stranger)))
                .andExpect(status().isForbidden());

        mockMvc.perform(get("/api/translation-requests/{id}", mine.id()).session(login(colleague)))
                .andExpect(status().isForbidden());
    }

    @Test
    public void get_UnknownOrder_ShouldReturn404() throws Exception {
        mockMvc.perform(get("/api/translation-requests/{id}", 987_654_321L).session(ownerSession))
                .andExpect(status().isNotFound());
    }

    // ==================== Updates and status ====================

    @Test
    public void patch_ShouldApplyStatusPriorityAndCompletion() throws Exception {
        TranslationRequestResponse created = submit(ownerSession, order("guide.docx", Workflow.AI_NEURAL, "French"));

        UpdateTranslationRequest request =
                new UpdateTranslationRequest(OrderStatus.COMPLETE, Priority.URGENT, 100, null, "Linguist Team A");
        mockMvc.perform(patch("/api/translation-requests/{id}", created.id())
                        .session(ownerSession)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("complete"))
                .andExpect(jsonPath("$.priority").value("urgent"))
                .andExpect(jsonPath("$.completionPercentage").value(100))
                .andExpect(jsonPath("$.assignedTo").value("Linguist Team A"));

        // completed orders stay editable
        mockMvc.perform(patch("/api/translation-requests/{id}", created.id())
                        .session(ownerSession)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("status", "pending"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("pending"));
    }

    @Test
    public void patch_WithCompletionOutOfRange_ShouldReturn400() throws Exception {
        TranslationRequestResponse created = submit(ownerSession, order("guide.docx", Workflow.AI_NEURAL, "French"));

        mockMvc.perform(patch("/api/translation-requests/{id}", created.id())
                        .session(ownerSession)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("completionPercentage", 150))))
                .andExpect(status().isBadRequest());
    }

    @Test
    public void statusChangeUpdate_ShouldMoveParentStatus() throws Exception {
        TranslationRequestResponse created = submit(ownerSession, order("guide.docx", Workflow.AI_NEURAL, "French"));

        mockMvc.perform(post("/api/translation-requests/{id}/updates", created.id())
                        .session(ownerSession)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new CreateProjectUpdateRequest("Kick-off", null, null))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.updateType").value("note"));

        mockMvc.perform(post("/api/translation-requests/{id}/updates", created.id())
                        .session(ownerSession)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new CreateProjectUpdateRequest("Translation started", UpdateType.STATUS_CHANGE,
                                OrderStatus.TRANSLATION_IN_PROGRESS))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.newStatus").value("translation-in-progress"));

        mockMvc.perform(get("/api/translation-requests/{id}", created.id()).session(ownerSession))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("translation-in-progress"))
                .andExpect(jsonPath("$.updates", hasSize(2)))
                .andExpect(jsonPath("$.updates[0].updateText").value("Kick-off"))
                .andExpect(jsonPath("$.updates[1].updateType").value("status_change"));

        mockMvc.perform(get("/api/translation-requests/{id}/updates", created.id()).session(ownerSession))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)));
    }

    @Test
    public void statusChangeUpdate_WithoutNewStatus_ShouldReturn400AndKeepStatus() throws Exception {
        TranslationRequestResponse created = submit(ownerSession, order("guide.docx", Workflow.AI_NEURAL, "French"));

        mockMvc.perform(post("/api/translation-requests/{id}/updates", created.id())
                        .session(ownerSession)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new CreateProjectUpdateRequest("Moving on", UpdateType.STATUS_CHANGE, null))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("newStatus is required for status_change updates"));

        mockMvc.perform(get("/api/translation-requests/{id}", created.id()).session(ownerSession))
                .andExpect(jsonPath("$.status").value("pending"))
                .andExpect(jsonPath("$.updates", hasSize(0)));
    }

    @Test
    public void noteUpdate_ShouldIgnoreNewStatus() throws Exception {
        TranslationRequestResponse created = submit(ownerSession, order("guide.docx", Workflow.AI_NEURAL, "French"));

        mockMvc.perform(post("/api/translation-requests/{id}/updates", created.id())
                        .session(ownerSession)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new CreateProjectUpdateRequest("Glossary agreed", UpdateType.MILESTONE,
                                OrderStatus.COMPLETE))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.updateType").value("milestone"))
                .andExpect(jsonPath("$.newStatus").doesNotExist());

        mockMvc.perform(get("/api/translation-requests/{id}", created.id()).session(ownerSession))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("pending"))
                .andExpect(jsonPath("$.updates[0].newStatus").doesNotExist());
    }

    @Test
    public void update_WithBlankText_ShouldReturn400() throws Exception {
        TranslationRequestResponse created = submit(ownerSession, order("guide.docx", Workflow.AI_NEURAL, "French"));

        mockMvc.perform(post("/api/translation-requests/{id}/updates", created.id())
                        .session(ownerSession)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new CreateProjectUpdateRequest("   ", UpdateType.NOTE, null))))
                .andExpect(status().isBadRequest());
    }
}
