package com.ijp.lifecycle.posting.api;

import com.ijp.lifecycle.posting.model.CreatePostingRequest;
import com.ijp.lifecycle.posting.service.PostingService;
import com.ijp.lifecycle.support.MutableClock;
import com.ijp.lifecycle.support.TestClockConfiguration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.context.WebApplicationContext;

import java.time.Duration;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
@Import(TestClockConfiguration.class)
@Transactional
class PolicySettingsApiTest {

    @Autowired
    private WebApplicationContext context;

    @Autowired
    private MutableClock clock;

    @Autowired
    private PostingService postingService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
        clock.setInstant(TestClockConfiguration.START);
    }

    @Test
    void publicSettingsExposeConfiguredDefaults() throws Exception {
        mockMvc.perform(get("/api/settings/public"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.maxJobDeadlineDays").value(90))
            .andExpect(jsonPath("$.archiveDeletionDays").value(90));
    }

    @Test
    void updatedSettingIsVisiblePublicly() throws Exception {
        mockMvc.perform(put("/api/admin/settings/{key}", "archive_deletion_days")
                .header("X-Admin-Id", "1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"value\":30}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.archiveDeletionDays").value(30))
            .andExpect(jsonPath("$.maxJobDeadlineDays").value(90));

        mockMvc.perform(get("/api/settings/public"))
            .andExpect(jsonPath("$.archiveDeletionDays").value(30));
        mockMvc.perform(get("/api/admin/settings"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(3))
            .andExpect(jsonPath("$[1].key").value("archive_deletion_days"))
            .andExpect(jsonPath("$[1].value").value(30))
            .andExpect(jsonPath("$[1].updatedBy").value(1));
    }

    @Test
    void booleanSettingAcceptsJsonBoolean() throws Exception {
        mockMvc.perform(put("/api/admin/settings/{key}", "auto_archive_expired_jobs")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"value\":false}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.autoArchiveExpired").value(false));
    }

    @Test
    void invalidSettingValuesAreRejected() throws Exception {
        mockMvc.perform(put("/api/admin/settings/{key}", "archive_deletion_days")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"value\":0}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("validation_error"));
        mockMvc.perform(put("/api/admin/settings/{key}", "max_job_deadline_days")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"value\":366}"))
            .andExpect(status().isBadRequest());
        mockMvc.perform(put("/api/admin/settings/{key}", "max_job_deadline_days")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"value\":{\"days\":30}}"))
            .andExpect(status().isBadRequest());
        mockMvc.perform(put("/api/admin/settings/{key}", "no_such_setting")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"value\":30}"))
            .andExpect(status().isBadRequest());

        mockMvc.perform(get("/api/settings/public"))
            .andExpect(jsonPath("$.archiveDeletionDays").value(90))
            .andExpect(jsonPath("$.maxJobDeadlineDays").value(90));
    }

    @Test
    void archivePreviewWarnsWithoutChangingAnything() throws Exception {
        long id = postingService.create(811L, new CreatePostingRequest("Shepherd", null, true)).id();
        postingService.archive(811L, id);
        clock.advance(Duration.ofDays(40));

        mockMvc.perform(get("/api/admin/settings/archive-preview").param("days", "30"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.days").value(30))
            .andExpect(jsonPath("$.affectedCount").value(1))
            .andExpect(jsonPath("$.affectedSample[0].id").value(id))
            .andExpect(jsonPath("$.affectedSample[0].daysArchived").value(40))
            .andExpect(jsonPath("$.warning").value(true));

        mockMvc.perform(get("/api/admin/settings/archive-preview"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.days").value(90))
            .andExpect(jsonPath("$.affectedCount").value(0))
            .andExpect(jsonPath("$.warning").value(false));
        mockMvc.perform(get("/api/settings/public"))
            .andExpect(jsonPath("$.archiveDeletionDays").value(90));
    }

    @Test
    void previewOutsideBoundsIsRejected() throws Exception {
        mockMvc.perform(get("/api/admin/settings/archive-preview").param("days", "0"))
            .andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/admin/settings/archive-preview").param("days", "400"))
            .andExpect(status().isBadRequest());
    }
}
