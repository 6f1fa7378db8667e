package com.ijp.lifecycle.posting.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.ijp.lifecycle.posting.model.DeletionPreview;
import com.ijp.lifecycle.posting.model.PolicySettingView;
import com.ijp.lifecycle.posting.model.PolicySettings;
import com.ijp.lifecycle.posting.model.PublicSettingsResponse;
import com.ijp.lifecycle.posting.model.SettingValueRequest;
import com.ijp.lifecycle.posting.service.DeletionPreviewService;
import com.ijp.lifecycle.posting.service.LifecycleValidationException;
import com.ijp.lifecycle.posting.service.PolicyStore;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
public class PolicySettingsController {
    private static final String ADMIN_HEADER = "X-Admin-Id";

    private final PolicyStore policyStore;
    private final DeletionPreviewService previewService;

    public PolicySettingsController(PolicyStore policyStore, DeletionPreviewService previewService) {
        this.policyStore = policyStore;
        this.previewService = previewService;
    }

    @GetMapping("/settings/public")
    public PublicSettingsResponse publicSettings() {
        PolicySettings settings = policyStore.get();
        return new PublicSettingsResponse(settings.maxJobDeadlineDays(), settings.archiveDeletionDays());
    }

    @GetMapping("/admin/settings")
    public List<PolicySettingView> settings() {
        return policyStore.describe();
    }

    @PutMapping("/admin/settings/{key}")
    public PolicySettings updateSetting(
        @PathVariable("key") String key,
        @RequestHeader(name = ADMIN_HEADER, required = false) Long adminId,
        @RequestBody SettingValueRequest request
    ) {
        JsonNode value = request == null ? null : request.value();
        if (value == null || value.isNull() || value.isContainerNode()) {
            throw new LifecycleValidationException("A scalar value is required for " + key);
        }
        return policyStore.set(key, value.asText(), adminId);
    }

    @GetMapping("/admin/settings/archive-preview")
    public DeletionPreview archivePreview(
        @RequestParam(name = "days", required = false, defaultValue = "90") int days
    ) {
        return previewService.preview(days);
    }
}
