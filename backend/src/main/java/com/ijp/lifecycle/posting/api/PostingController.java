package com.ijp.lifecycle.posting.api;

import com.ijp.lifecycle.posting.model.CreatePostingRequest;
import com.ijp.lifecycle.posting.model.JobPosting;
import com.ijp.lifecycle.posting.model.PermanentDeletionResponse;
import com.ijp.lifecycle.posting.model.UpdatePostingRequest;
import com.ijp.lifecycle.posting.service.PostingService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/postings")
public class PostingController {
    static final String COMPANY_HEADER = "X-Company-Id";

    private final PostingService postingService;

    public PostingController(PostingService postingService) {
        this.postingService = postingService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public JobPosting create(
        @RequestHeader(COMPANY_HEADER) long companyId,
        @RequestBody CreatePostingRequest request
    ) {
        return postingService.create(companyId, request);
    }

    @PatchMapping("/{id}")
    public JobPosting update(
        @RequestHeader(COMPANY_HEADER) long companyId,
        @PathVariable("id") long id,
        @RequestBody UpdatePostingRequest request
    ) {
        return postingService.update(companyId, id, request);
    }

    @GetMapping("/mine")
    public List<JobPosting> mine(@RequestHeader(COMPANY_HEADER) long companyId) {
        return postingService.listMine(companyId);
    }

    @GetMapping("/mine/archived")
    public List<JobPosting> mineArchived(@RequestHeader(COMPANY_HEADER) long companyId) {
        return postingService.listArchived(companyId);
    }

    @DeleteMapping("/{id}")
    public JobPosting archive(
        @RequestHeader(COMPANY_HEADER) long companyId,
        @PathVariable("id") long id
    ) {
        return postingService.archive(companyId, id);
    }

    @DeleteMapping("/{id}/permanent")
    public PermanentDeletionResponse deletePermanently(
        @RequestHeader(COMPANY_HEADER) long companyId,
        @PathVariable("id") long id
    ) {
        return postingService.deletePermanently(companyId, id);
    }

    @PostMapping("/{id}/reactivate")
    public JobPosting reactivate(
        @RequestHeader(COMPANY_HEADER) long companyId,
        @PathVariable("id") long id
    ) {
        return postingService.reactivate(companyId, id);
    }
}
