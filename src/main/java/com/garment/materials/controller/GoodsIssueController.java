package com.garment.materials.controller;

import com.garment.materials.dto.BomIssueRequest;
import com.garment.materials.dto.GoodsIssueRequest;
import com.garment.materials.dto.GoodsIssueUpdateRequest;
import com.garment.materials.dto.IssueLineRequest;
import com.garment.materials.model.GoodsIssue;
import com.garment.materials.model.GoodsIssueLine;
import com.garment.materials.model.IssueType;
import com.garment.materials.service.GoodsIssueService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/goods-issues")
public class GoodsIssueController {

    private final GoodsIssueService goodsIssueService;

    public GoodsIssueController(GoodsIssueService goodsIssueService) {
        this.goodsIssueService = goodsIssueService;
    }

    @GetMapping
    public List<GoodsIssue> list(@RequestParam(required = false) IssueType type) {
        return type != null ? goodsIssueService.getIssuesByType(type) : goodsIssueService.getAllIssues();
    }

    @GetMapping("/pending")
    public List<GoodsIssue> pending() {
        return goodsIssueService.getPendingIssues();
    }

    @GetMapping("/{id}")
    public GoodsIssue get(@PathVariable Long id) {
        return goodsIssueService.getIssue(id);
    }

    /**
     * Creates a pending issue, or creates and posts it straight away with {@code post=true}.
     */
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    @PreAuthorize("hasAnyRole('STORES', 'ADMIN')")
    public GoodsIssue create(@Valid @RequestBody GoodsIssueRequest request,
            @RequestParam(defaultValue = "false") boolean post) {
        return post ? goodsIssueService.issueNow(request) : goodsIssueService.createIssue(request);
    }

    @PostMapping("/from-bom")
    @ResponseStatus(HttpStatus.CREATED)
    @PreAuthorize("hasAnyRole('STORES', 'ADMIN')")
    public GoodsIssue createFromBom(@Valid @RequestBody BomIssueRequest request) {
        return goodsIssueService.createBomBasedIssue(request);
    }

    @PutMapping("/{id}")
    @PreAuthorize("hasAnyRole('STORES', 'ADMIN')")
    public GoodsIssue update(@PathVariable Long id, @RequestBody GoodsIssueUpdateRequest request) {
        return goodsIssueService.updateIssue(id, request);
    }

    @PostMapping("/{id}/lines")
    @ResponseStatus(HttpStatus.CREATED)
    @PreAuthorize("hasAnyRole('STORES', 'ADMIN')")
    public GoodsIssueLine addLine(@PathVariable Long id, @Valid @RequestBody IssueLineRequest request) {
        return goodsIssueService.addLine(id, request);
    }

    @PutMapping("/{id}/lines/{lineId}")
    @PreAuthorize("hasAnyRole('STORES', 'ADMIN')")
    public GoodsIssueLine updateLine(@PathVariable Long id, @PathVariable Long lineId,
            @Valid @RequestBody IssueLineRequest request) {
        return goodsIssueService.updateLine(id, lineId, request);
    }

    @DeleteMapping("/{id}/lines/{lineId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    @PreAuthorize("hasAnyRole('STORES', 'ADMIN')")
    public void removeLine(@PathVariable Long id, @PathVariable Long lineId) {
        goodsIssueService.removeLine(id, lineId);
    }

    @PostMapping("/{id}/post")
    @PreAuthorize("hasAnyRole('STORES', 'ADMIN')")
    public GoodsIssue post(@PathVariable Long id) {
        return goodsIssueService.postIssue(id);
    }

    @PostMapping("/{id}/cancel")
    @PreAuthorize("hasAnyRole('STORES', 'ADMIN')")
    public GoodsIssue cancel(@PathVariable Long id) {
        return goodsIssueService.cancelIssue(id);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    @PreAuthorize("hasAnyRole('STORES', 'ADMIN')")
    public void delete(@PathVariable Long id) {
        goodsIssueService.deleteIssue(id);
    }
}
