package com.garment.materials.service;

import com.garment.materials.config.MaterialsProperties;
import com.garment.materials.dto.BomIssueRequest;
import com.garment.materials.dto.ConsumptionResult;
import com.garment.materials.dto.GoodsIssueRequest;
import com.garment.materials.dto.GoodsIssueUpdateRequest;
import com.garment.materials.dto.IssueLineRequest;
import com.garment.materials.dto.MaterialRequirement;
import com.garment.materials.exception.IssueStateException;
import com.garment.materials.exception.RecordNotFoundException;
import com.garment.materials.model.BomHeader;
import com.garment.materials.model.GoodsIssue;
import com.garment.materials.model.GoodsIssueLine;
import com.garment.materials.model.IssueStatus;
import com.garment.materials.model.IssueType;
import com.garment.materials.repository.GoodsIssueRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

@Slf4j
@Service
public class GoodsIssueService {

    private final GoodsIssueRepository issueRepository;
    private final InventoryLedgerService ledgerService;
    private final BomService bomService;
    private final MaterialService materialService;
    private final AuditService auditService;
    private final MaterialsProperties properties;

    public GoodsIssueService(GoodsIssueRepository issueRepository, InventoryLedgerService ledgerService,
            BomService bomService, MaterialService materialService, AuditService auditService,
            MaterialsProperties properties) {
        this.issueRepository = issueRepository;
        this.ledgerService = ledgerService;
        this.bomService = bomService;
        this.materialService = materialService;
        this.auditService = auditService;
        this.properties = properties;
    }

    /**
     * Creates a PENDING issue. Availability is checked now and again when the issue is posted.
     */
    @Transactional
    public GoodsIssue createIssue(GoodsIssueRequest request) {
        if (request.getLines() == null || request.getLines().isEmpty()) {
            throw new IllegalArgumentException("A goods issue needs at least one line");
        }

        Map<Long, BigDecimal> totals = new TreeMap<>();
        for (IssueLineRequest line : request.getLines()) {
            checkLine(line);
            totals.merge(line.getMaterialId(), line.getQuantity(), BigDecimal::add);
        }
        totals.forEach(ledgerService::checkAvailability);

        GoodsIssue issue = new GoodsIssue();
        issue.setIssueNumber(nextIssueNumber());
        issue.setIssueDate(request.getIssueDate());
        issue.setIssueType(request.getIssueType() != null ? request.getIssueType() : IssueType.PRODUCTION);
        issue.setReferenceNumber(request.getReferenceNumber());
        issue.setNotes(request.getNotes());
        issue.setStatus(IssueStatus.PENDING);

        for (IssueLineRequest lineRequest : request.getLines()) {
            issue.addLine(toLine(lineRequest));
        }

        GoodsIssue saved = issueRepository.save(issue);
        log.info("Created goods issue {} with {} line(s)", saved.getIssueNumber(), saved.getLines().size());
        auditService.log("CREATE_ISSUE", "Issue: " + saved.getIssueNumber() + ", Type: " + saved.getIssueType());
        return saved;
    }

    /**
     * Creates and posts in one transaction.
     */
    @Transactional
    public GoodsIssue issueNow(GoodsIssueRequest request) {
        GoodsIssue issue = createIssue(request);
        return post(issue);
    }

    @Transactional
    public GoodsIssue postIssue(Long issueId) {
        return post(getIssue(issueId));
    }

    @Transactional
    public GoodsIssue cancelIssue(Long issueId) {
        GoodsIssue issue = getIssue(issueId);
        requirePending(issue, "cancel");
        issue.setStatus(IssueStatus.CANCELLED);
        GoodsIssue saved = issueRepository.save(issue);
        log.info("Cancelled goods issue {}", issue.getIssueNumber());
        auditService.log("CANCEL_ISSUE", "Issue: " + issue.getIssueNumber());
        return saved;
    }

    @Transactional
    public void deleteIssue(Long issueId) {
        GoodsIssue issue = getIssue(issueId);
        requirePending(issue, "delete");
        issueRepository.delete(issue);
        auditService.log("DELETE_ISSUE", "Issue: " + issue.getIssueNumber());
    }

    /**
     * Changes header fields of a pending issue. Status only moves through post and cancel.
     */
    @Transactional
    public GoodsIssue updateIssue(Long issueId, GoodsIssueUpdateRequest request) {
        GoodsIssue issue = getIssue(issueId);
        requirePending(issue, "modify");
        if (request.getIssueDate() != null)
            issue.setIssueDate(request.getIssueDate());
        if (request.getIssueType() != null)
            issue.setIssueType(request.getIssueType());
        if (request.getReferenceNumber() != null)
            issue.setReferenceNumber(request.getReferenceNumber());
        if (request.getNotes() != null)
            issue.setNotes(request.getNotes());

        GoodsIssue saved = issueRepository.save(issue);
        auditService.log("UPDATE_ISSUE", "Issue: " + saved.getIssueNumber());
        return saved;
    }

    @Transactional
    public GoodsIssueLine addLine(Long issueId, IssueLineRequest request) {
        GoodsIssue issue = getIssue(issueId);
        requirePending(issue, "modify");
        checkLine(request);

        GoodsIssueLine line = toLine(request);
        issue.addLine(line);
        issueRepository.save(issue);
        return line;
    }

    @Transactional
    public GoodsIssueLine updateLine(Long issueId, Long lineId, IssueLineRequest request) {
        GoodsIssue issue = getIssue(issueId);
        requirePending(issue, "modify");
        GoodsIssueLine line = findLine(issue, lineId);
        checkLine(request);

        line.setMaterialId(request.getMaterialId());
        line.setRequestedQuantity(request.getQuantity());
        line.setBatchNumber(request.getBatchNumber());
        line.setNotes(request.getNotes());
        issueRepository.save(issue);
        return line;
    }

    @Transactional
    public void removeLine(Long issueId, Long lineId) {
        GoodsIssue issue = getIssue(issueId);
        requirePending(issue, "modify");
        issue.getLines().remove(findLine(issue, lineId));
        issueRepository.save(issue);
    }

    /**
     * Turns the aggregated requirements of a BOM run into a PENDING issue, one line per material.
     */
    @Transactional
    public GoodsIssue createBomBasedIssue(BomIssueRequest request) {
        BomHeader bom = bomService.getBom(request.getBomId());

        List<MaterialRequirement> requirements;
        if (request.getSelections() != null && !request.getSelections().isEmpty()) {
            requirements = bomService.calculateRequirements(bom.getId(), request.getSelections());
        } else if (request.getQuantityToProduce() != null && request.getQuantityToProduce().signum() > 0) {
            requirements = bomService.calculateRequirements(bom.getId(), request.getQuantityToProduce());
        } else {
            throw new IllegalArgumentException("Either a production quantity or product selections are required");
        }

        List<IssueLineRequest> lines = requirements.stream()
                .filter(r -> r.getRequiredQuantity().signum() > 0)
                .map(r -> new IssueLineRequest(r.getMaterialId(), r.getRequiredQuantity(), null,
                        "BOM " + bom.getName() + " v" + bom.getVersion()))
                .toList();
        if (lines.isEmpty()) {
            throw new IllegalArgumentException("BOM " + bom.getName() + " requires no materials for this run");
        }

        GoodsIssueRequest issueRequest = new GoodsIssueRequest();
        issueRequest.setIssueDate(request.getIssueDate());
        issueRequest.setIssueType(request.getIssueType());
        issueRequest.setReferenceNumber(request.getReferenceNumber() != null
                ? request.getReferenceNumber()
                : "BOM-" + bom.getName());
        issueRequest.setNotes(request.getNotes());
        issueRequest.setLines(lines);
        return createIssue(issueRequest);
    }

    public GoodsIssue getIssue(Long issueId) {
        return issueRepository.findById(issueId)
                .orElseThrow(() -> new RecordNotFoundException("Goods issue", issueId));
    }

    public List<GoodsIssue> getAllIssues() {
        return issueRepository.findAllByOrderByCreatedAtDesc();
    }

    public List<GoodsIssue> getPendingIssues() {
        return issueRepository.findByStatusOrderByIssueDateAsc(IssueStatus.PENDING);
    }

    public List<GoodsIssue> getIssuesByType(IssueType issueType) {
        return issueRepository.findByIssueTypeOrderByIssueDateDesc(issueType);
    }

    private GoodsIssue post(GoodsIssue issue) {
        requirePending(issue, "post");
        if (issue.getLines().isEmpty()) {
            throw new IllegalArgumentException("Goods issue " + issue.getIssueNumber() + " has no lines");
        }

        // Validate every material first, in id order so concurrent posts lock in the same order
        validateLines(issue.getLines());

        List<GoodsIssueLine> ordered = issue.getLines().stream()
                .sorted(Comparator.comparing(GoodsIssueLine::getMaterialId)
                        .thenComparing(GoodsIssueLine::getId, Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
        for (GoodsIssueLine line : ordered) {
            ConsumptionResult result = ledgerService.consume(line.getMaterialId(), line.getRequestedQuantity());
            line.setUnitCost(result.averageUnitCost());
            line.getConsumedLayers().clear();
            line.getConsumedLayers().addAll(result.layersConsumed());
        }

        issue.setStatus(IssueStatus.ISSUED);
        issue.setPostedAt(LocalDateTime.now());
        issue.setIssuedBy(auditService.currentUsername());
        GoodsIssue saved = issueRepository.save(issue);

        log.info("Posted goods issue {} ({} line(s))", issue.getIssueNumber(), issue.getLines().size());
        auditService.log("POST_ISSUE", "Issue: " + issue.getIssueNumber() + ", Lines: " + issue.getLines().size());
        return saved;
    }

    private void validateLines(Collection<GoodsIssueLine> lines) {
        Map<Long, BigDecimal> totals = new TreeMap<>();
        for (GoodsIssueLine line : lines) {
            totals.merge(line.getMaterialId(), line.getRequestedQuantity(), BigDecimal::add);
        }
        totals.forEach(ledgerService::checkAvailability);
    }

    private void requirePending(GoodsIssue issue, String action) {
        if (issue.getStatus() != IssueStatus.PENDING) {
            log.warn("Rejected {} of goods issue {} in status {}", action, issue.getIssueNumber(), issue.getStatus());
            throw new IssueStateException(issue.getIssueNumber(), issue.getStatus(), action);
        }
    }

    private GoodsIssueLine findLine(GoodsIssue issue, Long lineId) {
        return issue.getLines().stream()
                .filter(l -> lineId.equals(l.getId()))
                .findFirst()
                .orElseThrow(() -> new RecordNotFoundException("Goods issue line", lineId));
    }

    private void checkLine(IssueLineRequest request) {
        if (request.getQuantity() == null || request.getQuantity().signum() <= 0) {
            throw new IllegalArgumentException("Issue quantity must be greater than zero");
        }
        materialService.getMaterial(request.getMaterialId());
    }

    private GoodsIssueLine toLine(IssueLineRequest request) {
        GoodsIssueLine line = new GoodsIssueLine();
        line.setMaterialId(request.getMaterialId());
        line.setRequestedQuantity(request.getQuantity());
        line.setBatchNumber(request.getBatchNumber());
        line.setNotes(request.getNotes());
        return line;
    }

    String nextIssueNumber() {
        String prefix = properties.getIssue().getNumberPrefix();
        long nextNum = 1;
        Optional<GoodsIssue> lastIssue = issueRepository.findTopByOrderByIdDesc();
        if (lastIssue.isPresent()) {
            String lastNumber = lastIssue.get().getIssueNumber();
            if (lastNumber.startsWith(prefix)) {
                try {
                    nextNum = Long.parseLong(lastNumber.substring(prefix.length())) + 1;
                } catch (NumberFormatException e) {
                    log.warn("Unexpected issue number format {}, falling back to count", lastNumber);
                    nextNum = issueRepository.count() + 1;
                }
            } else {
                nextNum = issueRepository.count() + 1;
            }
        }
        return String.format("%s%05d", prefix, nextNum);
    }
}
