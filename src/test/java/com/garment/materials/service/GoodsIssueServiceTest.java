package com.garment.materials.service;

import com.garment.materials.config.MaterialsProperties;
import com.garment.materials.dto.BomIssueRequest;
import com.garment.materials.dto.ConsumptionResult;
import com.garment.materials.dto.GoodsIssueRequest;
import com.garment.materials.dto.GoodsIssueUpdateRequest;
import com.garment.materials.dto.IssueLineRequest;
import com.garment.materials.dto.MaterialRequirement;
import com.garment.materials.exception.InsufficientInventoryException;
import com.garment.materials.exception.IssueStateException;
import com.garment.materials.exception.RecordNotFoundException;
import com.garment.materials.model.BomHeader;
import com.garment.materials.model.GoodsIssue;
import com.garment.materials.model.GoodsIssueLine;
import com.garment.materials.model.IssueStatus;
import com.garment.materials.model.IssueType;
import com.garment.materials.model.LayerDraw;
import com.garment.materials.model.Material;
import com.garment.materials.repository.GoodsIssueRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class GoodsIssueServiceTest {

    @Mock
    private GoodsIssueRepository issueRepository;

    @Mock
    private InventoryLedgerService ledgerService;

    @Mock
    private BomService bomService;

    @Mock
    private MaterialService materialService;

    @Mock
    private AuditService auditService;

    private GoodsIssueService service;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        service = new GoodsIssueService(issueRepository, ledgerService, bomService, materialService, auditService,
                new MaterialsProperties());
        when(issueRepository.save(any(GoodsIssue.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(materialService.getMaterial(anyLong())).thenReturn(new Material());
        when(auditService.currentUsername()).thenReturn("stores");
    }

    private static BigDecimal qty(String value) {
        return argThat(q -> q != null && q.compareTo(new BigDecimal(value)) == 0);
    }

    private static GoodsIssueLine line(long id, long materialId, String quantity) {
        GoodsIssueLine line = new GoodsIssueLine();
        line.setId(id);
        line.setMaterialId(materialId);
        line.setRequestedQuantity(new BigDecimal(quantity));
        return line;
    }

    private GoodsIssue pendingIssue(GoodsIssueLine... lines) {
        GoodsIssue issue = new GoodsIssue();
        issue.setId(5L);
        issue.setIssueNumber("GI-00005");
        issue.setStatus(IssueStatus.PENDING);
        for (GoodsIssueLine line : lines) {
            issue.addLine(line);
        }
        when(issueRepository.findById(5L)).thenReturn(Optional.of(issue));
        return issue;
    }

    private static ConsumptionResult result(long materialId, String quantity, String averageCost) {
        return new ConsumptionResult(materialId, new BigDecimal(quantity), new BigDecimal(averageCost),
                List.of(new LayerDraw(100L + materialId, new BigDecimal(quantity), new BigDecimal(averageCost))));
    }

    @Test
    void postIssue_consumesEveryLineAndMarksIssued() {
        GoodsIssue issue = pendingIssue(line(1, 2, "3"), line(2, 1, "4"), line(3, 2, "1"));
        when(ledgerService.consume(eq(1L), any())).thenReturn(result(1, "4", "2.5000"));
        when(ledgerService.consume(eq(2L), qty("3"))).thenReturn(result(2, "3", "1.0000"));
        when(ledgerService.consume(eq(2L), qty("1"))).thenReturn(result(2, "1", "1.2000"));

        GoodsIssue posted = service.postIssue(5L);

        assertEquals(IssueStatus.ISSUED, posted.getStatus());
        assertEquals("stores", posted.getIssuedBy());
        assertNotNull(posted.getPostedAt());
        assertEquals(0, new BigDecimal("1.0000").compareTo(issue.getLines().get(0).getUnitCost()));
        assertEquals(0, new BigDecimal("2.5000").compareTo(issue.getLines().get(1).getUnitCost()));
        assertEquals(0, new BigDecimal("1.2000").compareTo(issue.getLines().get(2).getUnitCost()));
        assertEquals(1, issue.getLines().get(1).getConsumedLayers().size());

        InOrder inOrder = inOrder(ledgerService);
        inOrder.verify(ledgerService).checkAvailability(eq(1L), qty("4"));
        inOrder.verify(ledgerService).checkAvailability(eq(2L), qty("4"));
        inOrder.verify(ledgerService).consume(eq(1L), qty("4"));
        inOrder.verify(ledgerService).consume(eq(2L), qty("3"));
        inOrder.verify(ledgerService).consume(eq(2L), qty("1"));
        verify(auditService).log(eq("POST_ISSUE"), contains("GI-00005"));
    }

    @Test
    void postIssue_shortStockConsumesNothing() {
        GoodsIssue issue = pendingIssue(line(1, 1, "2"), line(2, 2, "50"));
        doThrow(new InsufficientInventoryException(2L, "Rib", new BigDecimal("10"), new BigDecimal("50")))
                .when(ledgerService).checkAvailability(eq(2L), any());

        assertThrows(InsufficientInventoryException.class, () -> service.postIssue(5L));

        verify(ledgerService, never()).consume(anyLong(), any());
        assertEquals(IssueStatus.PENDING, issue.getStatus());
        assertNull(issue.getLines().get(0).getUnitCost());
    }

    @Test
    void postIssue_rejectsIssuedAndCancelled() {
        GoodsIssue issue = pendingIssue(line(1, 1, "2"));
        issue.setStatus(IssueStatus.ISSUED);

        IssueStateException ex = assertThrows(IssueStateException.class, () -> service.postIssue(5L));
        assertEquals("Cannot post goods issue GI-00005 (Status: ISSUED)", ex.getMessage());

        issue.setStatus(IssueStatus.CANCELLED);
        assertThrows(IssueStateException.class, () -> service.postIssue(5L));
        verifyNoInteractions(ledgerService);
    }

    @Test
    void postIssue_rejectsEmptyIssue() {
        pendingIssue();

        assertThrows(IllegalArgumentException.class, () -> service.postIssue(5L));
    }

    @Test
    void cancelIssue_onlyFromPending() {
        GoodsIssue issue = pendingIssue(line(1, 1, "2"));

        assertEquals(IssueStatus.CANCELLED, service.cancelIssue(5L).getStatus());
        assertThrows(IssueStateException.class, () -> service.cancelIssue(5L));

        issue.setStatus(IssueStatus.ISSUED);
        assertThrows(IssueStateException.class, () -> service.cancelIssue(5L));
        verifyNoInteractions(ledgerService);
    }

    @Test
    void deleteIssue_blockedOnceIssued() {
        GoodsIssue issue = pendingIssue(line(1, 1, "2"));
        issue.setStatus(IssueStatus.ISSUED);

        assertThrows(IssueStateException.class, () -> service.deleteIssue(5L));
        verify(issueRepository, never()).delete(any());
    }

    @Test
    void addLine_blockedOnceCancelled() {
        GoodsIssue issue = pendingIssue(line(1, 1, "2"));
        issue.setStatus(IssueStatus.CANCELLED);

        assertThrows(IssueStateException.class,
                () -> service.addLine(5L, new IssueLineRequest(1L, BigDecimal.ONE)));
        assertEquals(1, issue.getLines().size());
    }

    @Test
    void updateLine_replacesPendingLineValues() {
        GoodsIssue issue = pendingIssue(line(1, 1, "2"), line(2, 3, "4"));

        GoodsIssueLine updated = service.updateLine(5L, 2L, new IssueLineRequest(4L, new BigDecimal("6"), "B-7", null));

        assertSame(issue.getLines().get(1), updated);
        assertEquals(4L, updated.getMaterialId());
        assertEquals(0, new BigDecimal("6").compareTo(updated.getRequestedQuantity()));
        assertEquals("B-7", updated.getBatchNumber());
        assertThrows(RecordNotFoundException.class,
                () -> service.updateLine(5L, 9L, new IssueLineRequest(1L, BigDecimal.ONE)));
        assertThrows(IllegalArgumentException.class,
                () -> service.updateLine(5L, 1L, new IssueLineRequest(1L, BigDecimal.ZERO)));
        assertEquals(0, new BigDecimal("2").compareTo(issue.getLines().get(0).getRequestedQuantity()));
    }

    @Test
    void updateLine_blockedOnceIssued() {
        GoodsIssue issue = pendingIssue(line(1, 1, "2"));
        issue.setStatus(IssueStatus.ISSUED);

        assertThrows(IssueStateException.class,
                () -> service.updateLine(5L, 1L, new IssueLineRequest(1L, BigDecimal.TEN)));
        assertEquals(0, new BigDecimal("2").compareTo(issue.getLines().get(0).getRequestedQuantity()));
    }

    @Test
    void updateIssue_changesHeaderOnlyWhilePending() {
        GoodsIssue issue = pendingIssue(line(1, 1, "2"));
        issue.setIssueType(IssueType.PRODUCTION);
        issue.setReferenceNumber("CUT-9");
        GoodsIssueUpdateRequest request = new GoodsIssueUpdateRequest();
        request.setIssueType(IssueType.MAINTENANCE);

        service.updateIssue(5L, request);

        assertEquals(IssueType.MAINTENANCE, issue.getIssueType());
        assertEquals("CUT-9", issue.getReferenceNumber());
        assertEquals(IssueStatus.PENDING, issue.getStatus());
        verify(auditService).log(eq("UPDATE_ISSUE"), anyString());

        issue.setStatus(IssueStatus.CANCELLED);
        request.setIssueType(IssueType.WASTE);
        assertThrows(IssueStateException.class, () -> service.updateIssue(5L, request));
        assertEquals(IssueType.MAINTENANCE, issue.getIssueType());
    }

    @Test
    void createIssue_checksSummedQuantityPerMaterial() {
        GoodsIssueRequest request = new GoodsIssueRequest();
        request.setLines(List.of(new IssueLineRequest(1L, new BigDecimal("3")),
                new IssueLineRequest(1L, new BigDecimal("4"))));

        GoodsIssue created = service.createIssue(request);

        verify(ledgerService).checkAvailability(eq(1L), qty("7"));
        assertEquals(IssueStatus.PENDING, created.getStatus());
        assertEquals("GI-00001", created.getIssueNumber());
        assertEquals(2, created.getLines().size());
    }

    @Test
    void issueNumber_followsLastIssue() {
        GoodsIssue last = new GoodsIssue();
        last.setIssueNumber("GI-00041");
        when(issueRepository.findTopByOrderByIdDesc()).thenReturn(Optional.of(last));

        assertEquals("GI-00042", service.nextIssueNumber());

        last.setIssueNumber("GI-X1");
        when(issueRepository.count()).thenReturn(7L);
        assertEquals("GI-00008", service.nextIssueNumber());
    }

    @Test
    void createBomBasedIssue_skipsZeroRequirements() {
        BomHeader bom = new BomHeader();
        bom.setId(3L);
        bom.setName("T-Shirt");
        when(bomService.getBom(3L)).thenReturn(bom);
        when(bomService.calculateRequirements(eq(3L), any(BigDecimal.class))).thenReturn(List.of(
                new MaterialRequirement(10L, "Jersey", "m", new BigDecimal("22"), new BigDecimal("5"),
                        new BigDecimal("110")),
                new MaterialRequirement(11L, "Label", "pcs", BigDecimal.ZERO, null, BigDecimal.ZERO)));

        BomIssueRequest request = new BomIssueRequest();
        request.setBomId(3L);
        request.setQuantityToProduce(BigDecimal.TEN);

        GoodsIssue issue = service.createBomBasedIssue(request);

        assertEquals(1, issue.getLines().size());
        assertEquals(10L, issue.getLines().get(0).getMaterialId());
        assertEquals("BOM-T-Shirt", issue.getReferenceNumber());
        verify(ledgerService).checkAvailability(eq(10L), qty("22"));
    }

    @Test
    void createBomBasedIssue_needsQuantityOrSelections() {
        BomHeader bom = new BomHeader();
        bom.setId(3L);
        when(bomService.getBom(3L)).thenReturn(bom);
        BomIssueRequest request = new BomIssueRequest();
        request.setBomId(3L);

        assertThrows(IllegalArgumentException.class, () -> service.createBomBasedIssue(request));
    }
}
