package com.proofly.backend.controllers;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.proofly.backend.dto.ApiResponse;
import com.proofly.backend.dto.PageResponseDTO;
import com.proofly.backend.dto.transactions.FinancialTransactionResponseDTO;
import com.proofly.backend.dto.transactions.TransactionBulkUpdateRequest;
import com.proofly.backend.dto.transactions.TransactionFilter;
import com.proofly.backend.dto.transactions.TransactionRequestDTO;
import com.proofly.backend.dto.transactions.TransactionStatisticsDTO;
import com.proofly.backend.dto.transactions.TransactionUpdateRequest;
import com.proofly.backend.enums.TransactionCategory;
import com.proofly.backend.enums.TransactionType;
import com.proofly.backend.security.SecurityService;
import com.proofly.backend.services.transactions.TransactionService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/transactions")
@RequiredArgsConstructor
public class TransactionController {

    private final TransactionService transactionService;
    private final SecurityService securityService;

    @PostMapping
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<ApiResponse<FinancialTransactionResponseDTO>> create(
            @Valid @RequestBody TransactionRequestDTO dto
    ) {
        FinancialTransactionResponseDTO created = FinancialTransactionResponseDTO.from(
                transactionService.createManual(securityService.currentUserId(), dto));
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(created, "Transaction created"));
    }

    @GetMapping
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<ApiResponse<PageResponseDTO<FinancialTransactionResponseDTO>>> list(
            @RequestParam(value = "transactionType", required = false) TransactionType transactionType,
            @RequestParam(value = "category", required = false) TransactionCategory category,
            @RequestParam(value = "source", required = false) String source,
            @RequestParam(value = "search", required = false) String search,
            @RequestParam(value = "dateFrom", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateFrom,
            @RequestParam(value = "dateTo", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateTo,
            @RequestParam(value = "page", defaultValue = "0") int page,
            @RequestParam(value = "size", defaultValue = "50") int size
    ) {
        TransactionFilter filter = new TransactionFilter(transactionType, category, source, search, dateFrom, dateTo);
        PageRequest pageable = PageRequest.of(page, Math.min(size, 200), Sort.by(Sort.Direction.DESC, "transactionDate"));
        PageResponseDTO<FinancialTransactionResponseDTO> result = PageResponseDTO.of(
                transactionService.list(securityService.currentUserId(), filter, pageable),
                FinancialTransactionResponseDTO::from);
        return ResponseEntity.ok(ApiResponse.success(result, "Transactions"));
    }

    @GetMapping("/statistics")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<ApiResponse<TransactionStatisticsDTO>> statistics(
            @RequestParam("dateFrom") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateFrom,
            @RequestParam("dateTo") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateTo
    ) {
        TransactionStatisticsDTO stats = transactionService.statistics(securityService.currentUserId(), dateFrom, dateTo);
        return ResponseEntity.ok(ApiResponse.success(stats, "Transaction statistics"));
    }

    @GetMapping("/{id}")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<ApiResponse<FinancialTransactionResponseDTO>> get(@PathVariable UUID id) {
        FinancialTransactionResponseDTO dto = FinancialTransactionResponseDTO.from(
                transactionService.getForUser(securityService.currentUserId(), id));
        return ResponseEntity.ok(ApiResponse.success(dto, "Transaction"));
    }

    @PatchMapping("/{id}")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<ApiResponse<FinancialTransactionResponseDTO>> update(
            @PathVariable UUID id,
            @Valid @RequestBody TransactionUpdateRequest dto
    ) {
        FinancialTransactionResponseDTO updated = FinancialTransactionResponseDTO.from(
                transactionService.update(securityService.currentUserId(), id, dto));
        return ResponseEntity.ok(ApiResponse.success(updated, "Transaction updated"));
    }

    @PostMapping("/bulk-update")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<ApiResponse<List<FinancialTransactionResponseDTO>>> bulkUpdate(
            @Valid @RequestBody TransactionBulkUpdateRequest request
    ) {
        List<FinancialTransactionResponseDTO> updated = transactionService
                .bulkUpdate(securityService.currentUserId(), request)
                .stream()
                .map(FinancialTransactionResponseDTO::from)
                .toList();
        return ResponseEntity.ok(ApiResponse.success(updated, "Transactions updated"));
    }

    @DeleteMapping("/{id}")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<ApiResponse<Void>> delete(@PathVariable UUID id) {
        transactionService.delete(securityService.currentUserId(), id);
        return ResponseEntity.ok(ApiResponse.success(null, "Transaction deleted"));
    }
}
