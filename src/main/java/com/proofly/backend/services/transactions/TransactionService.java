package com.proofly.backend.services.transactions;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.proofly.backend.config.IngestionProperties;
import com.proofly.backend.dto.transactions.TransactionBulkUpdateRequest;
import com.proofly.backend.dto.transactions.TransactionFilter;
import com.proofly.backend.dto.transactions.TransactionRequestDTO;
import com.proofly.backend.dto.transactions.TransactionStatisticsDTO;
import com.proofly.backend.dto.transactions.TransactionUpdateRequest;
import com.proofly.backend.entities.FinancialTransaction;
import com.proofly.backend.enums.SourcePlatform;
import com.proofly.backend.enums.TransactionCategory;
import com.proofly.backend.enums.TransactionType;
import com.proofly.backend.exceptions.BadRequestException;
import com.proofly.backend.exceptions.ResourceNotFoundException;
import com.proofly.backend.repositories.FinancialTransactionRepository;
import com.proofly.backend.services.reports.ReportAggregationService;
import com.proofly.backend.services.reports.ReportFigures;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Service
@RequiredArgsConstructor
@Slf4j
@Transactional
public class TransactionService {

    private final FinancialTransactionRepository transactionRepository;
    private final IngestionProperties ingestionProperties;

    public FinancialTransaction createManual(UUID userId, TransactionRequestDTO dto) {
        FinancialTransaction tx = FinancialTransaction.builder()
                .userId(userId)
                .transactionDate(dto.transactionDate())
                .amount(dto.amount().abs())
                .currency(dto.currency() != null ? dto.currency().toUpperCase(Locale.ROOT) : ingestionProperties.defaultCurrency())
                .description(dto.description())
                .referenceNumber(dto.referenceNumber())
                .counterparty(dto.counterparty())
                .transactionType(dto.transactionType())
                .category(dto.category() != null ? dto.category() : TransactionCategory.OTHER)
                .sourcePlatform(SourcePlatform.MANUAL_ENTRY.getCode())
                .manuallyVerified(true)
                .build();
        FinancialTransaction saved = transactionRepository.save(tx);
        log.info("[Transactions] manual entry created id={} userId={}", saved.getId(), userId);
        return saved;
    }

    @Transactional(readOnly = true)
    public FinancialTransaction getForUser(UUID userId, UUID transactionId) {
        return transactionRepository.findByIdAndUserId(transactionId, userId)
                .orElseThrow(() -> new ResourceNotFoundException("Transaction not found"));
    }

    @Transactional(readOnly = true)
    public Page<FinancialTransaction> list(UUID userId, TransactionFilter filter, Pageable pageable) {
        if (filter != null && filter.dateFrom() != null && filter.dateTo() != null
                && filter.dateTo().isBefore(filter.dateFrom())) {
            throw new BadRequestException("dateTo must not be before dateFrom");
        }
        return transactionRepository.findAll(TransactionSpecifications.forUser(userId, filter), pageable);
    }

    /**
     * Applies the non-null fields and marks the transaction as manually verified, which keeps
     * later AI categorization runs from overwriting it.
     */
    public FinancialTransaction update(UUID userId, UUID transactionId, TransactionUpdateRequest dto) {
        FinancialTransaction tx = getForUser(userId, transactionId);
        if (dto.transactionDate() != null) tx.setTransactionDate(dto.transactionDate());
        if (dto.amount() != null) tx.setAmount(dto.amount().abs());
        if (dto.transactionType() != null) tx.setTransactionType(dto.transactionType());
        if (dto.category() != null) tx.setCategory(dto.category());
        if (dto.description() != null) tx.setDescription(dto.description());
        if (dto.referenceNumber() != null) tx.setReferenceNumber(dto.referenceNumber());
        if (dto.counterparty() != null) tx.setCounterparty(dto.counterparty());
        tx.setManuallyVerified(true);
        return transactionRepository.save(tx);
    }

    /**
     * Sets category and/or direction on a set of the user's transactions. The whole request is
     * rejected if any id does not belong to the user.
     */
    public List<FinancialTransaction> bulkUpdate(UUID userId, TransactionBulkUpdateRequest request) {
        if (request.category() == null && request.transactionType() == null) {
            throw new BadRequestException("Provide a category or a transactionType");
        }
        Set<UUID> requested = new HashSet<>(request.transactionIds());
        List<FinancialTransaction> owned = transactionRepository.findByUserIdAndIdIn(userId, requested);
        if (owned.size() != requested.size()) {
            throw new BadRequestException("Some transactions were not found");
        }
        for (FinancialTransaction tx : owned) {
            if (request.category() != null) tx.setCategory(request.category());
            if (request.transactionType() != null) tx.setTransactionType(request.transactionType());
            tx.setManuallyVerified(true);
        }
        List<FinancialTransaction> saved = transactionRepository.saveAll(owned);
        log.info("[Transactions] bulk update userId={} count={}", userId, saved.size());
        return saved;
    }

    public void delete(UUID userId, UUID transactionId) {
        FinancialTransaction tx = getForUser(userId, transactionId);
        transactionRepository.delete(tx);
    }

    @Transactional(readOnly = true)
    public TransactionStatisticsDTO statistics(UUID userId, LocalDate from, LocalDate to) {
        if (to.isBefore(from)) {
            throw new BadRequestException("dateTo must not be before dateFrom");
        }
        List<FinancialTransaction> inRange = transactionRepository
                .findByUserIdAndTransactionDateBetweenOrderByTransactionDateAsc(
                        userId, from.atStartOfDay(), to.atTime(LocalTime.MAX));
        ReportFigures figures = inRange.isEmpty()
                ? ReportFigures.empty()
                : ReportAggregationService.aggregate(inRange, from, to);
        int expenseCount = (int) inRange.stream()
                .filter(t -> t.getTransactionType() == TransactionType.EXPENSE)
                .count();

        return TransactionStatisticsDTO.builder()
                .dateFrom(from)
                .dateTo(to)
                .totalIncome(figures.totalIncome())
                .totalExpenses(figures.totalExpenses())
                .netIncome(figures.netIncome())
                .transactionCount(figures.transactionCount())
                .incomeCount(figures.incomeCount())
                .expenseCount(expenseCount)
                .incomeByCategory(figures.incomeBreakdown())
                .expensesByCategory(figures.expenseBreakdown())
                .monthlyTrends(figures.monthlyTrends())
                .build();
    }
}
