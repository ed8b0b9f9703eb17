package com.proofly.backend.dto.transactions;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class TransactionStatisticsDTO {
    private LocalDate dateFrom;
    private LocalDate dateTo;
    private BigDecimal totalIncome;
    private BigDecimal totalExpenses;
    private BigDecimal netIncome;
    private int transactionCount;
    private int incomeCount;
    private int expenseCount;
    private Map<String, BigDecimal> incomeByCategory;
    private Map<String, BigDecimal> expensesByCategory;
    private Map<String, Map<String, BigDecimal>> monthlyTrends;
}
