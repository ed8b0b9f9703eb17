package com.proofly.backend.enums;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

public enum TransactionCategory {
    SALARY("salary", "Regular employment income", CategoryGroup.INCOME),
    FREELANCE("freelance", "Freelance work payments", CategoryGroup.INCOME),
    BUSINESS_INCOME("business_income", "Income from business operations", CategoryGroup.INCOME),
    COMMISSION("commission", "Sales commissions", CategoryGroup.INCOME),
    TIPS("tips", "Tips and gratuities", CategoryGroup.INCOME),
    RENTAL_INCOME("rental_income", "Income from rentals", CategoryGroup.INCOME),
    GOVERNMENT_BENEFIT("government_benefit", "Government subsidies/benefits", CategoryGroup.INCOME),
    LOAN_RECEIVED("loan_received", "Money borrowed", CategoryGroup.INCOME),
    GIFT_RECEIVED("gift_received", "Gifts or financial assistance", CategoryGroup.INCOME),

    FOOD("food", "Food and dining expenses", CategoryGroup.EXPENSE),
    TRANSPORTATION("transportation", "Transportation costs", CategoryGroup.EXPENSE),
    UTILITIES("utilities", "Electricity, water, internet bills", CategoryGroup.EXPENSE),
    RENT("rent", "Rent payments", CategoryGroup.EXPENSE),
    HEALTHCARE("healthcare", "Medical expenses", CategoryGroup.EXPENSE),
    EDUCATION("education", "Educational expenses", CategoryGroup.EXPENSE),
    ENTERTAINMENT("entertainment", "Entertainment and leisure", CategoryGroup.EXPENSE),
    SHOPPING("shopping", "General shopping", CategoryGroup.EXPENSE),
    LOAN_PAYMENT("loan_payment", "Loan repayments", CategoryGroup.EXPENSE),
    INSURANCE("insurance", "Insurance payments", CategoryGroup.EXPENSE),
    BUSINESS_EXPENSE("business_expense", "Business-related expenses", CategoryGroup.EXPENSE),
    FAMILY_SUPPORT("family_support", "Money sent to family", CategoryGroup.EXPENSE),

    BANK_TRANSFER("bank_transfer", "Bank transfers", CategoryGroup.TRANSFER),
    EWALLET_TRANSFER("ewallet_transfer", "E-wallet transfers", CategoryGroup.TRANSFER),
    CASH_IN("cash_in", "Cash deposited into the account", CategoryGroup.TRANSFER),
    CASH_OUT("cash_out", "Cash withdrawn from the account", CategoryGroup.TRANSFER),

    TRANSACTION_FEE("transaction_fee", "Per-transaction fees", CategoryGroup.FEE),
    SERVICE_FEE("service_fee", "Service and maintenance fees", CategoryGroup.FEE),
    ATM_FEE("atm_fee", "ATM withdrawal fees", CategoryGroup.FEE),

    OTHER("other", "Anything that fits no other category", CategoryGroup.OTHER);

    private final String code;
    private final String description;
    private final CategoryGroup group;

    TransactionCategory(String code, String description, CategoryGroup group) {
        this.code = code;
        this.description = description;
        this.group = group;
    }

    public String getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }

    public CategoryGroup getGroup() {
        return group;
    }

    public static List<TransactionCategory> ofGroup(CategoryGroup group) {
        return Arrays.stream(values()).filter(c -> c.group == group).toList();
    }

    public static TransactionCategory fromCode(String raw) {
        if (raw == null || raw.isBlank()) return null;
        String v = raw.trim().toLowerCase(Locale.ROOT).replace(' ', '_');
        for (TransactionCategory c : values()) {
            if (c.code.equals(v)) return c;
        }
        return null;
    }
}
