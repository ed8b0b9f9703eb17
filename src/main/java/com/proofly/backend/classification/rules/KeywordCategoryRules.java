package com.proofly.backend.classification.rules;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import com.proofly.backend.enums.CategoryGroup;
import com.proofly.backend.enums.TransactionCategory;
import com.proofly.backend.enums.TransactionType;

/**
 * Keyword rules used to pre-categorize rows at ingestion, before any AI pass.
 * First matching rule wins; rules are only applied when the category group fits the direction.
 */
public final class KeywordCategoryRules {

    private KeywordCategoryRules() {}

    public record Rule(TransactionCategory category, List<String> keywords) {
        public Rule {
            if (category == null) throw new IllegalArgumentException("category is required");
            if (keywords == null || keywords.isEmpty()) throw new IllegalArgumentException("keywords are required");
        }
    }

    /**
     * Category -> keywords, in evaluation order. Keywords are lowercase.
     * Fees and transfers come first since their descriptions often also mention a merchant.
     */
    public static final Map<TransactionCategory, List<String>> CATEGORY_KEYWORDS;

    public static final List<Rule> RULES;

    static {
        Map<TransactionCategory, List<String>> m = new LinkedHashMap<>();

        m.put(TransactionCategory.ATM_FEE, List.of("atm fee", "atm charge", "interbank withdrawal fee"));
        m.put(TransactionCategory.SERVICE_FEE, List.of("service charge", "maintenance fee", "monthly fee", "penalty fee"));
        m.put(TransactionCategory.TRANSACTION_FEE, List.of("transaction fee", "convenience fee", "transfer fee", "instapay fee"));

        m.put(TransactionCategory.CASH_IN, List.of("cash in", "cash-in", "top up", "top-up"));
        m.put(TransactionCategory.CASH_OUT, List.of("cash out", "cash-out", "atm withdrawal", "over the counter withdrawal"));
        m.put(TransactionCategory.BANK_TRANSFER, List.of("instapay", "pesonet", "fund transfer", "bank transfer", "interbank"));
        m.put(TransactionCategory.EWALLET_TRANSFER, List.of("send money", "express send", "gcash transfer", "maya transfer"));

        m.put(TransactionCategory.SALARY, List.of("salary", "payroll", "sweldo", "wages"));
        m.put(TransactionCategory.FREELANCE, List.of("freelance", "upwork", "fiverr", "onlinejobs", "client payment"));
        m.put(TransactionCategory.COMMISSION, List.of("commission"));
        m.put(TransactionCategory.TIPS, List.of("tip", "gratuity"));
        m.put(TransactionCategory.RENTAL_INCOME, List.of("rental income", "rent received", "boarder"));
        m.put(TransactionCategory.GOVERNMENT_BENEFIT, List.of("4ps", "dswd", "sss benefit", "pantawid", "ayuda"));
        m.put(TransactionCategory.LOAN_RECEIVED, List.of("loan proceeds", "loan release", "loan disbursement"));
        m.put(TransactionCategory.GIFT_RECEIVED, List.of("gift", "padala received", "remittance received"));
        m.put(TransactionCategory.BUSINESS_INCOME, List.of("sales", "sari-sari", "store income", "order payment"));

        m.put(TransactionCategory.FOOD, List.of("jollibee", "mcdo", "mcdonald", "foodpanda", "grabfood", "restaurant", "grocery", "bakery", "carinderia"));
        m.put(TransactionCategory.TRANSPORTATION, List.of("grab ride", "angkas", "joyride", "jeep", "lrt", "mrt", "fare", "petron", "shell", "caltex", "fuel"));
        m.put(TransactionCategory.UTILITIES, List.of("meralco", "maynilad", "manila water", "pldt", "converge", "globe", "smart", "electric", "water bill", "internet", "buy load"));
        m.put(TransactionCategory.RENT, List.of("rent", "lease", "apartment"));
        m.put(TransactionCategory.HEALTHCARE, List.of("pharmacy", "mercury drug", "watsons", "hospital", "clinic", "medical"));
        m.put(TransactionCategory.EDUCATION, List.of("tuition", "school", "university", "books"));
        m.put(TransactionCategory.ENTERTAINMENT, List.of("netflix", "spotify", "cinema", "youtube premium", "steam"));
        m.put(TransactionCategory.SHOPPING, List.of("lazada", "shopee", "sm store", "mall", "zalora"));
        m.put(TransactionCategory.LOAN_PAYMENT, List.of("loan payment", "amortization", "cash loan repayment"));
        m.put(TransactionCategory.INSURANCE, List.of("insurance", "premium", "philhealth", "pag-ibig"));
        m.put(TransactionCategory.BUSINESS_EXPENSE, List.of("supplies", "inventory", "wholesale", "puhunan"));
        m.put(TransactionCategory.FAMILY_SUPPORT, List.of("padala", "allowance", "family support"));

        CATEGORY_KEYWORDS = Collections.unmodifiableMap(m);

        List<Rule> rules = new ArrayList<>();
        m.forEach((category, keywords) -> rules.add(new Rule(category, keywords)));
        RULES = Collections.unmodifiableList(rules);
    }

    public static Optional<TransactionCategory> match(String description, TransactionType type) {
        if (description == null || description.isBlank()) return Optional.empty();
        String text = " " + description.toLowerCase(Locale.ROOT) + " ";

        for (Rule rule : RULES) {
            if (!fits(rule.category().getGroup(), type)) continue;
            for (String keyword : rule.keywords()) {
                if (containsWord(text, keyword)) {
                    return Optional.of(rule.category());
                }
            }
        }
        return Optional.empty();
    }

    private static boolean fits(CategoryGroup group, TransactionType type) {
        if (type == null) return false;
        return switch (group) {
            case INCOME -> type == TransactionType.INCOME || type == TransactionType.TRANSFER_IN;
            case EXPENSE -> type == TransactionType.EXPENSE || type == TransactionType.TRANSFER_OUT;
            case TRANSFER, FEE, OTHER -> true;
        };
    }

    // keyword must not be glued to letters on either side ("tip" must not match "multiple")
    private static boolean containsWord(String text, String keyword) {
        int from = 0;
        while (true) {
            int idx = text.indexOf(keyword, from);
            if (idx < 0) return false;
            int end = idx + keyword.length();
            boolean leftOk = idx == 0 || !Character.isLetter(text.charAt(idx - 1));
            boolean rightOk = end >= text.length() || !Character.isLetter(text.charAt(end));
            if (leftOk && rightOk) return true;
            from = idx + 1;
        }
    }
}
