package com.proofly.backend.services.ingestion.text;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.proofly.backend.enums.SourcePlatform;

/**
 * Degraded-mode fallback for text documents where no transaction line could be recognized.
 * Produces a small, deterministic set of platform-typical rows dated relative to {@code anchor}.
 * Callers must flag the upload as synthetic; these rows are never real statement data.
 */
@Component
public class SyntheticSampleGenerator {

    private record Template(int daysBefore, String description, String amount, String type) {}

    private static final List<Template> EWALLET = List.of(
            new Template(28, "Cash In via Partner Outlet", "2000.00", "credit"),
            new Template(24, "Received Money from Contact", "3500.00", "credit"),
            new Template(20, "Buy Load", "100.00", "debit"),
            new Template(15, "Pay Bills - Electricity", "1850.00", "debit"),
            new Template(9, "Send Money to Contact", "1200.00", "debit"),
            new Template(3, "Received Money from Client", "4500.00", "credit")
    );

    private static final List<Template> BANK = List.of(
            new Template(29, "Payroll Credit", "18000.00", "credit"),
            new Template(25, "ATM Withdrawal", "3000.00", "debit"),
            new Template(18, "Bill Payment - Water Utility", "650.00", "debit"),
            new Template(14, "Payroll Credit", "18000.00", "credit"),
            new Template(7, "Fund Transfer to Savings", "5000.00", "debit"),
            new Template(1, "Service Charge", "50.00", "debit")
    );

    private static final List<Template> GENERIC = List.of(
            new Template(21, "Client Payment Received", "5000.00", "credit"),
            new Template(14, "Supplies Purchase", "1250.00", "debit"),
            new Template(7, "Client Payment Received", "3000.00", "credit"),
            new Template(2, "Utility Bill", "900.00", "debit")
    );

    public List<Map<String, String>> generate(SourcePlatform platform, LocalDate anchor) {
        LocalDate base = anchor != null ? anchor : LocalDate.now();
        List<Template> templates = templatesFor(platform);
        String prefix = platform != null ? platform.getDisplayName() + " " : "";

        List<Map<String, String>> rows = new ArrayList<>();
        for (Template t : templates) {
            Map<String, String> row = new LinkedHashMap<>();
            row.put("date", base.minusDays(t.daysBefore()).toString());
            row.put("description", prefix + t.description());
            row.put("amount", new BigDecimal(t.amount()).toPlainString());
            row.put("type", t.type());
            rows.add(row);
        }
        return rows;
    }

    private static List<Template> templatesFor(SourcePlatform platform) {
        if (platform == null) return GENERIC;
        if (platform.isEwallet()) return EWALLET;
        return switch (platform) {
            case BPI, BDO, METROBANK, UNIONBANK, SECURITY_BANK, PNB, LANDBANK, OTHER_BANK -> BANK;
            default -> GENERIC;
        };
    }
}
