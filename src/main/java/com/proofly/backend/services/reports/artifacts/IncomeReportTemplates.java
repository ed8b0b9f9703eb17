package com.proofly.backend.services.reports.artifacts;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.proofly.backend.entities.IncomeReport;

/**
 * XHTML layout of the income report PDF. openhtmltopdf needs well-formed markup, so every
 * element is closed and every value escaped.
 */
final class IncomeReportTemplates {

    static final String CURRENCY = "PHP";

    private IncomeReportTemplates() {}

    static String toHtml(IncomeReport report) {
        StringBuilder sb = new StringBuilder(8_000);
        sb.append("<!DOCTYPE html><html><head><meta charset='utf-8'/>");
        sb.append("<style>")
                .append("body{font-family:Helvetica,Arial,sans-serif;font-size:11px;color:#111;margin:24px;}")
                .append("h1{font-size:18px;margin:0 0 4px 0;}")
                .append("h2{font-size:13px;margin:18px 0 6px 0;border-bottom:1px solid #ccc;}")
                .append(".muted{color:#555;}")
                .append("table{width:100%;border-collapse:collapse;}")
                .append("th,td{border-bottom:1px solid #eee;padding:5px 4px;text-align:left;}")
                .append("th{text-transform:uppercase;font-size:9px;color:#555;}")
                .append(".right{text-align:right;}")
                .append(".box{border:1px solid #999;padding:8px;margin-top:8px;}")
                .append("</style>");
        sb.append("</head><body>");

        sb.append("<h1>").append(escape(report.getTitle())).append("</h1>");
        sb.append("<div class='muted'>Period: ")
                .append(escape(String.valueOf(report.getDateFrom())))
                .append(" to ")
                .append(escape(String.valueOf(report.getDateTo())))
                .append("</div>");
        if (report.getOwnerName() != null) {
            sb.append("<div class='muted'>Prepared for: ").append(escape(report.getOwnerName())).append("</div>");
        }
        if (report.getPurpose() != null) {
            sb.append("<div class='muted'>Purpose: ").append(escape(report.getPurpose().getLabel())).append("</div>");
        }

        sb.append("<h2>Summary</h2>");
        if (report.getSummary() != null) {
            sb.append("<p>").append(escape(report.getSummary())).append("</p>");
        }
        sb.append("<table><tbody>");
        sb.append(row("Total income", money(report.getTotalIncome())));
        sb.append(row("Total expenses", money(report.getTotalExpenses())));
        sb.append(row("Net income", money(report.getNetIncome())));
        sb.append(row("Average monthly income", money(report.getAverageMonthlyIncome())));
        sb.append(row("Transactions", String.valueOf(report.getTransactionCount())));
        sb.append(row("Confidence score", report.getConfidenceScore() + "%"));
        sb.append("</tbody></table>");

        sb.append("<h2>Income by category</h2>");
        sb.append(breakdownTable(report.getIncomeBreakdown()));

        sb.append("<h2>Expenses by category</h2>");
        sb.append(breakdownTable(report.getExpenseBreakdown()));

        sb.append("<h2>Monthly trend</h2>");
        sb.append(trendTable(report.getMonthlyTrends()));

        sb.append("<h2>Data sources</h2>");
        sb.append(list(report.getDataSources(), "No data sources recorded."));

        if (report.getAnomalies() != null && !report.getAnomalies().isEmpty()) {
            sb.append("<h2>Observations</h2>");
            sb.append(list(report.getAnomalies(), ""));
        }

        if (report.getInsights() != null && !report.getInsights().isEmpty()) {
            sb.append("<h2>Insights</h2>");
            sb.append(list(report.getInsights(), ""));
        }

        sb.append("<h2>Verification</h2>");
        sb.append("<div class='box'>");
        sb.append("<div>Verification code: <b>").append(escape(report.getVerificationCode())).append("</b></div>");
        sb.append("<div>Verify at: ").append(escape(report.getVerificationUrl())).append("</div>");
        if (report.getExpiresAt() != null) {
            sb.append("<div class='muted'>Valid until ")
                    .append(escape(report.getExpiresAt().toLocalDate().toString()))
                    .append("</div>");
        }
        sb.append("</div>");

        sb.append("<p class='muted'>This report is generated from documents supplied by the account holder. ")
                .append("Figures reflect the transactions available for the stated period.</p>");
        sb.append("</body></html>");
        return sb.toString();
    }

    private static String breakdownTable(Map<String, BigDecimal> rows) {
        StringBuilder sb = new StringBuilder(1_000);
        sb.append("<table><thead><tr><th>Category</th><th class='right'>Amount</th></tr></thead><tbody>");
        if (rows == null || rows.isEmpty()) {
            sb.append("<tr><td colspan='2' class='muted'>No data for the period.</td></tr>");
        } else {
            rows.forEach((k, v) -> sb.append("<tr><td>").append(escape(k))
                    .append("</td><td class='right'>").append(escape(money(v))).append("</td></tr>"));
        }
        sb.append("</tbody></table>");
        return sb.toString();
    }

    private static String trendTable(Map<String, Map<String, BigDecimal>> trends) {
        StringBuilder sb = new StringBuilder(1_000);
        sb.append("<table><thead><tr><th>Month</th><th class='right'>Income</th><th class='right'>Expenses</th></tr></thead><tbody>");
        if (trends == null || trends.isEmpty()) {
            sb.append("<tr><td colspan='3' class='muted'>No data for the period.</td></tr>");
        } else {
            trends.forEach((month, v) -> sb.append("<tr><td>").append(escape(month))
                    .append("</td><td class='right'>").append(escape(money(v.get("income"))))
                    .append("</td><td class='right'>").append(escape(money(v.get("expenses"))))
                    .append("</td></tr>"));
        }
        sb.append("</tbody></table>");
        return sb.toString();
    }

    private static String list(List<String> items, String emptyText) {
        if (items == null || items.isEmpty()) {
            return "<div class='muted'>" + escape(emptyText) + "</div>";
        }
        StringBuilder sb = new StringBuilder("<ul>");
        for (String item : items) {
            sb.append("<li>").append(escape(item)).append("</li>");
        }
        return sb.append("</ul>").toString();
    }

    private static String row(String label, String value) {
        return "<tr><td>" + escape(label) + "</td><td class='right'>" + escape(value) + "</td></tr>";
    }

    static String money(BigDecimal v) {
        if (v == null) return CURRENCY + " 0.00";
        return CURRENCY + " " + String.format(Locale.ROOT, "%,.2f", v.setScale(2, RoundingMode.HALF_UP));
    }

    static String escape(String s) {
        if (s == null) return "";
        return s
                .replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;")
                .replace("'", "&#39;");
    }
}
