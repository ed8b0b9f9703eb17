package com.proofly.backend.enums;

public enum ReportPurpose {
    LOAN_APPLICATION("Loan Application"),
    GOVERNMENT_SUBSIDY("Government Subsidy"),
    INSURANCE_APPLICATION("Insurance Application"),
    RENTAL_APPLICATION("Rental Application"),
    BUSINESS_REGISTRATION("Business Registration"),
    VISA_APPLICATION("Visa Application"),
    OTHER("Other");

    private final String label;

    ReportPurpose(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
