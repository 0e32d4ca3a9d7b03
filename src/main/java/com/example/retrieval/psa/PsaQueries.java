package com.example.retrieval.psa;

import com.example.retrieval.query.Query;
import com.example.retrieval.query.SoqlQueryBuilder;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Queries against the professional services automation objects: timecards and projects.
 */
public final class PsaQueries {

    public static final String TIMECARD_OBJECT = "pse__Timecard__c";

    public static final List<String> TIMECARD_FIELDS = List.of(
            "pse__Project__r.pse__Opportunity__r.OpportunityNumber__c",
            "pse__Project__r.OPA_Project_Number__c",
            "pse__Project__r.pse__Start_Date__c",
            "pse__Project__r.pse__End_Date__c",
            "pse__Project__r.Name",
            "pse__Milestone__r.OPA_Task_Number__c",
            "pse__Milestone__r.Name",
            "pse__Resource__r.Name",
            "pse__Start_Date__c",
            "pse__Total_Hours__c",
            "pse__Submitted__c",
            "pse__Sunday_Notes__c",
            "pse__Monday_Notes__c",
            "pse__Tuesday_Notes__c",
            "pse__Wednesday_Notes__c",
            "pse__Thursday_Notes__c",
            "pse__Friday_Notes__c",
            "pse__Saturday_Notes__c"
    );

    /**
     * Rejected timecards, zero-hour timecards and non-billable ("NB") milestones are excluded.
     */
    public static final List<String> TIMECARD_FILTER = List.of(
            "pse__Status__c NOT IN ('Rejected')",
            "pse__Total_Hours__c != 0",
            "(NOT pse__Milestone__r.Name LIKE 'NB%')"
    );

    public static final String PROJECT_OBJECT = "pse__Proj__c";

    public static final List<String> PROJECT_FIELDS = List.of(
            "pse__Opportunity__r.OpportunityNumber__c",
            "Name",
            "pse__Account__c",
            "pse__Account__r.Name",
            "Region_Level_2__c",
            "pse__Stage__c",
            "pse__Start_Date__c",
            "pse__End_Date__c",
            "OPA_Project_Number__c"
    );

    static final int MAX_OPPORTUNITY_NUMBER_LENGTH = 50;

    static final int MAX_RANGE_DAYS = 365;

    private PsaQueries() {
    }

    /**
     * Timecards of one opportunity whose start date lies in {@code [startDate, endDate]},
     * ordered by start date.
     *
     * @throws IllegalArgumentException if the opportunity number or the date range is invalid
     */
    public static Query timecards(String opportunityNumber, LocalDate startDate, LocalDate endDate) {
        String opportunity = validOpportunityNumber(opportunityNumber);
        validateRange(startDate, endDate);

        return SoqlQueryBuilder.select(TIMECARD_FIELDS)
                .from(TIMECARD_OBJECT)
                .where(TIMECARD_FILTER)
                .where("pse__Project__r.pse__Opportunity__r.OpportunityNumber__c = "
                        + SoqlQueryBuilder.literal(opportunity))
                .where("pse__Start_Date__c >= " + SoqlQueryBuilder.literal(startDate))
                .where("pse__Start_Date__c <= " + SoqlQueryBuilder.literal(endDate))
                .orderBy("pse__Start_Date__c")
                .build();
    }

    /**
     * Projects linked to one opportunity.
     *
     * @throws IllegalArgumentException if the opportunity number is invalid
     */
    public static Query projects(String opportunityNumber) {
        String opportunity = validOpportunityNumber(opportunityNumber);

        return SoqlQueryBuilder.select(PROJECT_FIELDS)
                .from(PROJECT_OBJECT)
                .where("pse__Opportunity__r.OpportunityNumber__c = " + SoqlQueryBuilder.literal(opportunity))
                .build();
    }

    private static String validOpportunityNumber(String opportunityNumber) {
        if (opportunityNumber == null || opportunityNumber.isBlank()) {
            throw new IllegalArgumentException("Opportunity number is required");
        }
        String trimmed = opportunityNumber.trim();
        if (trimmed.length() > MAX_OPPORTUNITY_NUMBER_LENGTH) {
            throw new IllegalArgumentException("Opportunity number must be at most "
                    + MAX_OPPORTUNITY_NUMBER_LENGTH + " characters");
        }
        return trimmed;
    }

    private static void validateRange(LocalDate startDate, LocalDate endDate) {
        if (startDate == null || endDate == null) {
            throw new IllegalArgumentException("Start and end dates are required");
        }
        if (startDate.isAfter(endDate)) {
            throw new IllegalArgumentException("Start date " + startDate + " is after end date " + endDate);
        }
        if (ChronoUnit.DAYS.between(startDate, endDate) > MAX_RANGE_DAYS) {
            throw new IllegalArgumentException("Date range is too large (max " + MAX_RANGE_DAYS + " days)");
        }
    }
}
