package com.bhavyahealth.fetcher.model;

import java.util.List;

/**
 * Fixed column set of the health report table, in storage order.
 * data_date is the unique key; id is left to the database.
 */
public final class HealthColumns {

    public static final String DATA_DATE = "data_date";
    public static final String STATE_NAME = "state_name";
    public static final String FOCUS_AREA = "focus_area";
    public static final String YEAR = "year";
    public static final String MONTH = "month";
    public static final String START_DATE = "start_date";
    public static final String END_DATE = "end_date";
    public static final String SOURCE = "source";
    public static final String FETCHED_AT = "fetched_at";

    public static final List<String> ALL = List.of(
            DATA_DATE, STATE_NAME, FOCUS_AREA, YEAR, MONTH,
            "number_of_abdm_cards_linked", "number_of_abdm_cards_shared", "number_of_abdm_cards_created",
            "number_of_abdm_health_facility_registry", "abdm_healthcare_professionals_registry",
            "number_of_doctors", "number_of_nurses", "number_of_data_entry_operators",
            "number_of_pharmacists", "number_of_lab_attendents", "number_of_community_health_officers",
            "number_of_auxiliary_nurse_midwives", "facilitator_count", "asha_count",
            "number_of_total_patients_visit", "number_of_patient_opd_patient_visit",
            "number_of_male_patient_visit", "number_of_female_patient_visit", "number_of_transgender_patient_visit",
            "unique_patients_total", "number_of_ipd_patient_admission", "number_of_ipd_patient_discharge",
            "number_of_ipd_patient_surgery", "number_of_ipd_patient_transfer",
            "medico_legal_cases_count", "accident_emergency_opd_count", "accident_emergency_observation_count",
            "total_district", "total_blocks", "total_villages", "total_panchayats", "total_hsc",
            "live_hsc", "live_facilities", "asha_beneficiary_count", "asha_eligible_couple_count",
            "asha_household_count", "asha_pregnant_women_count", "delivery_count", "total_child_care_count",
            "eaushadhi_facility_count", "patient_journey_time_min", "patient_waiting_time_min",
            "hsc_patient_registered_total", "hsc_patient_till_now_total", "state_dashboard_patient_count",
            START_DATE, END_DATE, SOURCE, "citizen_portal_live_facility_count",
            "number_of_wards", "number_of_beds", FETCHED_AT
    );

    private HealthColumns() {
    }

    public static boolean isDeclared(String column) {
        return ALL.contains(column);
    }
}
