package com.bhavyahealth.fetcher.service;

import com.bhavyahealth.fetcher.model.EndpointSpec;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static com.bhavyahealth.fetcher.model.EndpointSpec.endpoint;
import static com.bhavyahealth.fetcher.model.FieldMapping.field;
import static com.bhavyahealth.fetcher.model.FieldMapping.nonZeroField;

/**
 * Ordered table of the Bhavya endpoints and the columns each one feeds.
 *
 * Adding or removing a data point is an edit to {@link #BHAVYA_ENDPOINTS}; nothing else
 * in the fetch path knows individual endpoints. A few endpoints (live districts/blocks,
 * first-registration OPD, BCM/DCM) have no column in the report table but are still
 * called so their availability shows up in the per-date counts.
 */
public class EndpointCatalog {

    static final List<EndpointSpec> BHAVYA_ENDPOINTS = List.of(
            endpoint("staff_data", "staff_data", "Staff/HR Data",
                    field("number_of_doctors", "doctor"),
                    field("number_of_nurses", "nurse"),
                    field("number_of_data_entry_operators", "deo"),
                    field("number_of_pharmacists", "pharmacist"),
                    field("number_of_lab_attendents", "lab_attendent"),
                    field("number_of_community_health_officers", "cho_staff")),
            endpoint("unique_patients", "unique_patients", "Unique Patients",
                    field("unique_patients_total", "total_patient")),
            endpoint("opd_patients", "opd_patients", "OPD Patients",
                    field("number_of_patient_opd_patient_visit", "patient_visit")),
            endpoint("male_female_count", "malefemaleCount", "Gender-wise Count",
                    field("number_of_male_patient_visit", "male_patient_visist"),
                    field("number_of_female_patient_visit", "female_patient_visist"),
                    field("number_of_transgender_patient_visit", "transgender_patient_visits")),
            endpoint("patient_journey_time", "patientJourneyTime", "Journey Time",
                    field("patient_journey_time_min", "journey_time_min")),
            endpoint("patient_waiting_time", "patientWaitingTime", "Waiting Time",
                    field("patient_waiting_time_min", "waiting_time_min")),
            endpoint("eaushadhi_facility_count", "eAushadhiFacilityCount", "E-Aushadhi Facilities",
                    field("eaushadhi_facility_count", "count")),
            endpoint("ipd_facility_ward_bed", "IPDFacilityWardBed", "IPD Ward/Bed",
                    field("number_of_wards", "ward_count", "wards"),
                    field("number_of_beds", "bed_count", "beds")),
            endpoint("ipd_patient_admit", "IPDPatientAdmit", "IPD Admissions",
                    field("number_of_ipd_patient_admission", "admission"),
                    field("number_of_ipd_patient_discharge", "discharge"),
                    field("number_of_ipd_patient_surgery", "surgery"),
                    field("number_of_ipd_patient_transfer", "transfer")),
            endpoint("mlc_count", "MLCCount", "MLC Cases",
                    field("medico_legal_cases_count", "count")),
            endpoint("ae_opd_consultation", "getAEOPDConsultation", "A&E OPD",
                    field("accident_emergency_opd_count", "count")),
            endpoint("ae_observation_count", "getAEObservationCount", "A&E Observation",
                    field("accident_emergency_observation_count", "count")),
            endpoint("abdm_data", "getABDMData", "ABDM Data",
                    field("number_of_abdm_cards_linked", "Linked"),
                    field("number_of_abdm_cards_shared", "Shared"),
                    field("number_of_abdm_cards_created", "Created"),
                    field("number_of_abdm_health_facility_registry", "HFR"),
                    field("abdm_healthcare_professionals_registry", "HPR")),
            endpoint("total_district", "getTotalDistrict", "Total Districts",
                    field("total_district", "count")),
            endpoint("total_live_district", "getTotalLiveDistrict", "Live Districts"),
            endpoint("total_block", "getTotalBlock", "Total Blocks",
                    field("total_blocks", "count")),
            endpoint("total_live_block", "getTotalLiveBlock", "Live Blocks"),
            endpoint("hsc_count", "getHSCcount", "HSC Count",
                    field("live_hsc", "live_hsc"),
                    field("total_hsc", "total_hsc")),
            endpoint("hsc_patient_registered", "getHSCPatientRegistered", "HSC Patients Registered",
                    field("hsc_patient_registered_total", "total_patient")),
            endpoint("cho_anm_count", "getCHO_ANMCount", "CHO/ANM Count",
                    nonZeroField("number_of_auxiliary_nurse_midwives", "anm")),
            endpoint("hsc_patient_till_now", "getHSCPatientTillNow", "HSC Patients Till Now",
                    field("hsc_patient_till_now_total", "total_patient")),
            endpoint("patient_visits_count_hsc", "getPatientVisitsCountHSC", "HSC Patient Visits",
                    field("number_of_total_patients_visit", "pateint_visits")),
            endpoint("state_dashboard_patient_count", "getStateDashboardPatientCount", "State Dashboard",
                    field("state_dashboard_patient_count", "patient_count")),
            endpoint("citizen_portal_facility_count", "getCitizenPortalDistrictFacilityCount", "Citizen Portal",
                    field("citizen_portal_live_facility_count", "Total_Live_Facilities"),
                    field("live_facilities", "Total_Live_Facilities")),
            endpoint("patient_first_registration_opd", "getPatientFirstRegistrationOPD", "First Registration OPD"),
            endpoint("facilitator_asha_count", "get_facilitator_and_asha_count", "Facilitator/ASHA",
                    field("facilitator_count", "facilitator_count"),
                    field("asha_count", "asha_count")),
            endpoint("bcm_dcm_count", "get_bcm_and_dcm_count", "BCM/DCM Count"),
            endpoint("dist_block_village_panch_hsc", "get_dist_block_village_panch_hsc_count", "Geographic Data",
                    field("total_villages", "village_counts"),
                    field("total_panchayats", "panchayat_counts")),
            endpoint("asha_household", "getAshaHousehold", "ASHA Household",
                    field("asha_household_count", "household_count")),
            endpoint("asha_beneficiary", "getAshaBeneficiary", "ASHA Beneficiary",
                    field("asha_beneficiary_count", "beneficiary_count")),
            endpoint("asha_eligible_couple", "getAshaEligibleCouple", "Eligible Couples",
                    field("asha_eligible_couple_count", "ec_count")),
            endpoint("asha_pregnant_women", "getAshaPregnant_Women", "Pregnant Women",
                    field("asha_pregnant_women_count", "pw_count")),
            endpoint("total_child_care", "getTotalchildcare", "Child Care",
                    field("total_child_care_count", "child_count")),
            endpoint("delivery_count", "getDeliveryCount", "Delivery Count",
                    field("delivery_count", "delivery_count"))
    );

    private final List<EndpointSpec> endpoints;

    public EndpointCatalog(List<EndpointSpec> endpoints) {
        Set<String> ids = new HashSet<>();
        for (EndpointSpec e : endpoints) {
            if (!ids.add(e.id())) {
                throw new IllegalArgumentException("Duplicate endpoint id: " + e.id());
            }
        }
        this.endpoints = List.copyOf(endpoints);
    }

    public static EndpointCatalog bhavya() {
        return new EndpointCatalog(BHAVYA_ENDPOINTS);
    }

    public List<EndpointSpec> all() {
        return endpoints;
    }

    public int size() {
        return endpoints.size();
    }

    public Optional<EndpointSpec> find(String id) {
        return endpoints.stream().filter(e -> e.id().equals(id)).findFirst();
    }
}
