package com.ai.clinic.controller;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.MOCK)
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_EACH_TEST_METHOD)
class ClinicControllerIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() throws Exception {
        create("/api/clinic/doctors", """
                {"id": 1, "name": "Dr. Rao", "specialization": "General"}
                """);
        create("/api/clinic/doctors/1/slots", """
                {"slotId": 101, "startTime": "09:00", "endTime": "09:15"}
                """);
        create("/api/clinic/doctors/1/slots", """
                {"slotId": 102, "startTime": "09:15", "endTime": "09:30"}
                """);
        create("/api/clinic/patients", """
                {"id": 1, "name": "Alice", "age": 30}
                """);
        create("/api/clinic/patients", """
                {"id": 3, "name": "Charlie", "age": 25}
                """);
    }

    private void create(String url, String body) throws Exception {
        mockMvc.perform(postJson(url, body))
                .andExpect(status().isCreated());
    }

    private static MockHttpServletRequestBuilder postJson(String url, String body) {
        return post(url)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body);
    }

    @Test
    void bookThenServe() throws Exception {
        mockMvc.perform(postJson("/api/clinic/bookings", """
                        {"patientId": 1, "doctorId": 1}
                        """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.tokenId").value(1000))
                .andExpect(jsonPath("$.slotId").value(102))
                .andExpect(jsonPath("$.type").value("ROUTINE"));

        mockMvc.perform(get("/api/clinic/reports/doctors"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].pendingBookedSlots").value(1))
                .andExpect(jsonPath("$[0].nextFreeSlotId").value(101));

        mockMvc.perform(post("/api/clinic/serve"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.patientId").value(1));

        mockMvc.perform(post("/api/clinic/serve"))
                .andExpect(status().isNoContent());
    }

    @Test
    void triagePreemptsAndUndoReports() throws Exception {
        mockMvc.perform(postJson("/api/clinic/bookings", """
                        {"patientId": 1, "doctorId": 1}
                        """))
                .andExpect(status().isCreated());
        mockMvc.perform(postJson("/api/clinic/triage", """
                        {"patientId": 3, "severity": 0}
                        """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.type").value("EMERGENCY"))
                .andExpect(jsonPath("$.doctorId").value(-1));

        mockMvc.perform(get("/api/clinic/next"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.patientId").value(3));

        mockMvc.perform(post("/api/clinic/serve"))
                .andExpect(jsonPath("$.patientId").value(3));

        mockMvc.perform(get("/api/clinic/reports/served-vs-pending"))
                .andExpect(jsonPath("$.served").value(1))
                .andExpect(jsonPath("$.pending").value(1));

        mockMvc.perform(post("/api/clinic/undo"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.action").value("SERVE_TRIAGE"))
                .andExpect(jsonPath("$.message").value("Undid serving of triage token 1001"));

        mockMvc.perform(get("/api/clinic/triage"))
                .andExpect(jsonPath("$[0].severity").value(0))
                .andExpect(jsonPath("$[0].token.tokenId").value(1001));
    }

    @Test
    void cancelThenUndo() throws Exception {
        mockMvc.perform(postJson("/api/clinic/bookings", """
                        {"patientId": 1, "doctorId": 1}
                        """))
                .andExpect(status().isCreated());

        mockMvc.perform(delete("/api/clinic/bookings/1000"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cancelled").value(true));
        mockMvc.perform(delete("/api/clinic/bookings/1000"))
                .andExpect(jsonPath("$.cancelled").value(false));

        mockMvc.perform(post("/api/clinic/undo"))
                .andExpect(jsonPath("$.message").value("Undid cancellation: rebooked token 1000"));

        mockMvc.perform(get("/api/clinic/queue"))
                .andExpect(jsonPath("$[0].tokenId").value(1000));
    }

    @Test
    void errorsMapToProblemDetails() throws Exception {
        mockMvc.perform(postJson("/api/clinic/bookings", """
                        {"patientId": 99, "doctorId": 1}
                        """))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("PATIENT_NOT_FOUND"));

        for (int i = 0; i < 2; i++) {
            mockMvc.perform(postJson("/api/clinic/bookings", """
                            {"patientId": 1, "doctorId": 1}
                            """))
                    .andExpect(status().isCreated());
        }
        mockMvc.perform(postJson("/api/clinic/bookings", """
                        {"patientId": 1, "doctorId": 1}
                        """))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorCode").value("NO_FREE_SLOT"));

        mockMvc.perform(postJson("/api/clinic/bookings", """
                        {"doctorId": 1}
                        """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title").value("Validation Error"));
    }

    @Test
    void malformedRequestsAreBadRequests() throws Exception {
        mockMvc.perform(postJson("/api/clinic/triage", """
                        {"patientId": 1, "severity": "high"}
                        """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title").value("Bad Request"));

        mockMvc.perform(postJson("/api/clinic/bookings", "{not json"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(get("/api/clinic/patients/abc"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("Invalid value for 'id': abc"));
    }

    @Test
    void unknownRouteIsNotFound() throws Exception {
        mockMvc.perform(get("/api/clinic/nope"))
                .andExpect(status().isNotFound());
    }

    @Test
    void doctorLookup() throws Exception {
        mockMvc.perform(get("/api/clinic/doctors/1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Dr. Rao"))
                .andExpect(jsonPath("$.specialization").value("General"));
        mockMvc.perform(get("/api/clinic/doctors/2"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("DOCTOR_NOT_FOUND"));
        mockMvc.perform(get("/api/clinic/doctors/1/slots"))
                .andExpect(jsonPath("$[0].id").value(102))
                .andExpect(jsonPath("$[0].status").value("FREE"));
    }

    @Test
    void undoOnFreshClinic() throws Exception {
        mockMvc.perform(post("/api/clinic/undo"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Nothing to undo"));
    }

    @Test
    void patientLifecycle() throws Exception {
        mockMvc.perform(get("/api/clinic/patients/1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Alice"));
        mockMvc.perform(delete("/api/clinic/patients/1"))
                .andExpect(status().isNoContent());
        mockMvc.perform(get("/api/clinic/patients/1"))
                .andExpect(status().isNotFound());
    }
}
