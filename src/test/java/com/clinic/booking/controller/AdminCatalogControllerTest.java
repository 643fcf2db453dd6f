package com.clinic.booking.controller;

import com.clinic.booking.dto.ClinicServiceRequest;
import com.clinic.booking.dto.PatientDetail;
import com.clinic.booking.dto.PatientSummary;
import com.clinic.booking.entity.ClinicService;
import com.clinic.booking.entity.Staff;
import com.clinic.booking.exception.GlobalExceptionHandler;
import com.clinic.booking.exception.ResourceNotFoundException;
import com.clinic.booking.service.ClinicServiceAdminService;
import com.clinic.booking.service.PatientAdminService;
import com.clinic.booking.service.StaffAdminService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.SpringBootConfiguration;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = {AdminServiceController.class, AdminStaffController.class, AdminPatientController.class})
@AutoConfigureMockMvc(addFilters = false)
class AdminCatalogControllerTest {

    @SpringBootConfiguration
    @Import({AdminServiceController.class, AdminStaffController.class, AdminPatientController.class,
            GlobalExceptionHandler.class})
    static class TestApplication {}

    @Autowired
    MockMvc mockMvc;

    @MockBean
    ClinicServiceAdminService serviceAdminService;

    @MockBean
    StaffAdminService staffAdminService;

    @MockBean
    PatientAdminService patientAdminService;

    @Test
    void serviceIsCreated() throws Exception {
        when(serviceAdminService.create(any(ClinicServiceRequest.class))).thenReturn(
                ClinicService.builder().id(5L).name("Cleaning").durationMinutes(45).build());

        mockMvc.perform(post("/api/admin/services")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Cleaning\",\"durationMinutes\":45}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(5))
                .andExpect(jsonPath("$.durationMinutes").value(45));
    }

    @Test
    void zeroDurationNeverReachesTheService() throws Exception {
        mockMvc.perform(post("/api/admin/services")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Cleaning\",\"durationMinutes\":0}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors[0]").value("durationMinutes: durationMinutes must be 1 or more"));
        verify(serviceAdminService, never()).create(any());
    }

    @Test
    void reorderIsNotMistakenForAnId() throws Exception {
        mockMvc.perform(put("/api/admin/services/reorder")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"ids\":[3,1,2]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));
        verify(serviceAdminService).reorder(List.of(3L, 1L, 2L));
        verify(serviceAdminService, never()).update(anyLong(), any());
    }

    @Test
    void bookedServiceDeleteIsABadRequest() throws Exception {
        doThrow(new IllegalArgumentException("This service has appointments and cannot be deleted. Deactivate it instead."))
                .when(serviceAdminService).delete(3L);

        mockMvc.perform(delete("/api/admin/services/3"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value(
                        "This service has appointments and cannot be deleted. Deactivate it instead."));
    }

    @Test
    void staffIsListedAndCreated() throws Exception {
        when(staffAdminService.list()).thenReturn(List.of(Staff.builder().id(1L).name("Tanaka").build()));

        mockMvc.perform(get("/api/admin/staff"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("Tanaka"));

        mockMvc.perform(post("/api/admin/staff")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"Dentist\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors[0]").value("name: name is required"));
    }

    @Test
    void unknownStaffDeleteIsNotFound() throws Exception {
        doThrow(new ResourceNotFoundException("Staff not found: 9")).when(staffAdminService).deactivate(9L);

        mockMvc.perform(delete("/api/admin/staff/9"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Staff not found: 9"));
    }

    @Test
    void patientsAreSearched() throws Exception {
        when(patientAdminService.list("sato")).thenReturn(List.of(new PatientSummary(1L, "Hanako Sato", "hanako",
                "0312345678", null, "2030-05-10T09:00:00+09:00", 2, "2030-05-01T10:00:00+09:00")));

        mockMvc.perform(get("/api/admin/patients").param("search", "sato"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].appointmentCount").value(2))
                .andExpect(jsonPath("$[0].lastVisit").value("2030-05-01T10:00:00+09:00"));
    }

    @Test
    void noteIsAddedAndBlankNoteRejected() throws Exception {
        when(patientAdminService.addNote(eq(1L), anyString()))
                .thenReturn(new PatientDetail.Note(11L, "Prefers mornings", "2030-05-20T09:00:00+09:00"));

        mockMvc.perform(post("/api/admin/patients/1/notes")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"note\":\"Prefers mornings\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(11));

        mockMvc.perform(post("/api/admin/patients/1/notes")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"note\":\"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors[0]").value("note: note is required"));
    }
}
