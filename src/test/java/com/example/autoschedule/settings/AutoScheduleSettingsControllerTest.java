package com.example.autoschedule.settings;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.transaction.annotation.Transactional;

import java.time.DayOfWeek;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@Transactional
class AutoScheduleSettingsControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private AutoScheduleSettingsRepository repository;

    @BeforeEach
    void setUp() {
        repository.deleteAll();
    }

    @Test
    void getSettings_createsDefaultsOnFirstAccess() throws Exception {
        mockMvc.perform(get("/api/users/alice/auto-schedule-settings"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.data.userId").value("alice"))
            .andExpect(jsonPath("$.data.workDays.length()").value(5))
            .andExpect(jsonPath("$.data.workDays[0]").value(1))
            .andExpect(jsonPath("$.data.workDays[4]").value(5))
            .andExpect(jsonPath("$.data.workHourStart").value(9))
            .andExpect(jsonPath("$.data.workHourEnd").value(17))
            .andExpect(jsonPath("$.data.bufferMinutes").value(15))
            .andExpect(jsonPath("$.data.maxConsecutiveHours").value(3))
            .andExpect(jsonPath("$.data.minBreakDuration").value(10))
            .andExpect(jsonPath("$.data.enforceBreaks").value(true));

        assertThat(repository.findByUserId("alice")).isPresent();
    }

    @Test
    void updateSettings_keepsFieldsThatAreNotSent() throws Exception {
        String payload = """
            {
              "workDays": [0, 6],
              "bufferMinutes": 5,
              "highEnergyStart": 8,
              "highEnergyEnd": 11
            }
            """;

        mockMvc.perform(put("/api/users/bob/auto-schedule-settings")
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.workDays[0]").value(0))
            .andExpect(jsonPath("$.data.workDays[1]").value(6))
            .andExpect(jsonPath("$.data.bufferMinutes").value(5))
            .andExpect(jsonPath("$.data.workHourStart").value(9))
            .andExpect(jsonPath("$.data.highEnergyEnd").value(11));

        AutoScheduleSettings saved = repository.findByUserId("bob").orElseThrow();
        assertThat(saved.getWorkDays()).containsExactlyInAnyOrder(DayOfWeek.SUNDAY, DayOfWeek.SATURDAY);
        assertThat(saved.toPolicy().energyWindow(com.example.autoschedule.task.EnergyLevel.HIGH))
            .contains(new EnergyWindow(8, 11));
    }

    @Test
    void updateSettings_rejectsInvertedWorkHours() throws Exception {
        String payload = """
            {
              "workHourStart": 18,
              "workHourEnd": 9
            }
            """;

        mockMvc.perform(put("/api/users/carol/auto-schedule-settings")
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.details.constraint").value("workHours"));

        AutoScheduleSettings stored = repository.findByUserId("carol").orElseThrow();
        assertThat(stored.getWorkHourStart()).isEqualTo(9);
        assertThat(stored.getWorkHourEnd()).isEqualTo(17);
    }

    @Test
    void updateSettings_rejectsOutOfRangeValues() throws Exception {
        String payload = """
            {
              "workHourStart": 25,
              "workDays": [7]
            }
            """;

        mockMvc.perform(put("/api/users/dave/auto-schedule-settings")
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.details.workHourStart").exists());
    }

    @Test
    void updateSettings_rejectsEmptyWorkDays() throws Exception {
        mockMvc.perform(put("/api/users/erin/auto-schedule-settings")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"workDays\": []}"))
            .andExpect(status().isUnprocessableEntity());
    }
}
