package com.example.autoschedule.breaks;

import com.example.autoschedule.FixedClockConfig;
import com.example.autoschedule.task.Task;
import com.example.autoschedule.task.TaskRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@Import(FixedClockConfig.class)
@Transactional
class BreakControllerTest {

    private static final String USER = "break-user";
    private static final LocalDateTime MONDAY = FixedClockConfig.NOW.toLocalDate().atStartOfDay();

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private TaskRepository taskRepository;

    private Task first;
    private Task second;

    @BeforeEach
    void setUp() {
        taskRepository.deleteAll();
        first = taskRepository.save(scheduled("資料作成", MONDAY.withHour(14), 60));
        second = taskRepository.save(scheduled("レビュー", MONDAY.withHour(15), 60));
    }

    private Task scheduled(String title, LocalDateTime start, int duration) {
        Task task = new Task(USER, title, duration);
        task.setAutoScheduled(true);
        task.setScheduledStart(start);
        task.setScheduledEnd(start.plusMinutes(duration));
        return task;
    }

    @Test
    void validate_reportsBackToBackTasks() throws Exception {
        String payload = "{\"taskIds\": [" + first.getId() + ", " + second.getId() + "]}";

        mockMvc.perform(post("/api/users/" + USER + "/breaks/validate")
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.length()").value(1))
            .andExpect(jsonPath("$.data[0].type").value("insufficient_break"))
            .andExpect(jsonPath("$.data[0].severity").value("high"))
            .andExpect(jsonPath("$.meta.count").value(1));
    }

    @Test
    void validate_returnsNotFoundForUnknownOrForeignTask() throws Exception {
        Task foreign = new Task("someone-else", "他人のタスク", 30);
        foreign = taskRepository.save(foreign);
        String payload = "{\"taskIds\": [" + first.getId() + ", " + foreign.getId() + "]}";

        mockMvc.perform(post("/api/users/" + USER + "/breaks/validate")
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("TASK_NOT_FOUND"));
    }

    @Test
    void validate_requiresTaskIds() throws Exception {
        mockMvc.perform(post("/api/users/" + USER + "/breaks/validate")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"taskIds\": []}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void suggest_returnsShortBreakForDay() throws Exception {
        mockMvc.perform(get("/api/users/" + USER + "/breaks/suggest").param("date", "2025-03-03"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.length()").value(1))
            .andExpect(jsonPath("$.data[0].type").value("short_break"))
            .andExpect(jsonPath("$.data[0].duration").value(10));

        mockMvc.perform(get("/api/users/" + USER + "/breaks/suggest").param("date", "2025-03-04"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.length()").value(0));
    }

    @Test
    void compliance_scoresRecentSchedule() throws Exception {
        mockMvc.perform(get("/api/users/" + USER + "/breaks/compliance"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.score").value(50))
            .andExpect(jsonPath("$.data.days").value(7));
    }

    @Test
    void compliance_rejectsNonPositiveDays() throws Exception {
        mockMvc.perform(get("/api/users/" + USER + "/breaks/compliance").param("days", "0"))
            .andExpect(status().isBadRequest());
    }
}
