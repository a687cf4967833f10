package fr.tictak.pulse.controller;

import fr.tictak.pulse.config.PulseProperties;
import fr.tictak.pulse.config.WebConfig;
import fr.tictak.pulse.dto.out.PatternInsights;
import fr.tictak.pulse.exception.ForbiddenException;
import fr.tictak.pulse.model.NotificationPattern;
import fr.tictak.pulse.security.CustomAccessDeniedHandler;
import fr.tictak.pulse.security.CustomAuthenticationEntryPoint;
import fr.tictak.pulse.security.JwtAuthenticationFilter;
import fr.tictak.pulse.security.JwtUtils;
import fr.tictak.pulse.security.SecurityConfig;
import fr.tictak.pulse.security.SecurityErrorWriter;
import fr.tictak.pulse.service.PatternService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpHeaders;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static fr.tictak.pulse.security.JwtTestTokens.bearer;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = PatternController.class)
@Import({SecurityConfig.class, JwtUtils.class, JwtAuthenticationFilter.class, CustomAuthenticationEntryPoint.class,
        CustomAccessDeniedHandler.class, SecurityErrorWriter.class, WebConfig.class})
@EnableConfigurationProperties(PulseProperties.class)
@DisplayName("PatternController")
class PatternControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private PatternService patternService;

    @Test
    @DisplayName("Should filter patterns by key")
    void shouldListByKey() throws Exception {
        // Given
        NotificationPattern pattern = new NotificationPattern();
        pattern.setId("p-1");
        pattern.setPatternKey("task_due_soon:high");
        pattern.setFrequency(7);
        when(patternService.list("user-1", "task_due_soon:high")).thenReturn(List.of(pattern));

        // When / Then
        mockMvc.perform(get("/api/notification-patterns")
                        .param("patternKey", "task_due_soon:high")
                        .header(HttpHeaders.AUTHORIZATION, bearer("user-1")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].frequency").value(7));
    }

    @Test
    @DisplayName("Should return insights and bound the limit")
    void shouldReturnInsights() throws Exception {
        // Given
        when(patternService.insights("user-1", 3)).thenReturn(new PatternInsights(4, 0.5, List.of(), List.of()));

        // When / Then
        mockMvc.perform(get("/api/notification-patterns/insights/summary")
                        .param("limit", "3")
                        .header(HttpHeaders.AUTHORIZATION, bearer("user-1")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalPatterns").value(4))
                .andExpect(jsonPath("$.averageConfidence").value(0.5));
        mockMvc.perform(get("/api/notification-patterns/insights/summary")
                        .param("limit", "500")
                        .header(HttpHeaders.AUTHORIZATION, bearer("user-1")))
                .andExpect(status().isBadRequest());
        verify(patternService, times(1)).insights(anyString(), anyInt());
    }

    @Test
    @DisplayName("Should refuse to delete another user's pattern")
    void shouldGuardDelete() throws Exception {
        // Given
        doThrow(new ForbiddenException("Pattern belongs to another user")).when(patternService).delete("user-1", "p-9");

        // When / Then
        mockMvc.perform(delete("/api/notification-patterns/p-9").header(HttpHeaders.AUTHORIZATION, bearer("user-1")))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.message").value("Pattern belongs to another user"));
    }
}
