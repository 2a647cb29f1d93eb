package dev.guardrails.controller;

import dev.guardrails.config.SecurityConfig;
import dev.guardrails.domain.enums.EventState;
import dev.guardrails.domain.valueobject.EventOutcome;
import dev.guardrails.pipeline.EventRouter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.webmvc.test.autoconfigure.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = TriggerController.class, properties = "guardrails.operator.api-key=op-secret")
@Import(SecurityConfig.class)
class TriggerControllerTest {

  @Autowired
  private MockMvc mockMvc;

  @MockitoBean
  private EventRouter eventRouter;

  @Test
  @DisplayName("should reject a trigger without the operator key")
  void shouldRequireOperatorKey() throws Exception {
    mockMvc.perform(post("/trigger/acme/widgets/7"))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.status").value("rejected"));

    verify(eventRouter, never()).trigger(any(), any(), anyInt());
  }

  @Test
  @DisplayName("should reject a trigger with the wrong operator key")
  void shouldRejectWrongKey() throws Exception {
    mockMvc.perform(post("/trigger/acme/widgets/7").header("X-Operator-Api-Key", "guess"))
        .andExpect(status().isUnauthorized());

    verify(eventRouter, never()).trigger(any(), any(), anyInt());
  }

  @Test
  @DisplayName("should run the pull request pipeline and return its outcome")
  void shouldTriggerScan() throws Exception {
    when(eventRouter.trigger("acme", "widgets", 7)).thenReturn(
        new EventOutcome("manual-1", EventState.DEGRADED_PUBLISHED, "pull request #7", 0, true,
            List.of("Analysis backend unavailable after 3 attempt(s)")));

    mockMvc.perform(post("/trigger/acme/widgets/7").header("X-Operator-Api-Key", "op-secret"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("degraded"))
        .andExpect(jsonPath("$.mergeable").value(true))
        .andExpect(jsonPath("$.notes[0]").value("Analysis backend unavailable after 3 attempt(s)"));
  }

  @Test
  @DisplayName("should answer a non-positive pull request number with 400")
  void shouldValidatePullRequestNumber() throws Exception {
    mockMvc.perform(post("/trigger/acme/widgets/0").header("X-Operator-Api-Key", "op-secret"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.title").value("Invalid Request"));
  }

  @Test
  @DisplayName("should deny endpoints that are not exposed")
  void shouldDenyEverythingElse() throws Exception {
    mockMvc.perform(get("/reviews").header("X-Operator-Api-Key", "op-secret"))
        .andExpect(status().isForbidden());
  }
}
